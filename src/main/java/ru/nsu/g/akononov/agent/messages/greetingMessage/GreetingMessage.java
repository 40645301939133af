package ru.nsu.g.akononov.agent.messages.greetingMessage;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Client greeting {VER, NMETHODS, METHODS...}. Methods are written in the order they were offered.
 */
public class GreetingMessage {
    private final byte socksVersion;
    private final Set<AuthMethod> authMethods = new LinkedHashSet<>();

    public GreetingMessage(byte socksVersion, AuthMethod... authMethods) {
        if (authMethods.length == 0) {
            throw new IllegalArgumentException("at least one auth method must be offered");
        }
        this.socksVersion = socksVersion;
        Collections.addAll(this.authMethods, authMethods);
    }

    public byte[] toByteRequest() {
        byte[] byteArray = new byte[2 + authMethods.size()];
        byteArray[0] = socksVersion;
        byteArray[1] = (byte) authMethods.size();

        int i = 2;
        for (AuthMethod authMethod : authMethods) {
            byteArray[i++] = authMethod.getValue();
        }
        return byteArray;
    }

    public byte getSocksVersion() {
        return socksVersion;
    }

    public boolean hasAuthMethod(AuthMethod method) {
        return authMethods.contains(method);
    }
}
