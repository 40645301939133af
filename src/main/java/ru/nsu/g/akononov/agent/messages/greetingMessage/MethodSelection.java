package ru.nsu.g.akononov.agent.messages.greetingMessage;

import java.io.DataInputStream;
import java.io.IOException;

/**
 * Server answer {VER, METHOD} to a greeting.
 */
public class MethodSelection {
    private final byte socksVersion;
    private final byte method;

    public MethodSelection(byte socksVersion, byte method) {
        this.socksVersion = socksVersion;
        this.method = method;
    }

    public static MethodSelection read(DataInputStream in) throws IOException {
        byte[] reply = new byte[2];
        in.readFully(reply);
        return new MethodSelection(reply[0], reply[1]);
    }

    public byte getSocksVersion() {
        return socksVersion;
    }

    public byte getMethodValue() {
        return method;
    }

    /**
     * @return the selected method, or {@code null} if the byte is not one this client knows
     */
    public AuthMethod getMethod() {
        return AuthMethod.getByValue(method);
    }
}
