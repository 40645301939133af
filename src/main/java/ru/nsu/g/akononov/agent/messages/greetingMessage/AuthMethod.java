package ru.nsu.g.akononov.agent.messages.greetingMessage;

import java.util.Map;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toMap;

public enum AuthMethod {
    NO_AUTHENTICATION       ((byte) 0x00, "none"),
    GSSAPI                  ((byte) 0x01, "gssapi"),
    USERNAME_PASSWORD       ((byte) 0x02, "userpass"),
    NO_ACCEPTABLE_METHOD    ((byte) 0xFF, null);

    private final byte value;
    private final String featureName;

    private static final Map<Byte, AuthMethod> valuesToMethods = Stream.of(values())
            .collect(toMap(AuthMethod::getValue, e -> e));

    AuthMethod(byte value, String featureName) {
        this.value = value;
        this.featureName = featureName;
    }

    public byte getValue() {
        return value;
    }

    /**
     * Name reported in probe features, {@code null} for the rejection marker.
     */
    public String getFeatureName() {
        return featureName;
    }

    public static AuthMethod getByValue(byte value) {
        return valuesToMethods.get(value);
    }
}
