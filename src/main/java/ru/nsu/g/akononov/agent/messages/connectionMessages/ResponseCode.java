package ru.nsu.g.akononov.agent.messages.connectionMessages;

import java.util.Map;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toMap;

/**
 * REP codes of a SOCKS5 reply (RFC 1928, section 6).
 */
public enum ResponseCode {
    REQUEST_GRANTED             ((byte) 0x00, "succeeded"),
    GENERAL_FAILURE             ((byte) 0x01, "general SOCKS server failure"),
    CONNECTION_NOT_ALLOWED      ((byte) 0x02, "connection not allowed by ruleset"),
    NETWORK_UNREACHABLE         ((byte) 0x03, "network unreachable"),
    HOST_UNREACHABLE            ((byte) 0x04, "host unreachable"),
    CONNECTION_REFUSED          ((byte) 0x05, "connection refused by destination host"),
    TTL_EXPIRED                 ((byte) 0x06, "TTL expired"),
    CMD_NOT_SUPPORTED           ((byte) 0x07, "command not supported"),
    ADDRESS_TYPE_NOT_SUPPORTED  ((byte) 0x08, "address type not supported");

    private final byte value;
    private final String description;

    private static final Map<Byte, ResponseCode> valuesToCodes = Stream.of(values())
            .collect(toMap(ResponseCode::getValue, e -> e));

    ResponseCode(byte value, String description) {
        this.value = value;
        this.description = description;
    }

    public byte getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public static ResponseCode getByValue(byte value) {
        return valuesToCodes.get(value);
    }

    public static String describe(byte value) {
        ResponseCode code = getByValue(value);
        if (code == null) {
            return String.format("unknown reply code 0x%02x", value);
        }
        return code.getDescription();
    }
}
