package ru.nsu.g.akononov.agent.messages.connectionMessages;

import java.util.Map;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toMap;

public enum RequestCode {
    ESTABLISH_STREAM_CONNECTION ((byte) 0x01, "CONNECT"),
    ESTABLISH_PORT_BINDING      ((byte) 0x02, "BIND"),
    ASSOCIATE_UDP_PORT          ((byte) 0x03, "UDP ASSOCIATE");

    private final byte value;
    private final String commandName;

    private static final Map<Byte, RequestCode> valuesToCommands = Stream.of(values())
            .collect(toMap(RequestCode::getValue, e -> e));

    public static RequestCode getByValue(byte value) {
        return valuesToCommands.get(value);
    }

    RequestCode(byte value, String commandName) {
        this.value = value;
        this.commandName = commandName;
    }

    public byte getValue() {
        return value;
    }

    public String getCommandName() {
        return commandName;
    }
}
