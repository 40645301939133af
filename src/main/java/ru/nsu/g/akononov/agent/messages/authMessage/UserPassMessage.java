package ru.nsu.g.akononov.agent.messages.authMessage;

import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Username/password sub-negotiation (RFC 1929): {VER, ULEN, UNAME, PLEN, PASSWD}.
 */
public class UserPassMessage {
    public static final byte SUBNEGOTIATION_VERSION = 0x01;
    public static final int MAX_FIELD_LENGTH = 255;

    private static final byte STATUS_SUCCESS = 0x00;

    private final byte[] username;
    private final byte[] password;

    public UserPassMessage(String username, String password) {
        this.username = username.getBytes(StandardCharsets.UTF_8);
        this.password = password.getBytes(StandardCharsets.UTF_8);

        if (this.username.length > MAX_FIELD_LENGTH || this.password.length > MAX_FIELD_LENGTH) {
            throw new IllegalArgumentException("username/password too long (max 255 bytes each)");
        }
    }

    public byte[] toByteRequest() {
        ByteBuffer buffer = ByteBuffer.allocate(3 + username.length + password.length);
        buffer.put(SUBNEGOTIATION_VERSION);
        buffer.put((byte) username.length);
        buffer.put(username);
        buffer.put((byte) password.length);
        buffer.put(password);
        return buffer.array();
    }

    /**
     * Reads the {VER, STATUS} reply.
     *
     * @return {@code true} if the server accepted the credentials
     * @throws IllegalArgumentException if the reply carries an unexpected version
     */
    public static boolean readStatus(DataInputStream in) throws IOException {
        byte[] reply = new byte[2];
        in.readFully(reply);

        if (reply[0] != SUBNEGOTIATION_VERSION) {
            throw new IllegalArgumentException(
                    String.format("unexpected user/pass reply version: 0x%02x", reply[0]));
        }
        return reply[1] == STATUS_SUCCESS;
    }
}
