package ru.nsu.g.akononov.agent.messages.connectionMessages;

import java.io.DataInputStream;
import java.io.IOException;

/**
 * Fixed part {VER, REP, RSV, ATYP} of a server reply. BND.ADDR and BND.PORT follow on the wire
 * and are consumed by {@link #discardBoundAddress(DataInputStream)}.
 */
public class ConnectionReply {
    private static final int PORT_SIZE = 2;

    private final byte socksVersion;
    private final byte replyCode;
    private final byte addressType;

    public ConnectionReply(byte socksVersion, byte replyCode, byte addressType) {
        this.socksVersion = socksVersion;
        this.replyCode = replyCode;
        this.addressType = addressType;
    }

    public static ConnectionReply readHeader(DataInputStream in) throws IOException {
        byte[] header = new byte[4];
        in.readFully(header);
        return new ConnectionReply(header[0], header[1], header[3]);
    }

    /**
     * Skips BND.ADDR and BND.PORT so the stream is positioned at the next reply.
     *
     * @throws IllegalArgumentException on an unknown ATYP or an empty domain
     */
    public void discardBoundAddress(DataInputStream in) throws IOException {
        AddressType type = AddressType.getByValue(addressType);

        int size;
        if (type == AddressType.DOMAIN_NAME) {
            int length = in.readUnsignedByte();
            if (length == 0) {
                throw new IllegalArgumentException("invalid domain length in reply");
            }
            size = length;
        } else {
            size = type.getSize(null);
        }
        in.readFully(new byte[size + PORT_SIZE]);
    }

    public byte getSocksVersion() {
        return socksVersion;
    }

    public byte getReplyCode() {
        return replyCode;
    }

    public byte getAddressType() {
        return addressType;
    }

    public boolean isGranted() {
        return replyCode == ResponseCode.REQUEST_GRANTED.getValue();
    }

    public String describeReply() {
        return ResponseCode.describe(replyCode);
    }
}
