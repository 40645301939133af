package ru.nsu.g.akononov.agent.messages.connectionMessages;

import ru.nsu.g.akononov.agent.messages.HostPort;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Client request {VER, CMD, RSV, ATYP, DST.ADDR, DST.PORT}.
 */
public class ConnectionMsg {
    private static final byte RESERVED = (byte) 0x00;
    private static final String UNSPECIFIED_IPV4 = "0.0.0.0";

    private final byte socksVersion;
    private final RequestCode requestCommand;
    private final AddressType addressType;
    private final byte[] address;
    private final String domain;
    private final int port;

    public ConnectionMsg(byte socksVersion, RequestCode requestCommand, HostPort target) {
        this(socksVersion, requestCommand, target.getHost(), target.getPort());
    }

    private ConnectionMsg(byte socksVersion, RequestCode requestCommand, String host, int port) {
        this.socksVersion = socksVersion;
        this.requestCommand = requestCommand;
        this.addressType = AddressType.of(host);
        this.port = port;

        if (addressType == AddressType.DOMAIN_NAME) {
            int length = host.getBytes(StandardCharsets.UTF_8).length;
            if (length < 1 || length > AddressType.MAX_DOMAIN_LENGTH) {
                throw new IllegalArgumentException("invalid domain length: " + length);
            }
            this.domain = host;
            this.address = null;
        } else {
            this.domain = null;
            this.address = AddressType.toLiteralBytes(host);
        }
    }

    /**
     * UDP ASSOCIATE with the all-zero IPv4 address and port, meaning the client does not know
     * yet where its datagrams will come from.
     */
    public static ConnectionMsg udpAssociatePlaceholder(byte socksVersion) {
        return new ConnectionMsg(socksVersion, RequestCode.ASSOCIATE_UDP_PORT, UNSPECIFIED_IPV4, 0);
    }

    public byte[] toByteRequest() {
        int size = addressType.getSize(domain) + 6;
        ByteBuffer buffer = ByteBuffer.allocate(size);

        buffer.put(socksVersion);
        buffer.put(requestCommand.getValue());
        buffer.put(RESERVED);
        buffer.put(addressType.getValue());

        if (addressType == AddressType.DOMAIN_NAME) {
            byte[] name = domain.getBytes(StandardCharsets.UTF_8);
            buffer.put((byte) name.length);
            buffer.put(name);
        } else {
            buffer.put(address);
        }

        buffer.putShort((short) port);
        return buffer.array();
    }

    public byte getSocksVersion() {
        return socksVersion;
    }

    public RequestCode getRequestCommand() {
        return requestCommand;
    }

    public AddressType getAddressType() {
        return addressType;
    }

    public byte[] getAddress() {
        return address == null ? null : address.clone();
    }

    public String getDomain() {
        return domain;
    }

    public int getPort() {
        return port;
    }
}
