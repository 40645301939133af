package ru.nsu.g.akononov.agent.messages.connectionMessages;

import org.xbill.DNS.Address;

import java.nio.charset.StandardCharsets;

public enum AddressType {
    IPV4_ADDRESS    ((byte) 0x01),
    DOMAIN_NAME     ((byte) 0x03),
    IPV6_ADDRESS    ((byte) 0x04);

    public static final int MAX_DOMAIN_LENGTH = 255;

    private final byte value;

    AddressType(byte value) {
        this.value = value;
    }

    public byte getValue() {
        return value;
    }

    public int getSize(String domain) {
        switch (this) {
            case IPV4_ADDRESS:
                return 4;
            case IPV6_ADDRESS:
                return 16;
            case DOMAIN_NAME:
                if (domain == null) {
                    throw new IllegalArgumentException();
                }
                return domain.getBytes(StandardCharsets.UTF_8).length + 1;
            default:
                throw new UnsupportedOperationException();
        }
    }

    /**
     * Classifies a host by its literal form only; names are never resolved.
     */
    public static AddressType of(String host) {
        if (Address.toByteArray(host, Address.IPv4) != null) {
            return IPV4_ADDRESS;
        }
        byte[] v6 = Address.toByteArray(host, Address.IPv6);
        if (v6 != null) {
            return isIpv4Mapped(v6) ? IPV4_ADDRESS : IPV6_ADDRESS;
        }
        return DOMAIN_NAME;
    }

    /**
     * Raw address bytes for an IP literal, 4 bytes for IPv4 (including IPv4-mapped IPv6) and 16 for IPv6.
     */
    public static byte[] toLiteralBytes(String host) {
        byte[] v4 = Address.toByteArray(host, Address.IPv4);
        if (v4 != null) {
            return v4;
        }
        byte[] v6 = Address.toByteArray(host, Address.IPv6);
        if (v6 == null) {
            throw new IllegalArgumentException("not an IP literal: " + host);
        }
        if (isIpv4Mapped(v6)) {
            byte[] mapped = new byte[4];
            System.arraycopy(v6, 12, mapped, 0, 4);
            return mapped;
        }
        return v6;
    }

    private static boolean isIpv4Mapped(byte[] v6) {
        for (int i = 0; i < 10; i++) {
            if (v6[i] != 0) {
                return false;
            }
        }
        return v6[10] == (byte) 0xFF && v6[11] == (byte) 0xFF;
    }

    public static AddressType getByValue(byte value) {
        for (AddressType type : values()) {
            if (type.getValue() == value) {
                return type;
            }
        }

        throw new IllegalArgumentException(String.format("unknown reply ATYP: 0x%02x", value));
    }
}
