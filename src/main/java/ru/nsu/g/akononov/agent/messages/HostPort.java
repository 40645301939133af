package ru.nsu.g.akononov.agent.messages;

import java.util.Objects;

/**
 * Validated "host:port" pair. The host is kept as written (brackets stripped for IPv6 literals),
 * nothing is resolved here.
 */
public final class HostPort {
    public static final int MIN_PORT = 1;
    public static final int MAX_PORT = 65535;

    private final String host;
    private final int port;

    private HostPort(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public static HostPort of(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("empty host");
        }
        if (port < MIN_PORT || port > MAX_PORT) {
            throw new IllegalArgumentException("invalid port \"" + port + "\"");
        }
        return new HostPort(host, port);
    }

    /**
     * Splits {@code hostPort} strictly: the port must be numeric and in range, the host non-empty,
     * and an IPv6 literal must be bracketed ({@code [::1]:1080}).
     *
     * @throws IllegalArgumentException if the value is malformed
     */
    public static HostPort parse(String hostPort) {
        if (hostPort == null) {
            throw new IllegalArgumentException("missing address");
        }

        String host;
        String port;
        if (hostPort.startsWith("[")) {
            int end = hostPort.indexOf(']');
            if (end < 0) {
                throw new IllegalArgumentException("missing ']' in address \"" + hostPort + "\"");
            }
            if (end + 1 >= hostPort.length() || hostPort.charAt(end + 1) != ':') {
                throw new IllegalArgumentException("missing port in address \"" + hostPort + "\"");
            }
            host = hostPort.substring(1, end);
            port = hostPort.substring(end + 2);
        } else {
            int colon = hostPort.lastIndexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("missing port in address \"" + hostPort + "\"");
            }
            host = hostPort.substring(0, colon);
            if (host.indexOf(':') >= 0) {
                throw new IllegalArgumentException("too many colons in address \"" + hostPort + "\"");
            }
            port = hostPort.substring(colon + 1);
        }

        return of(host, parsePort(port));
    }

    /**
     * Decimal port, leading zeros allowed. Stops as soon as the value leaves the port range so
     * long digit runs cannot overflow.
     */
    private static int parsePort(String port) {
        if (port.isEmpty()) {
            throw new IllegalArgumentException("invalid port \"" + port + "\"");
        }
        int value = 0;
        for (int i = 0; i < port.length(); i++) {
            char c = port.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("invalid port \"" + port + "\"");
            }
            value = value * 10 + (c - '0');
            if (value > MAX_PORT) {
                throw new IllegalArgumentException("invalid port \"" + port + "\"");
            }
        }
        return value;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HostPort)) {
            return false;
        }
        HostPort other = (HostPort) o;
        return port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        if (host.indexOf(':') >= 0) {
            return "[" + host + "]:" + port;
        }
        return host + ":" + port;
    }
}
