package ru.nsu.g.akononov.agent.api;

import ru.nsu.g.akononov.agent.messages.HostPort;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the local control API.
 */
public final class ApiOptions {
    public static final String API_PREFIX = "/v1";
    public static final String DEFAULT_ADDRESS = "127.0.0.1:8787";
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String host;
    private final int port;
    private final Duration shutdownTimeout;

    private ApiOptions(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.shutdownTimeout = b.shutdownTimeout;
    }

    public String getHost() {
        return host;
    }

    /**
     * @return listen port, 0 means any free port
     */
    public int getPort() {
        return port;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Server settings for the embedded web server: listen address, graceful shutdown and its
     * grace period.
     */
    public Map<String, Object> toProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("server.address", host);
        properties.put("server.port", String.valueOf(port));
        properties.put("server.shutdown", "graceful");
        properties.put("spring.lifecycle.timeout-per-shutdown-phase", shutdownTimeout.toMillis() + "ms");
        return properties;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        private Builder() {
            address(DEFAULT_ADDRESS);
        }

        /**
         * @param address listen address in "host:port" form
         * @throws IllegalArgumentException if the address is malformed
         */
        public Builder address(String address) {
            HostPort hostPort = HostPort.parse(address);
            this.host = hostPort.getHost();
            this.port = hostPort.getPort();
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ApiOptions build() {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be blank.");
            }
            if (port < 0 || port > HostPort.MAX_PORT) {
                throw new IllegalArgumentException("port must be between 0 and 65535.");
            }
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must not be negative.");
            }
            return new ApiOptions(this);
        }
    }
}
