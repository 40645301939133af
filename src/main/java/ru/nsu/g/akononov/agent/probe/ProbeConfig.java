package ru.nsu.g.akononov.agent.probe;

import java.time.Duration;

/**
 * Parameters of one probe run.
 */
public final class ProbeConfig {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);
    public static final String DEFAULT_CONNECT_TARGET = "example.com:80";

    private final String server;
    private final Duration timeout;
    private final Credentials credentials;
    private final String connectTarget;
    private final boolean udpTest;

    private ProbeConfig(Builder b) {
        this.server = b.server;
        this.timeout = b.timeout;
        this.credentials = b.credentials;
        this.connectTarget = b.connectTarget;
        this.udpTest = b.udpTest;
    }

    public String getServer() {
        return server;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Timeout for the whole run; unset, zero and negative values fall back to {@link #DEFAULT_TIMEOUT}.
     */
    public Duration getEffectiveTimeout() {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return DEFAULT_TIMEOUT;
        }
        return timeout;
    }

    /**
     * @return credentials, or {@code null} when only "no auth" should be offered
     */
    public Credentials getCredentials() {
        return credentials;
    }

    public String getConnectTarget() {
        return connectTarget;
    }

    public String getEffectiveConnectTarget() {
        if (connectTarget == null || connectTarget.isBlank()) {
            return DEFAULT_CONNECT_TARGET;
        }
        return connectTarget;
    }

    public boolean isUdpTest() {
        return udpTest;
    }

    public static Builder builder(String server) {
        return new Builder(server);
    }

    public static final class Builder {
        private final String server;
        private Duration timeout;
        private Credentials credentials;
        private String connectTarget;
        private boolean udpTest;

        private Builder(String server) {
            this.server = server;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder connectTarget(String connectTarget) {
            this.connectTarget = connectTarget;
            return this;
        }

        public Builder udpTest(boolean udpTest) {
            this.udpTest = udpTest;
            return this;
        }

        public ProbeConfig build() {
            return new ProbeConfig(this);
        }
    }
}
