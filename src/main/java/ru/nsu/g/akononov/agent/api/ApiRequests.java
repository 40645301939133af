package ru.nsu.g.akononov.agent.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON request bodies accepted by the control API.
 */
public final class ApiRequests {

    private ApiRequests() {
    }

    public static final class AuthBody {
        @JsonProperty("username")
        public String username;
        @JsonProperty("password")
        public String password;

        @Override
        public String toString() {
            return "AuthBody{username='" + username + "', password=****}";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ProbeRequest {
        @JsonProperty("socks_server")
        public String socksServer;
        @JsonProperty("timeout_ms")
        public long timeoutMs;
        @JsonProperty("auth")
        public AuthBody auth;
        @JsonProperty("connect_target")
        public String connectTarget;
        @JsonProperty("udp_test")
        public boolean udpTest;
    }

    public static final class StartRequest {
        @JsonProperty("socks_server")
        public String socksServer;
        @JsonProperty("auth")
        public AuthBody auth;
        @JsonProperty("mtu")
        public int mtu;
    }

    public static final class StopRequest {
    }
}
