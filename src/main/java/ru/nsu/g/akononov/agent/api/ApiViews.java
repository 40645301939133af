package ru.nsu.g.akononov.agent.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON payloads returned by the control API. They are kept apart from the state types so the
 * wire format stays stable while the internals change.
 */
public final class ApiViews {

    private ApiViews() {
    }

    public static final class StatusView {
        @JsonProperty("state")
        public String state;
        @JsonProperty("started_at")
        public String startedAt;
        @JsonProperty("uptime_sec")
        public long uptimeSec;
        @JsonProperty("warnings")
        public List<String> warnings;
        @JsonProperty("tun")
        public TunView tun;
        @JsonProperty("routes")
        public RoutesView routes;
        @JsonProperty("tun2socks")
        public Tun2SocksView tun2Socks;
        @JsonProperty("last_probe")
        public ProbeView lastProbe;
        @JsonProperty("generated_at")
        public String generatedAt;
    }

    public static final class TunView {
        @JsonProperty("name")
        public String name;
        @JsonProperty("up")
        public boolean up;
        @JsonProperty("mtu")
        public int mtu;
        @JsonProperty("local_ip")
        public String localIp;
        @JsonProperty("peer_ip")
        public String peerIp;
    }

    public static final class RoutesView {
        @JsonProperty("default_via")
        public String defaultVia;
        @JsonProperty("lan_cidrs")
        public List<String> lanCidrs;
        @JsonProperty("bypass_hosts")
        public List<String> bypassHosts;
        @JsonProperty("proxy_host_route")
        public boolean proxyHostRoute;
        @JsonProperty("original_gateway")
        public String originalGateway;
    }

    public static final class Tun2SocksView {
        @JsonProperty("pid")
        public int pid;
        @JsonProperty("uptime_sec")
        public long uptimeSec;
        @JsonProperty("tcp_ok")
        public boolean tcpOk;
        @JsonProperty("udp_ok")
        public boolean udpOk;
    }

    public static final class ProbeView {
        @JsonProperty("reachable")
        public boolean reachable;
        @JsonProperty("socks_ok")
        public boolean socksOk;
        @JsonProperty("connect_ok")
        public boolean connectOk;
        @JsonProperty("udp_ok")
        public boolean udpOk;
        @JsonProperty("latencies_ms")
        public Map<String, Long> latenciesMs;
        @JsonProperty("features")
        public FeaturesView features;
        @JsonProperty("last_checked")
        public String lastChecked;
        @JsonProperty("warnings")
        public List<String> warnings;
    }

    public static final class FeaturesView {
        @JsonProperty("auth")
        public String auth;
        @JsonProperty("ipv6")
        public boolean ipv6;
        @JsonProperty("udp")
        public boolean udp;
    }

    public static final class ApiError {
        @JsonProperty("error")
        public String error;
        @JsonProperty("timestamp")
        public String timestamp;

        public ApiError() {
        }

        public ApiError(String error, String timestamp) {
            this.error = error;
            this.timestamp = timestamp;
        }
    }
}
