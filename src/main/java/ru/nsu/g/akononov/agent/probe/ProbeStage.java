package ru.nsu.g.akononov.agent.probe;

/**
 * Steps of a probe run, in the order they are executed over one connection.
 */
public enum ProbeStage {
    VALIDATE        (null),
    TCP_CONNECT     ("tcp_connect"),
    SOCKS_HANDSHAKE ("socks_handshake"),
    CONNECT         ("connect"),
    UDP_ASSOCIATE   ("udp_associate");

    private final String latencyKey;

    ProbeStage(String latencyKey) {
        this.latencyKey = latencyKey;
    }

    /**
     * @return key in the summary latency map, {@code null} for steps that are not timed
     */
    public String getLatencyKey() {
        return latencyKey;
    }
}
