package ru.nsu.g.akononov.agent.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one SOCKS5 probe run. Filled in step by step by the probe, so it is mutable;
 * the state store only ever keeps and hands out {@link #copy() copies}.
 */
public class ProbeSummary {
    private boolean reachable;
    private boolean socksOk;
    private boolean connectOk;
    private boolean udpOk;
    private final Map<String, Long> latenciesMs = new LinkedHashMap<>();
    private ProxyFeatures features = new ProxyFeatures();
    private final List<String> warnings = new ArrayList<>();
    private Instant lastChecked;

    public ProbeSummary copy() {
        ProbeSummary copy = new ProbeSummary();
        copy.reachable = reachable;
        copy.socksOk = socksOk;
        copy.connectOk = connectOk;
        copy.udpOk = udpOk;
        copy.latenciesMs.putAll(latenciesMs);
        copy.features = features.copy();
        copy.warnings.addAll(warnings);
        copy.lastChecked = lastChecked;
        return copy;
    }

    public boolean isReachable() {
        return reachable;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public boolean isSocksOk() {
        return socksOk;
    }

    public void setSocksOk(boolean socksOk) {
        this.socksOk = socksOk;
    }

    public boolean isConnectOk() {
        return connectOk;
    }

    public void setConnectOk(boolean connectOk) {
        this.connectOk = connectOk;
    }

    public boolean isUdpOk() {
        return udpOk;
    }

    public void setUdpOk(boolean udpOk) {
        this.udpOk = udpOk;
    }

    public Map<String, Long> getLatenciesMs() {
        return latenciesMs;
    }

    public void putLatency(String step, long millis) {
        latenciesMs.put(step, Math.max(0, millis));
    }

    public ProxyFeatures getFeatures() {
        return features;
    }

    public void setFeatures(ProxyFeatures features) {
        this.features = features == null ? new ProxyFeatures() : features;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /**
     * @return completion time of the run, {@code null} if no probe has been recorded
     */
    public Instant getLastChecked() {
        return lastChecked;
    }

    public void setLastChecked(Instant lastChecked) {
        this.lastChecked = lastChecked;
    }
}
