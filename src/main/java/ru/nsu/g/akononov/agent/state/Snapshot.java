package ru.nsu.g.akononov.agent.state;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of the daemon state. Everything reachable from a snapshot belongs to the
 * caller; changing it affects neither the store nor other snapshots.
 */
public final class Snapshot {
    private final AgentState agentState;
    private final Instant startedAt;
    private final List<String> warnings;
    private final TunSnapshot tun;
    private final RouteSnapshot routes;
    private final Tun2SocksSnapshot tun2Socks;
    private final ProbeSummary lastProbe;

    Snapshot(AgentState agentState, Instant startedAt, List<String> warnings, TunSnapshot tun,
             RouteSnapshot routes, Tun2SocksSnapshot tun2Socks, ProbeSummary lastProbe) {
        this.agentState = agentState;
        this.startedAt = startedAt;
        this.warnings = warnings;
        this.tun = tun;
        this.routes = routes;
        this.tun2Socks = tun2Socks;
        this.lastProbe = lastProbe;
    }

    public AgentState getAgentState() {
        return agentState;
    }

    /**
     * @return time of the first activation in this run, {@code null} if never started
     */
    public Instant getStartedAt() {
        return startedAt;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public TunSnapshot getTun() {
        return tun;
    }

    public RouteSnapshot getRoutes() {
        return routes;
    }

    public Tun2SocksSnapshot getTun2Socks() {
        return tun2Socks;
    }

    public ProbeSummary getLastProbe() {
        return lastProbe;
    }
}
