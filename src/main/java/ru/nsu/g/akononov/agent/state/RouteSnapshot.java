package ru.nsu.g.akononov.agent.state;

import java.util.List;

/**
 * Routing decisions of the daemon. {@code originalGateway} is the default gateway seen before
 * the swap and is what gets restored. List fields are copied on construction and read-only.
 */
public final class RouteSnapshot {
    public static final RouteSnapshot EMPTY = new RouteSnapshot("", List.of(), List.of(), false, "");

    private final String defaultVia;
    private final List<String> lanCidrs;
    private final List<String> bypassHosts;
    private final boolean proxyHostRoute;
    private final String originalGateway;

    public RouteSnapshot(String defaultVia, List<String> lanCidrs, List<String> bypassHosts,
                         boolean proxyHostRoute, String originalGateway) {
        this.defaultVia = defaultVia;
        this.lanCidrs = lanCidrs == null ? List.of() : List.copyOf(lanCidrs);
        this.bypassHosts = bypassHosts == null ? List.of() : List.copyOf(bypassHosts);
        this.proxyHostRoute = proxyHostRoute;
        this.originalGateway = originalGateway;
    }

    public String getDefaultVia() {
        return defaultVia;
    }

    public List<String> getLanCidrs() {
        return lanCidrs;
    }

    public List<String> getBypassHosts() {
        return bypassHosts;
    }

    public boolean isProxyHostRoute() {
        return proxyHostRoute;
    }

    public String getOriginalGateway() {
        return originalGateway;
    }
}
