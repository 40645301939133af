package ru.nsu.g.akononov.agent.api;

import ru.nsu.g.akononov.agent.api.ApiViews.FeaturesView;
import ru.nsu.g.akononov.agent.api.ApiViews.ProbeView;
import ru.nsu.g.akononov.agent.api.ApiViews.RoutesView;
import ru.nsu.g.akononov.agent.api.ApiViews.StatusView;
import ru.nsu.g.akononov.agent.api.ApiViews.Tun2SocksView;
import ru.nsu.g.akononov.agent.api.ApiViews.TunView;
import ru.nsu.g.akononov.agent.state.ProbeSummary;
import ru.nsu.g.akononov.agent.state.ProxyFeatures;
import ru.nsu.g.akononov.agent.state.RouteSnapshot;
import ru.nsu.g.akononov.agent.state.Snapshot;
import ru.nsu.g.akononov.agent.state.Tun2SocksSnapshot;
import ru.nsu.g.akononov.agent.state.TunSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Converts state snapshots into API views. Timestamps are RFC 3339 in UTC with second precision,
 * unset times are rendered as empty strings.
 */
public final class SnapshotMapper {

    private SnapshotMapper() {
    }

    public static StatusView toStatusView(Snapshot snapshot, Instant now) {
        StatusView view = new StatusView();
        view.state = snapshot.getAgentState().wireName();
        view.startedAt = format(snapshot.getStartedAt());
        if (snapshot.getStartedAt() != null) {
            view.uptimeSec = Math.max(0, Duration.between(snapshot.getStartedAt(), now).getSeconds());
        }
        view.warnings = new ArrayList<>(snapshot.getWarnings());
        view.tun = toTunView(snapshot.getTun());
        view.routes = toRoutesView(snapshot.getRoutes());
        view.tun2Socks = toTun2SocksView(snapshot.getTun2Socks());
        view.lastProbe = toProbeView(snapshot.getLastProbe());
        view.generatedAt = format(now);
        return view;
    }

    public static ProbeView toProbeView(ProbeSummary summary) {
        ProbeView view = new ProbeView();
        view.reachable = summary.isReachable();
        view.socksOk = summary.isSocksOk();
        view.connectOk = summary.isConnectOk();
        view.udpOk = summary.isUdpOk();
        view.latenciesMs = summary.getLatenciesMs().isEmpty() ? null : new LinkedHashMap<>(summary.getLatenciesMs());

        ProxyFeatures features = summary.getFeatures();
        view.features = new FeaturesView();
        view.features.auth = features.getAuth() == null ? "" : features.getAuth();
        view.features.ipv6 = features.isIpv6();
        view.features.udp = features.isUdp();

        view.lastChecked = format(summary.getLastChecked());
        view.warnings = new ArrayList<>(summary.getWarnings());
        return view;
    }

    private static TunView toTunView(TunSnapshot tun) {
        TunView view = new TunView();
        view.name = nullToEmpty(tun.getName());
        view.up = tun.isUp();
        view.mtu = tun.getMtu();
        view.localIp = nullToEmpty(tun.getLocalIp());
        view.peerIp = nullToEmpty(tun.getPeerIp());
        return view;
    }

    private static RoutesView toRoutesView(RouteSnapshot routes) {
        RoutesView view = new RoutesView();
        view.defaultVia = nullToEmpty(routes.getDefaultVia());
        view.lanCidrs = new ArrayList<>(routes.getLanCidrs());
        view.bypassHosts = new ArrayList<>(routes.getBypassHosts());
        view.proxyHostRoute = routes.isProxyHostRoute();
        view.originalGateway = nullToEmpty(routes.getOriginalGateway());
        return view;
    }

    private static Tun2SocksView toTun2SocksView(Tun2SocksSnapshot tun2Socks) {
        Tun2SocksView view = new Tun2SocksView();
        view.pid = tun2Socks.getPid();
        view.uptimeSec = tun2Socks.getUptimeSec();
        view.tcpOk = tun2Socks.isTcpOk();
        view.udpOk = tun2Socks.isUdpOk();
        return view;
    }

    static String format(Instant instant) {
        if (instant == null) {
            return "";
        }
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
