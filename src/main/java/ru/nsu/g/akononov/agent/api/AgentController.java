package ru.nsu.g.akononov.agent.api;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.nsu.g.akononov.agent.api.ApiRequests.AuthBody;
import ru.nsu.g.akononov.agent.api.ApiRequests.ProbeRequest;
import ru.nsu.g.akononov.agent.api.ApiRequests.StartRequest;
import ru.nsu.g.akononov.agent.api.ApiRequests.StopRequest;
import ru.nsu.g.akononov.agent.api.ApiViews.ApiError;
import ru.nsu.g.akononov.agent.api.ApiViews.ProbeView;
import ru.nsu.g.akononov.agent.api.ApiViews.StatusView;
import ru.nsu.g.akononov.agent.probe.Credentials;
import ru.nsu.g.akononov.agent.probe.ProbeConfig;
import ru.nsu.g.akononov.agent.probe.ProbeResult;
import ru.nsu.g.akononov.agent.probe.SocksProbe;
import ru.nsu.g.akononov.agent.state.AgentStateStore;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local control API. Handlers only check request shapes and delegate to the probe and the state
 * store; every answer is JSON.
 *
 * <pre>
 * GET  /v1/healthz   liveness
 * GET  /v1/status    current state snapshot
 * POST /v1/probe     run a SOCKS5 probe and store its summary
 * POST /v1/start     validated, orchestration not available yet (501)
 * POST /v1/stop      orchestration not available yet (501)
 * </pre>
 */
@RestController
@RequestMapping(ApiOptions.API_PREFIX)
public class AgentController {
    private static final int MIN_MTU = 576;
    private static final int MAX_MTU = 9000;

    @Autowired
    private AgentStateStore state;

    @Autowired
    private SocksProbe probe;

    @Autowired
    private Clock clock;

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> healthz() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", SnapshotMapper.format(clock.instant()));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status")
    public ResponseEntity<StatusView> status() {
        return ResponseEntity.ok(SnapshotMapper.toStatusView(state.getSnapshot(), clock.instant()));
    }

    /**
     * A missing body, or a body of JSON {@code null}, is treated as an empty request.
     */
    @PostMapping("/probe")
    public ResponseEntity<?> probe(@RequestBody(required = false) ProbeRequest request) {
        if (request == null) {
            request = new ProbeRequest();
        }
        if (request.socksServer == null || request.socksServer.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "socks_server is required");
        }
        if (request.timeoutMs < 0) {
            return error(HttpStatus.BAD_REQUEST, "timeout_ms must be >= 0");
        }

        ProbeConfig config = ProbeConfig.builder(request.socksServer)
                .timeout(Duration.ofMillis(request.timeoutMs))
                .credentials(toCredentials(request.auth))
                .connectTarget(request.connectTarget)
                .udpTest(request.udpTest)
                .build();
        ProbeResult result = probe.probe(config);

        // stored whatever the outcome, details stay visible in /v1/status
        state.updateProbe(result.getSummary());

        if (!result.isSuccess()) {
            return error(HttpStatus.BAD_GATEWAY, "probe failed: " + result.getError().get().getMessage());
        }
        ProbeView view = SnapshotMapper.toProbeView(result.getSummary());
        return ResponseEntity.ok(view);
    }

    @PostMapping("/start")
    public ResponseEntity<ApiError> start(@RequestBody(required = false) StartRequest request) {
        if (request == null) {
            request = new StartRequest();
        }
        if (request.socksServer == null || request.socksServer.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "socks_server is required");
        }
        if (request.mtu < 0 || (request.mtu > 0 && (request.mtu < MIN_MTU || request.mtu > MAX_MTU))) {
            return error(HttpStatus.BAD_REQUEST, "mtu must be 0 or between " + MIN_MTU + " and " + MAX_MTU);
        }
        return error(HttpStatus.NOT_IMPLEMENTED, "start not implemented yet");
    }

    @PostMapping("/stop")
    public ResponseEntity<ApiError> stop(@RequestBody StopRequest request) {
        return error(HttpStatus.NOT_IMPLEMENTED, "stop not implemented yet");
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ApiError(message, SnapshotMapper.format(clock.instant())));
    }

    private static Credentials toCredentials(AuthBody auth) {
        if (auth == null) {
            return null;
        }
        String username = auth.username == null ? "" : auth.username;
        String password = auth.password == null ? "" : auth.password;
        if (username.isEmpty() && password.isEmpty()) {
            return null;
        }
        return new Credentials(username, password);
    }
}
