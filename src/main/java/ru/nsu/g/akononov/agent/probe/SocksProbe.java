package ru.nsu.g.akononov.agent.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nsu.g.akononov.agent.dnsResolver.DnsResolver;
import ru.nsu.g.akononov.agent.messages.HostPort;
import ru.nsu.g.akononov.agent.messages.authMessage.UserPassMessage;
import ru.nsu.g.akononov.agent.messages.connectionMessages.AddressType;
import ru.nsu.g.akononov.agent.messages.connectionMessages.ConnectionMsg;
import ru.nsu.g.akononov.agent.messages.connectionMessages.ConnectionReply;
import ru.nsu.g.akononov.agent.messages.connectionMessages.RequestCode;
import ru.nsu.g.akononov.agent.messages.greetingMessage.AuthMethod;
import ru.nsu.g.akononov.agent.messages.greetingMessage.GreetingMessage;
import ru.nsu.g.akononov.agent.messages.greetingMessage.MethodSelection;
import ru.nsu.g.akononov.agent.state.ProbeSummary;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static ru.nsu.g.akononov.agent.probe.ProbeException.Kind.INPUT;
import static ru.nsu.g.akononov.agent.probe.ProbeException.Kind.PROTOCOL;
import static ru.nsu.g.akononov.agent.probe.ProbeException.Kind.TRANSPORT;

/**
 * Checks an upstream SOCKS5 proxy over a single TCP connection:
 * TCP connect, greeting (with optional RFC 1929 auth), CONNECT and, on request, UDP ASSOCIATE.
 *
 * <p>A run is synchronous and bounded by one deadline, applied through the {@link ProbeContext}
 * and through the socket timeouts; resolving the proxy's host name counts against it too.
 * Nothing is retried. Every run yields a populated
 * {@link ProbeSummary}; a failed step only stops the steps after it.</p>
 *
 * <p>Instances hold no mutable state and may be shared between threads.</p>
 */
public class SocksProbe {
    private static final Logger logger = LoggerFactory.getLogger(SocksProbe.class.getSimpleName());

    private static final byte SOCKS_VERSION = 0x05;

    private final Clock clock;
    private final DnsResolver dnsResolver;

    public SocksProbe() {
        this(Clock.systemUTC());
    }

    public SocksProbe(Clock clock) {
        this(clock, new DnsResolver());
    }

    public SocksProbe(Clock clock, DnsResolver dnsResolver) {
        this.clock = clock;
        this.dnsResolver = dnsResolver;
    }

    public ProbeResult probe(ProbeConfig config) {
        try (ProbeContext context = ProbeContext.background()) {
            return probe(context, config);
        }
    }

    public ProbeResult probe(ProbeContext context, ProbeConfig config) {
        ProbeSummary summary = new ProbeSummary();
        ProbeException failure = run(context, config, summary);
        summary.setLastChecked(clock.instant());

        if (failure != null) {
            logger.warn("Probe of {} failed at {}: {}", config.getServer(), failure.getStage(), failure.getMessage());
        } else {
            logger.info("Probe of {} succeeded, latencies {}", config.getServer(), summary.getLatenciesMs());
        }
        return new ProbeResult(summary, failure);
    }

    private ProbeException run(ProbeContext context, ProbeConfig config, ProbeSummary summary) {
        HostPort server;
        ConnectionMsg connectRequest;
        UserPassMessage userPass = null;
        try {
            server = HostPort.parse(config.getServer());
        } catch (IllegalArgumentException e) {
            return new ProbeException(INPUT, ProbeStage.VALIDATE, "invalid socks server: " + e.getMessage(), e);
        }
        try {
            HostPort target = HostPort.parse(config.getEffectiveConnectTarget());
            connectRequest = new ConnectionMsg(SOCKS_VERSION, RequestCode.ESTABLISH_STREAM_CONNECTION, target);
        } catch (IllegalArgumentException e) {
            return new ProbeException(INPUT, ProbeStage.VALIDATE, "invalid connect target: " + e.getMessage(), e);
        }
        if (config.getCredentials() != null) {
            try {
                userPass = new UserPassMessage(config.getCredentials().getUsername(),
                        config.getCredentials().getPassword());
            } catch (IllegalArgumentException e) {
                return new ProbeException(INPUT, ProbeStage.VALIDATE, "invalid credentials: " + e.getMessage(), e);
            }
        }

        try (ProbeContext runContext = context.withTimeout(config.getEffectiveTimeout())) {
            Socket socket = new Socket();
            runContext.attach(socket);
            try {
                return exchange(runContext, socket, server, connectRequest, userPass, config.isUdpTest(), summary);
            } finally {
                runContext.detach(socket);
                closeSocket(socket);
            }
        }
    }

    private ProbeException exchange(ProbeContext context, Socket socket, HostPort server, ConnectionMsg connectRequest,
                                    UserPassMessage userPass, boolean udpTest, ProbeSummary summary) {
        long start = System.nanoTime();
        StepResult<Void> tcp = connect(context, socket, server);
        recordLatency(summary, ProbeStage.TCP_CONNECT, start);
        if (tcp.isFailed()) {
            summary.addWarning(tcp.getFailure().getMessage());
            return tcp.getFailure();
        }
        summary.setReachable(true);

        DataInputStream in;
        OutputStream out;
        try {
            in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            out = socket.getOutputStream();
        } catch (IOException e) {
            ProbeException failure = transport(context, ProbeStage.TCP_CONNECT, "tcp connect failed", e);
            summary.addWarning(failure.getMessage());
            return failure;
        }

        start = System.nanoTime();
        StepResult<AuthMethod> handshake = negotiate(context, socket, in, out, userPass);
        recordLatency(summary, ProbeStage.SOCKS_HANDSHAKE, start);
        if (handshake.isFailed()) {
            summary.addWarning(handshake.getFailure().getMessage());
            return handshake.getFailure();
        }
        summary.setSocksOk(true);
        summary.getFeatures().setAuth(handshake.getValue().getFeatureName());

        start = System.nanoTime();
        StepResult<Void> connect = request(context, socket, in, out, connectRequest, ProbeStage.CONNECT, "connect failed");
        recordLatency(summary, ProbeStage.CONNECT, start);
        if (connect.isFailed()) {
            summary.addWarning(connect.getFailure().getMessage());
            return connect.getFailure();
        }
        summary.setConnectOk(true);
        summary.getFeatures().setIpv6(connectRequest.getAddressType() == AddressType.IPV6_ADDRESS);

        if (udpTest) {
            start = System.nanoTime();
            StepResult<Void> udp = request(context, socket, in, out,
                    ConnectionMsg.udpAssociatePlaceholder(SOCKS_VERSION), ProbeStage.UDP_ASSOCIATE, "udp associate failed");
            recordLatency(summary, ProbeStage.UDP_ASSOCIATE, start);
            if (udp.isFailed()) {
                // best effort, the probe itself still succeeds
                summary.addWarning(udp.getFailure().getMessage());
            } else {
                summary.setUdpOk(true);
            }
        }
        return null;
    }

    private StepResult<Void> connect(ProbeContext context, Socket socket, HostPort server) {
        try {
            InetAddress address = dnsResolver.resolve(context, server.getHost());
            socket.connect(new InetSocketAddress(address, server.getPort()), context.nextTimeoutMillis());
            logger.debug("Connected to {}", socket.getRemoteSocketAddress());
            return StepResult.ok(null);
        } catch (IOException e) {
            return StepResult.failed(transport(context, ProbeStage.TCP_CONNECT, "tcp connect failed", e));
        }
    }

    private StepResult<AuthMethod> negotiate(ProbeContext context, Socket socket, DataInputStream in,
                                             OutputStream out, UserPassMessage userPass) {
        String prefix = "socks handshake failed";
        GreetingMessage greeting = userPass == null
                ? new GreetingMessage(SOCKS_VERSION, AuthMethod.NO_AUTHENTICATION)
                : new GreetingMessage(SOCKS_VERSION, AuthMethod.NO_AUTHENTICATION, AuthMethod.USERNAME_PASSWORD);

        String action = "write greeting";
        try {
            send(context, socket, out, greeting.toByteRequest());

            action = "read method selection";
            socket.setSoTimeout(context.nextTimeoutMillis());
            MethodSelection selection = MethodSelection.read(in);
            if (selection.getSocksVersion() != SOCKS_VERSION) {
                return StepResult.failed(protocol(ProbeStage.SOCKS_HANDSHAKE, prefix,
                        String.format("unexpected version in method selection: 0x%02x", selection.getSocksVersion())));
            }

            AuthMethod method = selection.getMethod();
            if (method == AuthMethod.NO_AUTHENTICATION) {
                return StepResult.ok(method);
            }
            if (method == AuthMethod.USERNAME_PASSWORD) {
                if (userPass == null) {
                    return StepResult.failed(protocol(ProbeStage.SOCKS_HANDSHAKE, prefix,
                            "proxy requires username/password but none provided"));
                }
                action = "write user/pass";
                send(context, socket, out, userPass.toByteRequest());

                action = "read user/pass reply";
                socket.setSoTimeout(context.nextTimeoutMillis());
                if (!UserPassMessage.readStatus(in)) {
                    return StepResult.failed(protocol(ProbeStage.SOCKS_HANDSHAKE, prefix,
                            "user/pass authentication failed"));
                }
                return StepResult.ok(method);
            }
            if (method == AuthMethod.NO_ACCEPTABLE_METHOD) {
                return StepResult.failed(protocol(ProbeStage.SOCKS_HANDSHAKE, prefix,
                        "proxy rejected offered methods"));
            }
            return StepResult.failed(protocol(ProbeStage.SOCKS_HANDSHAKE, prefix,
                    String.format("unsupported method selected by proxy: 0x%02x", selection.getMethodValue())));
        } catch (IllegalArgumentException e) {
            return StepResult.failed(protocol(ProbeStage.SOCKS_HANDSHAKE, prefix, e.getMessage()));
        } catch (IOException e) {
            return StepResult.failed(transport(context, ProbeStage.SOCKS_HANDSHAKE, prefix + ": " + action, e));
        }
    }

    /**
     * Sends a CONNECT or UDP ASSOCIATE request and checks the reply. On a granted reply the bound
     * address is consumed, so the stream is positioned for the next request.
     */
    private StepResult<Void> request(ProbeContext context, Socket socket, DataInputStream in, OutputStream out,
                                     ConnectionMsg request, ProbeStage stage, String prefix) {
        String command = request.getRequestCommand().getCommandName();
        String action = "write " + command;
        try {
            send(context, socket, out, request.toByteRequest());

            action = "read " + command + " reply header";
            socket.setSoTimeout(context.nextTimeoutMillis());
            ConnectionReply reply = ConnectionReply.readHeader(in);
            if (reply.getSocksVersion() != SOCKS_VERSION) {
                return StepResult.failed(protocol(stage, prefix,
                        String.format("unexpected %s reply version: 0x%02x", command, reply.getSocksVersion())));
            }
            if (!reply.isGranted()) {
                return StepResult.failed(protocol(stage, prefix, reply.describeReply()));
            }

            action = "read " + command + " bind addr";
            reply.discardBoundAddress(in);
            return StepResult.ok(null);
        } catch (IllegalArgumentException e) {
            return StepResult.failed(protocol(stage, prefix, action + ": " + e.getMessage()));
        } catch (IOException e) {
            return StepResult.failed(transport(context, stage, prefix + ": " + action, e));
        }
    }

    private static void send(ProbeContext context, Socket socket, OutputStream out, byte[] bytes) throws IOException {
        socket.setSoTimeout(context.nextTimeoutMillis());
        out.write(bytes);
        out.flush();
    }

    private static ProbeException protocol(ProbeStage stage, String prefix, String cause) {
        return new ProbeException(PROTOCOL, stage, prefix + ": " + cause);
    }

    private static ProbeException transport(ProbeContext context, ProbeStage stage, String prefix, IOException e) {
        String cause = context.isCancelled() ? "probe cancelled" : String.valueOf(e.getMessage());
        return new ProbeException(TRANSPORT, stage, prefix + ": " + cause, e);
    }

    private static void recordLatency(ProbeSummary summary, ProbeStage stage, long startNanos) {
        summary.putLatency(stage.getLatencyKey(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Failed to close probe socket: {}", e.getMessage());
        }
    }

    /**
     * Outcome of one step: either a value or the failure that ends the run.
     */
    private static final class StepResult<T> {
        private final T value;
        private final ProbeException failure;

        private StepResult(T value, ProbeException failure) {
            this.value = value;
            this.failure = failure;
        }

        static <T> StepResult<T> ok(T value) {
            return new StepResult<>(value, null);
        }

        static <T> StepResult<T> failed(ProbeException failure) {
            return new StepResult<>(null, failure);
        }

        boolean isFailed() {
            return failure != null;
        }

        T getValue() {
            return value;
        }

        ProbeException getFailure() {
            return failure;
        }
    }
}
