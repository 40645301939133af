package ru.nsu.g.akononov.agent.probe;

/**
 * Reason a probe run ended early. Returned inside a {@link ProbeResult}, never thrown out of
 * {@link SocksProbe}.
 */
public class ProbeException extends Exception {

    public enum Kind {
        /** Malformed configuration, detected before any network I/O. */
        INPUT,
        /** Dial, read or write failure, timeout or cancellation. */
        TRANSPORT,
        /** The proxy answered, but not with something that lets the run continue. */
        PROTOCOL
    }

    private final Kind kind;
    private final ProbeStage stage;

    public ProbeException(Kind kind, ProbeStage stage, String message) {
        super(message);
        this.kind = kind;
        this.stage = stage;
    }

    public ProbeException(Kind kind, ProbeStage stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public Kind getKind() {
        return kind;
    }

    public ProbeStage getStage() {
        return stage;
    }
}
