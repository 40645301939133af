package ru.nsu.g.akononov.agent.probe;

import ru.nsu.g.akononov.agent.state.ProbeSummary;

import java.util.Optional;

/**
 * Summary of a probe run together with the error that stopped it, if any. The summary is
 * populated on every path, including failures.
 */
public final class ProbeResult {
    private final ProbeSummary summary;
    private final ProbeException error;

    public ProbeResult(ProbeSummary summary, ProbeException error) {
        this.summary = summary;
        this.error = error;
    }

    public ProbeSummary getSummary() {
        return summary;
    }

    public Optional<ProbeException> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
