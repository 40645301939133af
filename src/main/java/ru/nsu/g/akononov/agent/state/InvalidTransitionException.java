package ru.nsu.g.akononov.agent.state;

public class InvalidTransitionException extends Exception {
    private final AgentState from;
    private final AgentState to;

    public InvalidTransitionException(AgentState from, AgentState to) {
        super("invalid agent state transition: " + from.wireName() + " -> " + to.wireName());
        this.from = from;
        this.to = to;
    }

    public AgentState getFrom() {
        return from;
    }

    public AgentState getTo() {
        return to;
    }
}
