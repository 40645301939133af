package ru.nsu.g.akononov.agent.state;

import java.util.Locale;

/**
 * Coarse lifecycle phase of the daemon.
 *
 * <pre>
 * inactive -> starting | active
 * starting -> active | error | inactive
 * active   -> degraded | stopping | error
 * degraded -> active | stopping | error
 * stopping -> inactive | error
 * error    -> inactive | starting
 * </pre>
 */
public enum AgentState {
    INACTIVE,
    STARTING,
    ACTIVE,
    DEGRADED,
    STOPPING,
    ERROR;

    public boolean canTransitionTo(AgentState next) {
        switch (this) {
            case INACTIVE:
                return next == STARTING || next == ACTIVE;
            case STARTING:
                return next == ACTIVE || next == ERROR || next == INACTIVE;
            case ACTIVE:
                return next == DEGRADED || next == STOPPING || next == ERROR;
            case DEGRADED:
                return next == ACTIVE || next == STOPPING || next == ERROR;
            case STOPPING:
                return next == INACTIVE || next == ERROR;
            case ERROR:
                return next == INACTIVE || next == STARTING;
            default:
                return false;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
