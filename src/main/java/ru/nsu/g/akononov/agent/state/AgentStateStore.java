package ru.nsu.g.akononov.agent.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared daemon state: lifecycle phase, warnings and the latest view of every subsystem.
 *
 * <p>One instance is created by the process entry point and handed to every consumer. All access
 * goes through one fair read-write lock; critical sections only copy and assign, so no call here
 * ever blocks on I/O. Subsystem records are replaced whole, never merged.</p>
 */
public class AgentStateStore {
    private static final Logger logger = LoggerFactory.getLogger(AgentStateStore.class.getSimpleName());

    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Clock clock;

    private AgentState agentState = AgentState.INACTIVE;
    private Instant startedAt;
    private final List<String> warnings = new ArrayList<>();
    private TunSnapshot tun = TunSnapshot.EMPTY;
    private RouteSnapshot routes = RouteSnapshot.EMPTY;
    private Tun2SocksSnapshot tun2Socks = Tun2SocksSnapshot.EMPTY;
    private ProbeSummary lastProbe = new ProbeSummary();

    public AgentStateStore() {
        this(Clock.systemUTC());
    }

    public AgentStateStore(Clock clock) {
        this.clock = clock;
    }

    public Snapshot getSnapshot() {
        lock.readLock().lock();
        try {
            return new Snapshot(agentState, startedAt, new ArrayList<>(warnings), tun, routes, tun2Socks,
                    lastProbe.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    public AgentState getAgentState() {
        lock.readLock().lock();
        try {
            return agentState;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Moves the daemon to {@code next}. Staying in the current state succeeds without changes.
     * The first activation stamps the start time; returning to inactive clears it.
     *
     * @throws InvalidTransitionException if the edge is not allowed; nothing is changed then
     */
    public void setAgentState(AgentState next) throws InvalidTransitionException {
        AgentState previous;
        lock.writeLock().lock();
        try {
            previous = agentState;
            if (previous == next) {
                return;
            }
            if (!previous.canTransitionTo(next)) {
                logger.warn("Rejected agent state transition {} -> {}", previous.wireName(), next.wireName());
                throw new InvalidTransitionException(previous, next);
            }

            if (next == AgentState.ACTIVE && startedAt == null) {
                startedAt = clock.instant();
            } else if (next == AgentState.INACTIVE) {
                startedAt = null;
            }
            agentState = next;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Agent state {} -> {}", previous.wireName(), next.wireName());
    }

    /**
     * Overrides the start time, e.g. when lifecycle context is restored. {@code null} clears it.
     */
    public void setStartedAt(Instant startedAt) {
        lock.writeLock().lock();
        try {
            this.startedAt = startedAt;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Duration uptime() {
        lock.readLock().lock();
        try {
            if (startedAt == null) {
                return Duration.ZERO;
            }
            return Duration.between(startedAt, clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void appendWarning(String message) {
        if (message == null || message.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            warnings.add(message);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearWarnings() {
        lock.writeLock().lock();
        try {
            warnings.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void updateTun(TunSnapshot tun) {
        lock.writeLock().lock();
        try {
            this.tun = tun == null ? TunSnapshot.EMPTY : tun;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void updateRoutes(RouteSnapshot routes) {
        lock.writeLock().lock();
        try {
            this.routes = routes == null ? RouteSnapshot.EMPTY : routes;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void updateTun2Socks(Tun2SocksSnapshot tun2Socks) {
        lock.writeLock().lock();
        try {
            this.tun2Socks = tun2Socks == null ? Tun2SocksSnapshot.EMPTY : tun2Socks;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a copy of {@code summary}; the caller keeps ownership of the instance passed in.
     */
    public void updateProbe(ProbeSummary summary) {
        ProbeSummary copy = summary == null ? new ProbeSummary() : summary.copy();
        lock.writeLock().lock();
        try {
            lastProbe = copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops warnings and every subsystem record. With {@code clearLifecycle} the daemon also goes
     * back to inactive with no start time; otherwise the lifecycle phase is kept.
     */
    public void reset(boolean clearLifecycle) {
        lock.writeLock().lock();
        try {
            if (clearLifecycle) {
                agentState = AgentState.INACTIVE;
                startedAt = null;
            }
            warnings.clear();
            tun = TunSnapshot.EMPTY;
            routes = RouteSnapshot.EMPTY;
            tun2Socks = Tun2SocksSnapshot.EMPTY;
            lastProbe = new ProbeSummary();
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("State reset (clearLifecycle={})", clearLifecycle);
    }
}
