package ru.nsu.g.akononov.agent.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deadline and cancellation for blocking probe I/O.
 *
 * <p>A context may be cancelled from any thread. Cancelling closes every resource attached to it
 * and to its children, which makes a read or write blocked on that resource fail at once.
 * Children inherit cancellation and never outlive the parent's deadline.</p>
 */
public final class ProbeContext implements AutoCloseable {
    /**
     * Longest timeout that still becomes a deadline. Deadlines are {@link System#nanoTime()}
     * values, so anything longer would wrap around.
     */
    public static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE / 4);

    private static final Logger logger = LoggerFactory.getLogger(ProbeContext.class.getSimpleName());

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final ProbeContext parent;
    private final long deadlineNanos;
    private final List<ProbeContext> children = new CopyOnWriteArrayList<>();
    private final List<Closeable> resources = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    private ProbeContext(ProbeContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Root context without a deadline. Each call returns a fresh, independently cancellable context.
     */
    public static ProbeContext background() {
        return new ProbeContext(null, NO_DEADLINE);
    }

    /**
     * Child whose deadline is {@code timeout} from now, or the parent's deadline if that is sooner.
     * Timeouts of {@link #MAX_TIMEOUT} or more add no deadline of their own.
     * Close the child when done with it.
     */
    public ProbeContext withTimeout(Duration timeout) {
        long deadline = deadlineNanos;
        if (timeout.compareTo(MAX_TIMEOUT) < 0) {
            long candidate = System.nanoTime() + timeout.toNanos();
            if (deadlineNanos == NO_DEADLINE || candidate - deadlineNanos < 0) {
                deadline = candidate;
            }
        }

        ProbeContext child = new ProbeContext(this, deadline);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    public Duration remaining() {
        if (!hasDeadline()) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    /**
     * Budget for the next blocking call in milliseconds, suitable for socket timeouts: at least 1
     * while a deadline is set, 0 (infinite) only for a context without one.
     *
     * @throws IOException if the context has been cancelled
     * @throws SocketTimeoutException if the deadline has passed
     */
    public int nextTimeoutMillis() throws IOException {
        if (isCancelled()) {
            throw new IOException("probe cancelled");
        }
        if (!hasDeadline()) {
            return 0;
        }
        long left = deadlineNanos - System.nanoTime();
        if (left <= 0) {
            throw new SocketTimeoutException("probe deadline exceeded");
        }
        long millis = Math.max(1, Duration.ofNanos(left).toMillis());
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    /**
     * Registers a resource to be closed on cancellation. If the context is already cancelled the
     * resource is closed right away.
     */
    public void attach(Closeable resource) {
        resources.add(resource);
        if (isCancelled()) {
            closeResources();
        }
    }

    public void detach(Closeable resource) {
        resources.remove(resource);
    }

    public void cancel() {
        cancelled = true;
        closeResources();
        for (ProbeContext child : children) {
            child.cancel();
        }
    }

    private void closeResources() {
        for (Closeable resource : resources) {
            try {
                resource.close();
            } catch (IOException e) {
                logger.debug("Failed to close {} on cancellation: {}", resource, e.getMessage());
            }
        }
    }

    /**
     * Releases this context from its parent. Attached resources are left to their owner.
     */
    @Override
    public void close() {
        resources.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
    }
}
