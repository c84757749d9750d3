package com.mediafleet.manager.idle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-driven reclaiming of idle media nodes.
 * <p>
 * Holds at most one pending deadline per node id, due at
 * {@code idleSince + gracePeriod}. Arming replaces (and disposes) the previous
 * deadline. When a deadline fires it is handed to the {@link DeadlineHandler}
 * together with its generation; the handler enters the node's exclusive section
 * and calls {@link #complete} to learn whether the deadline is still the live one.
 * A deadline that lost the race against a registration or a re-arm is discarded.
 * </p>
 * <p>
 * {@link #arm} and {@link #cancel} are called with the node's lock held, so the
 * live deadline always matches the node's state. {@link #activate} runs after the
 * lock is released: a deadline that is already due fires on the caller's thread
 * with some schedulers and must not re-enter the lock mid-update.
 * </p>
 */
public class IdleReaper {
    private static final Logger log = LoggerFactory.getLogger(IdleReaper.class);

    public static final long NOT_ARMED = -1;

    private final Scheduler scheduler;
    private final Duration gracePeriod;
    private final DeadlineHandler handler;

    private final Map<String, IdleDeadline> deadlines = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private volatile boolean closed;

    public IdleReaper(Scheduler scheduler, Duration gracePeriod, DeadlineHandler handler) {
        this.scheduler = scheduler;
        this.gracePeriod = gracePeriod;
        this.handler = handler;
    }

    /**
     * Registers the idle deadline for a node, replacing any previous one.
     * The timer starts with {@link #activate}, which the caller invokes after
     * releasing the node's lock.
     *
     * @param nodeId    media node id
     * @param idleSince when usage reached zero (epoch millis, scheduler clock)
     * @return the generation of the new deadline, or {@link #NOT_ARMED} once the reaper is closed
     */
    public long arm(String nodeId, long idleSince) {
        if (closed) {
            log.debug("Idle reaper closed, no deadline armed for media node {}", nodeId);
            return NOT_ARMED;
        }
        IdleDeadline deadline = new IdleDeadline(nodeId, generations.incrementAndGet(),
            idleSince + gracePeriod.toMillis());
        IdleDeadline previous = deadlines.put(nodeId, deadline);
        if (previous != null) {
            previous.dispose();
            log.debug("Re-armed idle deadline for media node {} (generation {} replaces {})",
                nodeId, deadline.generation, previous.generation);
        }
        return deadline.generation;
    }

    /**
     * Starts the timer of an armed deadline. No-op if the deadline was cancelled or
     * replaced in the meantime, or if the reaper is closed.
     */
    public void activate(String nodeId, long generation) {
        IdleDeadline deadline = deadlines.get(nodeId);
        if (closed || deadline == null || deadline.generation != generation) {
            log.debug("Idle deadline generation {} for media node {} no longer current, not scheduled",
                generation, nodeId);
            return;
        }
        long delay = Math.max(0, deadline.dueAt - scheduler.now(TimeUnit.MILLISECONDS));
        log.info("Media node {} idle, terminating at {} unless a session attaches (in {} ms)",
            nodeId, deadline.dueAt, delay);
        deadline.task = scheduler.schedule(() -> fire(deadline), delay, TimeUnit.MILLISECONDS);
    }

    /**
     * Cancels the pending deadline of a node, if any.
     *
     * @return true if a deadline was pending
     */
    public boolean cancel(String nodeId) {
        IdleDeadline deadline = deadlines.remove(nodeId);
        if (deadline == null) {
            return false;
        }
        deadline.dispose();
        log.debug("Cancelled idle deadline for media node {} (generation {})", nodeId, deadline.generation);
        return true;
    }

    /**
     * Consumes the deadline of {@code generation} if it is still the live one for the node.
     *
     * @return true if the caller should act on the deadline; false if it is stale
     */
    public boolean complete(String nodeId, long generation) {
        IdleDeadline current = deadlines.get(nodeId);
        if (current == null || current.generation != generation) {
            return false;
        }
        return deadlines.remove(nodeId, current);
    }

    public boolean isArmed(String nodeId) {
        return deadlines.containsKey(nodeId);
    }

    public int pendingCount() {
        return deadlines.size();
    }

    /**
     * Disposes every pending deadline.
     */
    public void close() {
        closed = true;
        deadlines.values().forEach(IdleDeadline::dispose);
        int drained = deadlines.size();
        deadlines.clear();
        log.info("Idle reaper stopped, {} pending deadlines drained", drained);
    }

    private void fire(IdleDeadline deadline) {
        try {
            handler.onIdleDeadline(deadline.nodeId, deadline.generation);
        } catch (RuntimeException e) {
            log.error("Idle deadline handling failed for media node {}", deadline.nodeId, e);
        }
    }

    /**
     * Receives fired deadlines on the scheduler thread.
     */
    @FunctionalInterface
    public interface DeadlineHandler {
        void onIdleDeadline(String nodeId, long generation);
    }

    private static final class IdleDeadline {
        private final String nodeId;
        private final long generation;
        private final long dueAt;
        private volatile Disposable task;

        private IdleDeadline(String nodeId, long generation, long dueAt) {
            this.nodeId = nodeId;
            this.generation = generation;
            this.dueAt = dueAt;
        }

        private void dispose() {
            Disposable scheduled = task;
            if (scheduled != null) {
                scheduled.dispose();
            }
        }
    }
}
