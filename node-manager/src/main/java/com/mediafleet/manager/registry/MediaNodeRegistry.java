package com.mediafleet.manager.registry;

import com.mediafleet.core.error.NodeNotFoundException;
import com.mediafleet.core.metrics.MetricsNames;
import com.mediafleet.core.metrics.MetricsTags;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.core.model.MediaNodeState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory directory of all known media nodes; the single source of truth for
 * node state and usage.
 * <p>
 * Every id owns a slot with its own lock, so mutations of one node are serialized
 * while mutations of different nodes never contend. The slot publishes an
 * immutable {@link MediaNode}; {@link #get} and {@link #snapshot} read that value
 * without locking.
 * </p>
 * <p>
 * Callers that need to run side effects atomically with a state change (arming or
 * cancelling an idle deadline) do so inside the mutation passed to
 * {@link #update}, which runs while the node's lock is held.
 * </p>
 */
public class MediaNodeRegistry {

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public MediaNodeRegistry(MeterRegistry meterRegistry) {
        for (MediaNodeState state : MediaNodeState.values()) {
            Gauge.builder(MetricsNames.REGISTRY_NODES, this, r -> r.count(state))
                .tag(MetricsTags.STATE, state.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry);
        }
    }

    public Optional<MediaNode> get(String id) {
        Slot slot = slots.get(id);
        return slot == null ? Optional.empty() : Optional.of(slot.node);
    }

    /**
     * @return current records, in no particular order
     */
    public List<MediaNode> snapshot() {
        return slots.values().stream()
            .map(slot -> slot.node)
            .collect(Collectors.toList());
    }

    /**
     * Inserts the node, or replaces the record stored under its id.
     */
    public void upsert(MediaNode node) {
        while (true) {
            Slot slot = slots.putIfAbsent(node.getId(), new Slot(node));
            if (slot == null) {
                return;
            }
            slot.lock.lock();
            try {
                if (!slot.removed) {
                    slot.node = node;
                    return;
                }
            } finally {
                slot.lock.unlock();
            }
            // the slot was removed between lookup and lock; retry with a fresh one
        }
    }

    /**
     * Inserts the node only if no live record exists for its id.
     *
     * @return true if inserted
     */
    public boolean putIfAbsent(MediaNode node) {
        while (true) {
            Slot slot = slots.putIfAbsent(node.getId(), new Slot(node));
            if (slot == null) {
                return true;
            }
            slot.lock.lock();
            try {
                if (!slot.removed) {
                    return false;
                }
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Atomically replaces the node's record with the result of {@code mutation}.
     * <p>
     * The mutation runs under the node's exclusive lock. If it throws, the stored
     * record is unchanged and the exception propagates.
     * </p>
     *
     * @return the stored record
     * @throws NodeNotFoundException if the id is absent or was removed concurrently
     */
    public MediaNode update(String id, UnaryOperator<MediaNode> mutation) {
        Slot slot = slots.get(id);
        if (slot == null) {
            throw new NodeNotFoundException(id);
        }
        slot.lock.lock();
        try {
            if (slot.removed) {
                throw new NodeNotFoundException(id);
            }
            MediaNode updated = mutation.apply(slot.node);
            slot.node = updated;
            return updated;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Removes the record after {@code precondition} accepted it under the node's lock.
     * The precondition rejects removal by throwing.
     *
     * @return the removed record
     * @throws NodeNotFoundException if the id is absent
     */
    public MediaNode remove(String id, Consumer<MediaNode> precondition) {
        Slot slot = slots.get(id);
        if (slot == null) {
            throw new NodeNotFoundException(id);
        }
        slot.lock.lock();
        try {
            if (slot.removed) {
                throw new NodeNotFoundException(id);
            }
            precondition.accept(slot.node);
            slot.removed = true;
            slots.remove(id, slot);
            return slot.node;
        } finally {
            slot.lock.unlock();
        }
    }

    public Optional<MediaNode> remove(String id) {
        Slot slot = slots.get(id);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            if (slot.removed) {
                return Optional.empty();
            }
            slot.removed = true;
            slots.remove(id, slot);
            return Optional.of(slot.node);
        } finally {
            slot.lock.unlock();
        }
    }

    public int size() {
        return slots.size();
    }

    public long count(MediaNodeState state) {
        return slots.values().stream()
            .filter(slot -> slot.node.getState() == state)
            .count();
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile MediaNode node;
        private boolean removed; // guarded by lock

        private Slot(MediaNode node) {
            this.node = node;
        }
    }
}
