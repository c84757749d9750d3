package com.mediafleet.manager.idle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdleReaperTest {

    private static final Duration GRACE = Duration.ofSeconds(30);

    private VirtualTimeScheduler scheduler;
    private List<Long> fired;
    private IdleReaper reaper;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        fired = new CopyOnWriteArrayList<>();
        reaper = new IdleReaper(scheduler, GRACE, (nodeId, generation) -> {
            if (reaper.complete(nodeId, generation)) {
                fired.add(generation);
            }
        });
    }

    @Test
    void testDeadlineFiresAfterGracePeriod() {
        long generation = reaper.arm("kms-1", 0);
        reaper.activate("kms-1", generation);

        scheduler.advanceTimeBy(GRACE.minusMillis(1));
        assertTrue(fired.isEmpty());
        assertTrue(reaper.isArmed("kms-1"));

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(List.of(generation), fired);
        assertFalse(reaper.isArmed("kms-1"));
    }

    @Test
    void testRearmingKeepsSingleDeadline() {
        long first = reaper.arm("kms-1", 0);
        reaper.activate("kms-1", first);
        scheduler.advanceTimeBy(Duration.ofSeconds(10));
        long second = reaper.arm("kms-1", 10_000);
        reaper.activate("kms-1", second);

        assertEquals(1, reaper.pendingCount());

        scheduler.advanceTimeBy(Duration.ofSeconds(25));
        assertTrue(fired.isEmpty(), "first deadline was replaced");

        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertEquals(List.of(second), fired);
    }

    @Test
    void testCancelledDeadlineNeverFires() {
        long generation = reaper.arm("kms-1", 0);
        reaper.activate("kms-1", generation);

        assertTrue(reaper.cancel("kms-1"));
        assertFalse(reaper.cancel("kms-1"));

        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertTrue(fired.isEmpty());
    }

    @Test
    void testActivatingStaleGenerationDoesNothing() {
        long stale = reaper.arm("kms-1", 0);
        long current = reaper.arm("kms-1", 0);
        reaper.activate("kms-1", stale);

        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertTrue(fired.isEmpty());
        assertFalse(reaper.complete("kms-1", stale));
        assertTrue(reaper.complete("kms-1", current));
    }

    @Test
    void testOverdueDeadlineFiresOnActivation() {
        scheduler.advanceTimeBy(Duration.ofMinutes(2));
        long generation = reaper.arm("kms-1", 0);

        reaper.activate("kms-1", generation);
        scheduler.advanceTime();

        assertEquals(List.of(generation), fired);
    }

    @Test
    void testCloseDrainsPendingDeadlines() {
        reaper.activate("kms-1", reaper.arm("kms-1", 0));
        reaper.activate("kms-2", reaper.arm("kms-2", 0));

        reaper.close();

        assertEquals(0, reaper.pendingCount());
        long generation = reaper.arm("kms-3", 0);
        reaper.activate("kms-3", generation);
        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertTrue(fired.isEmpty());
    }

    @Test
    void testHandlerFailureDoesNotBreakScheduler() {
        IdleReaper failing = new IdleReaper(scheduler, GRACE, (nodeId, generation) -> {
            throw new IllegalStateException("boom");
        });
        failing.activate("kms-1", failing.arm("kms-1", 0));
        reaper.activate("kms-2", reaper.arm("kms-2", 0));

        scheduler.advanceTimeBy(GRACE);

        assertEquals(1, fired.size());
    }

    @Test
    void testArmAfterCloseLeavesNoDeadline() {
        reaper.close();

        assertEquals(IdleReaper.NOT_ARMED, reaper.arm("kms-1", 0));
        reaper.activate("kms-1", IdleReaper.NOT_ARMED);
        scheduler.advanceTimeBy(GRACE.multipliedBy(2));

        assertFalse(reaper.isArmed("kms-1"));
        assertEquals(0, reaper.pendingCount());
        assertTrue(fired.isEmpty());
    }
}
