package com.mediafleet.manager.lifecycle;

import com.mediafleet.core.error.InvalidStateTransitionException;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.manager.support.RecordingEventPublisher;
import com.mediafleet.manager.support.StubProvisioningGateway;
import com.mediafleet.manager.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Races between session usage and idle deadlines on real threads.
 */
class MediaNodeManagerConcurrencyTest {

    private final StubProvisioningGateway gateway = new StubProvisioningGateway();
    private final List<Scheduler> schedulers = new ArrayList<>();
    private ExecutorService executor;
    private MediaNodeManager manager;

    @AfterEach
    void tearDown() {
        manager.shutdown();
        schedulers.forEach(Scheduler::dispose);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private MediaNodeManager start(Duration grace, Scheduler scheduler) {
        schedulers.add(scheduler);
        manager = new MediaNodeManager(
            TestConfigs.defaults().toBuilder().idleGracePeriod(grace).build(),
            gateway, new RecordingEventPublisher(), new SimpleMeterRegistry(), scheduler);
        manager.start();
        return manager;
    }

    private void register(String id) {
        MediaNode node = manager.getMediaNode(id).orElseThrow();
        manager.mediaNodeUsageRegistration(node, System.currentTimeMillis(), manager.getMediaNodes());
    }

    private void deregister(String id) {
        manager.mediaNodeUsageDeregistration(manager.getMediaNode(id).orElseThrow(), System.currentTimeMillis());
    }

    @Test
    void testRegistrationAndFiringDeadlineNeverBothSucceed() throws Exception {
        start(Duration.ZERO, Schedulers.newParallel("idle-race", 2));
        int rounds = 200;
        List<String> registrationWon = new ArrayList<>();
        List<String> deadlineWon = new ArrayList<>();

        for (int i = 0; i < rounds; i++) {
            String id = "kms-" + i;
            manager.adoptMediaNode(id);
            register(id);

            // zero grace: the deadline is due as soon as usage reaches zero
            deregister(id);
            try {
                register(id);
                registrationWon.add(id);
            } catch (InvalidStateTransitionException e) {
                deadlineWon.add(id);
            }
        }

        // let any deadline still queued run and find its generation stale
        Thread.sleep(200);

        assertEquals(rounds, registrationWon.size() + deadlineWon.size());
        for (String id : registrationWon) {
            MediaNode node = manager.getMediaNode(id).orElseThrow();
            assertTrue(manager.isRunning(id), id + " should stay RUNNING, was " + node.getState());
            assertEquals(1, node.getUsageCount());
            assertEquals(0, gateway.terminationRequestsFor(id));
        }
        for (String id : deadlineWon) {
            MediaNode node = manager.getMediaNode(id).orElseThrow();
            assertTrue(manager.isTerminating(id), id + " should be TERMINATING, was " + node.getState());
            assertEquals(0, node.getUsageCount());
            assertEquals(1, gateway.terminationRequestsFor(id));
        }
    }

    @Test
    void testConcurrentUsageOnOneNodeArmsSingleDeadline() throws Exception {
        start(TestConfigs.GRACE, VirtualTimeScheduler.create());
        manager.adoptMediaNode("kms-1");
        int threads = 8;
        int perThread = 100;

        runConcurrently(threads, () -> {
            for (int i = 0; i < perThread; i++) {
                register("kms-1");
            }
        });
        assertEquals(threads * perThread, manager.getMediaNode("kms-1").orElseThrow().getUsageCount());

        runConcurrently(threads, () -> {
            for (int i = 0; i < perThread; i++) {
                deregister("kms-1");
            }
        });

        MediaNode node = manager.getMediaNode("kms-1").orElseThrow();
        assertEquals(0, node.getUsageCount());
        assertTrue(manager.isWaitingIdleToTerminate("kms-1"));
        assertEquals(1, manager.getIdleReaper().pendingCount());
    }

    @Test
    void testUsageOnDistinctNodesIsIndependent() throws Exception {
        start(TestConfigs.GRACE, VirtualTimeScheduler.create());
        int threads = 6;
        for (int t = 0; t < threads; t++) {
            manager.adoptMediaNode("kms-" + t);
        }

        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String id = "kms-" + t;
            int sessions = 50 + t;
            tasks.add(() -> {
                for (int i = 0; i < sessions; i++) {
                    register(id);
                }
                deregister(id);
            });
        }
        runAll(tasks);

        for (int t = 0; t < threads; t++) {
            assertEquals(49 + t, manager.getMediaNode("kms-" + t).orElseThrow().getUsageCount());
            assertTrue(manager.isRunning("kms-" + t));
        }
    }

    private void runConcurrently(int threads, Runnable task) throws Exception {
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            tasks.add(task);
        }
        runAll(tasks);
    }

    private void runAll(List<Runnable> tasks) throws Exception {
        if (executor == null) {
            executor = Executors.newFixedThreadPool(tasks.size());
        }
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Runnable task : tasks) {
            futures.add(executor.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (java.util.concurrent.ExecutionException e) {
                fail("concurrent task failed", e.getCause());
            }
        }
    }
}
