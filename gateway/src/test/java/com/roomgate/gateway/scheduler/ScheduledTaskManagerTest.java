package com.roomgate.gateway.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledTaskManagerTest {

    private VirtualTimeScheduler scheduler;
    private ScheduledTaskManager manager;
    private StubOwner owner;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        manager = new ScheduledTaskManager(scheduler);
        owner = new StubOwner("conn:1");
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        scheduler.dispose();
    }

    @Test
    @DisplayName("Task runs once per interval")
    void testRunsEveryInterval() {
        AtomicInteger runs = new AtomicInteger();

        assertTrue(manager.addTask(owner, "tick", Duration.ofSeconds(1), runs::incrementAndGet));
        scheduler.advanceTimeBy(Duration.ofMillis(3500));

        assertEquals(3, runs.get());
        assertEquals(3, manager.getTask("conn:1", "tick").orElseThrow().getRunCount().get());
        assertEquals(3000, manager.getTask("conn:1", "tick").orElseThrow().getLastRunAt());
    }

    @Test
    @DisplayName("Registering an existing (owner, task) key is a no-op")
    void testDuplicateKeyIsIdempotent() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        assertTrue(manager.addTask(owner, "tick", Duration.ofSeconds(1), first::incrementAndGet));
        assertFalse(manager.addTask(owner, "tick", Duration.ofSeconds(1), second::incrementAndGet));
        scheduler.advanceTimeBy(Duration.ofSeconds(2));

        assertEquals(2, first.get());
        assertEquals(0, second.get());
        assertEquals(1, manager.taskCount("conn:1"));
    }

    @Test
    @DisplayName("Same task id under different owners are separate tasks")
    void testSameTaskIdDifferentOwners() {
        StubOwner other = new StubOwner("conn:2");

        assertTrue(manager.addTask(owner, "tick", Duration.ofSeconds(1), () -> { }));
        assertTrue(manager.addTask(other, "tick", Duration.ofSeconds(1), () -> { }));

        assertEquals(2, manager.size());
    }

    @Test
    @DisplayName("Task removes itself without running once the owner is gone")
    void testOwnerDeathRemovesTask() {
        AtomicInteger runs = new AtomicInteger();
        manager.addTask(owner, "tick", Duration.ofSeconds(1), runs::incrementAndGet);

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        owner.alive = false;
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertEquals(1, runs.get());
        assertFalse(manager.hasTask("conn:1", "tick"));
    }

    @Test
    @DisplayName("Task removes itself the first time its condition is false")
    void testConditionRemovesTask() {
        AtomicInteger runs = new AtomicInteger();
        AtomicBoolean relevant = new AtomicBoolean(true);
        manager.addTask(owner, "tick", Duration.ofSeconds(1), runs::incrementAndGet, relevant::get);

        scheduler.advanceTimeBy(Duration.ofSeconds(2));
        relevant.set(false);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        relevant.set(true);
        scheduler.advanceTimeBy(Duration.ofSeconds(3));

        assertEquals(2, runs.get());
        assertFalse(manager.hasTask("conn:1", "tick"));
    }

    @Test
    @DisplayName("Failing work is logged and the task keeps running")
    void testFailingWorkKeepsTask() {
        AtomicInteger runs = new AtomicInteger();
        manager.addTask(owner, "flaky", Duration.ofSeconds(1), () -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        scheduler.advanceTimeBy(Duration.ofSeconds(3));

        assertEquals(3, runs.get());
        assertTrue(manager.hasTask("conn:1", "flaky"));
    }

    @Test
    @DisplayName("Dead owners cannot register tasks")
    void testDeadOwnerRejected() {
        owner.alive = false;

        assertFalse(manager.addTask(owner, "tick", Duration.ofSeconds(1), () -> { }));
        assertEquals(0, manager.size());
    }

    @Test
    @DisplayName("Non-positive intervals are rejected")
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> manager.addTask(owner, "tick", Duration.ZERO, () -> { }));
    }

    @Test
    @DisplayName("stopAll cancels every task of one owner only")
    void testStopAll() {
        StubOwner other = new StubOwner("room:/:general");
        AtomicInteger ownerRuns = new AtomicInteger();
        AtomicInteger otherRuns = new AtomicInteger();
        manager.addTask(owner, "a", Duration.ofSeconds(1), ownerRuns::incrementAndGet);
        manager.addTask(owner, "b", Duration.ofSeconds(1), ownerRuns::incrementAndGet);
        manager.addTask(other, "a", Duration.ofSeconds(1), otherRuns::incrementAndGet);

        assertEquals(2, manager.stopAll("conn:1"));
        scheduler.advanceTimeBy(Duration.ofSeconds(2));

        assertEquals(0, ownerRuns.get());
        assertEquals(2, otherRuns.get());
        assertEquals(0, manager.taskCount("conn:1"));
        assertEquals(1, manager.taskCount("room:/:general"));
    }

    @Test
    @DisplayName("stopTask cancels one task and reports whether it existed")
    void testStopTask() {
        AtomicInteger runs = new AtomicInteger();
        manager.addTask(owner, "tick", Duration.ofSeconds(1), runs::incrementAndGet);

        assertTrue(manager.stopTask("conn:1", "tick"));
        assertFalse(manager.stopTask("conn:1", "tick"));
        scheduler.advanceTimeBy(Duration.ofSeconds(3));

        assertEquals(0, runs.get());
        assertTrue(manager.addTask(owner, "tick", Duration.ofSeconds(1), runs::incrementAndGet));
    }

    @Test
    @DisplayName("shutdown cancels everything")
    void testShutdown() {
        AtomicInteger runs = new AtomicInteger();
        manager.addTask(owner, "tick", Duration.ofSeconds(1), runs::incrementAndGet);

        manager.shutdown();
        scheduler.advanceTimeBy(Duration.ofSeconds(3));

        assertEquals(0, runs.get());
        assertEquals(0, manager.size());
    }

    private static class StubOwner implements TaskOwner {
        private final String id;
        private volatile boolean alive = true;

        StubOwner(String id) {
            this.id = id;
        }

        @Override
        public String getTaskOwnerId() {
            return id;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
