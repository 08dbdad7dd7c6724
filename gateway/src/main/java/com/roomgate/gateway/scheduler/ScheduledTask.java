package com.roomgate.gateway.scheduler;

import lombok.Getter;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * A recurring task registered with {@link ScheduledTaskManager}.
 */
@Getter
public class ScheduledTask {
    private final String ownerId;
    private final String taskId;
    private final Duration interval;
    private final BooleanSupplier liveness;
    private final Runnable work;
    private final AtomicLong runCount = new AtomicLong();
    private volatile long lastRunAt = -1;

    private Disposable timer;
    private boolean cancelled;

    ScheduledTask(String ownerId, String taskId, Duration interval, BooleanSupplier liveness, Runnable work) {
        this.ownerId = ownerId;
        this.taskId = taskId;
        this.interval = interval;
        this.liveness = liveness;
        this.work = work;
    }

    synchronized void attach(Disposable timer) {
        if (cancelled) {
            timer.dispose();
        } else {
            this.timer = timer;
        }
    }

    synchronized void cancel() {
        cancelled = true;
        if (timer != null) {
            timer.dispose();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    void markRun(long now) {
        lastRunAt = now;
        runCount.incrementAndGet();
    }
}
