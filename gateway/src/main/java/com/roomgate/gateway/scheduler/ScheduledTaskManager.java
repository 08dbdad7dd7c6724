package com.roomgate.gateway.scheduler;

import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Attaches recurring work to the lifecycle of an owning entity.
 * <p>
 * Tasks are keyed by (owner id, task id); registering an existing key is a no-op.
 * Before every run the task checks its owner's liveness and its own condition and
 * removes itself the first time either is false. Owners call {@link #stopAll(String)}
 * on destruction so no timer outlives the entity it references.
 * </p>
 * <p>
 * Timers run on the supplied Reactor {@link Scheduler}; tests pass a virtual-time scheduler.
 * </p>
 */
public class ScheduledTaskManager {
    private static final Logger log = LoggerFactory.getLogger(ScheduledTaskManager.class);

    private final Scheduler scheduler;
    private final Map<TaskKey, ScheduledTask> tasks = new ConcurrentHashMap<>();

    public ScheduledTaskManager(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public boolean addTask(TaskOwner owner, String taskId, Duration interval, Runnable work) {
        return addTask(owner, taskId, interval, work, () -> true);
    }

    /**
     * Registers a recurring task.
     *
     * @param owner     Owning entity; its liveness is checked before every run
     * @param taskId    Task name, unique per owner
     * @param interval  Period between runs (first run after one interval)
     * @param work      Work to run
     * @param condition Extra liveness predicate
     * @return true if scheduled, false if the key already exists or the owner is no longer alive
     */
    public boolean addTask(TaskOwner owner, String taskId, Duration interval, Runnable work,
                           BooleanSupplier condition) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(condition, "condition");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Task interval must be positive: " + interval);
        }
        if (!owner.isAlive()) {
            log.debug("Not scheduling task {} for {}: owner is no longer alive", taskId, owner.getTaskOwnerId());
            return false;
        }

        TaskKey key = new TaskKey(owner.getTaskOwnerId(), taskId);
        ScheduledTask task = new ScheduledTask(
            key.getOwnerId(), taskId, interval,
            () -> owner.isAlive() && condition.getAsBoolean(),
            work
        );
        if (tasks.putIfAbsent(key, task) != null) {
            log.debug("Task {} already scheduled for {}", taskId, key.getOwnerId());
            return false;
        }

        task.attach(Flux.interval(interval, scheduler)
            .subscribe(
                tick -> runTick(key, task),
                err -> log.error("Timer for task {} of {} failed", taskId, key.getOwnerId(), err)
            ));
        log.debug("Task {} scheduled for {} every {}ms", taskId, key.getOwnerId(), interval.toMillis());
        return true;
    }

    private void runTick(TaskKey key, ScheduledTask task) {
        if (tasks.get(key) != task) {
            return;
        }

        boolean live;
        try {
            live = task.getLiveness().getAsBoolean();
        } catch (Exception e) {
            log.warn("Liveness check of task {} for {} failed, stopping it", key.getTaskId(), key.getOwnerId(), e);
            live = false;
        }
        if (!live) {
            if (tasks.remove(key, task)) {
                task.cancel();
                log.debug("Task {} for {} stopped: owner no longer relevant", key.getTaskId(), key.getOwnerId());
            }
            return;
        }

        try {
            task.getWork().run();
            task.markRun(scheduler.now(TimeUnit.MILLISECONDS));
        } catch (Exception e) {
            log.error("Task {} for {} failed", key.getTaskId(), key.getOwnerId(), e);
        }
    }

    public boolean stopTask(String ownerId, String taskId) {
        ScheduledTask task = tasks.remove(new TaskKey(ownerId, taskId));
        if (task == null) {
            return false;
        }
        task.cancel();
        log.debug("Task {} for {} stopped", taskId, ownerId);
        return true;
    }

    /**
     * Cancels every task of an owner.
     *
     * @param ownerId Owner identity
     * @return number of tasks cancelled
     */
    public int stopAll(String ownerId) {
        int stopped = 0;
        for (Map.Entry<TaskKey, ScheduledTask> entry : tasks.entrySet()) {
            if (entry.getKey().getOwnerId().equals(ownerId) && tasks.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().cancel();
                stopped++;
            }
        }
        if (stopped > 0) {
            log.debug("Stopped {} task(s) for {}", stopped, ownerId);
        }
        return stopped;
    }

    public boolean hasTask(String ownerId, String taskId) {
        return tasks.containsKey(new TaskKey(ownerId, taskId));
    }

    public Optional<ScheduledTask> getTask(String ownerId, String taskId) {
        return Optional.ofNullable(tasks.get(new TaskKey(ownerId, taskId)));
    }

    public int taskCount(String ownerId) {
        return (int) tasks.keySet().stream().filter(key -> key.getOwnerId().equals(ownerId)).count();
    }

    public int size() {
        return tasks.size();
    }

    public void shutdown() {
        tasks.values().forEach(ScheduledTask::cancel);
        tasks.clear();
        log.info("Scheduled task manager stopped");
    }

    @Value
    private static class TaskKey {
        String ownerId;
        String taskId;
    }
}
