package geoflow.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Runs the coordinator's housekeeping on one daemon thread:
 * <ul>
 *   <li>job-reaper: cancels jobs the execution tracker no longer runs</li>
 *   <li>work-failer: times out work items stuck in flight</li>
 *   <li>work-reaper: deletes workflow state of old terminal jobs</li>
 *   <li>direct-kick: re-invokes direct services so deferred work is picked up</li>
 * </ul>
 * Tasks never overlap; a task with a zero or negative period is not scheduled.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    /**
     * Run periods of the scheduled tasks.
     */
    public record Intervals(Duration jobReaper, Duration workFailer, Duration workReaper, Duration directKick) {
    }

    private record Task(String name, Runnable body, Duration period) {
    }

    private final List<Task> tasks;
    private final ScheduledExecutorService executor;

    private volatile boolean running = false;

    public Scheduler(JobReaper jobReaper, WorkFailer workFailer, WorkReaper workReaper, Runnable directKick,
            Intervals intervals) {
        this.tasks = List.of(
                new Task("job-reaper", jobReaper, intervals.jobReaper()),
                new Task("work-failer", workFailer, intervals.workFailer()),
                new Task("work-reaper", workReaper, intervals.workReaper()),
                new Task("direct-kick", directKick, intervals.directKick()));
        this.executor = Executors.newSingleThreadScheduledExecutor(daemonThreads());
    }

    private static ThreadFactory daemonThreads() {
        return r -> {
            Thread t = new Thread(r, "geoflow-scheduler");
            t.setDaemon(true);
            return t;
        };
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        int scheduled = 0;
        for (Task task : tasks) {
            long periodMs = task.period() == null ? 0 : task.period().toMillis();
            if (periodMs <= 0) {
                log.info("{} disabled", task.name());
                continue;
            }
            executor.scheduleAtFixedRate(guarded(task), periodMs, periodMs, TimeUnit.MILLISECONDS);
            log.info("{} scheduled every {}ms", task.name(), periodMs);
            scheduled++;
        }
        log.info("Scheduler started with {} of {} tasks", scheduled, tasks.size());
    }

    /**
     * Stops accepting runs and waits briefly for the current one to finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.info("Scheduler stopped");
            } else {
                executor.shutdownNow();
                log.warn("Scheduler did not stop within {}s, interrupted", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    // A thrown exception would cancel every later run of the task.
    private static Runnable guarded(Task task) {
        return () -> {
            long started = System.nanoTime();
            try {
                task.body().run();
            } catch (RuntimeException e) {
                log.error("{} run failed", task.name(), e);
            }
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (tookMs > task.period().toMillis()) {
                log.warn("{} took {}ms, longer than its {}ms period", task.name(), tookMs, task.period().toMillis());
            }
        };
    }
}
