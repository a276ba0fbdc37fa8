package testlab.master.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.config.MasterConfig;
import testlab.master.core.MasterEvents;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordinates background work on one thread:
 * - scheduling passes, on a timer and whenever the queue or devices change
 * - the reservation reaper
 * - health-check submission
 */
public class SchedulerDaemon implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerDaemon.class);

    private final ScheduledExecutorService executor;
    private final JobScheduler scheduler;
    private final ReservationReaper reaper;
    private final HealthCheckScheduler healthChecks;
    private final MasterConfig config;
    private final AtomicBoolean passPending = new AtomicBoolean(false);

    private volatile boolean running = false;

    public SchedulerDaemon(JobScheduler scheduler, ReservationReaper reaper, HealthCheckScheduler healthChecks,
            MasterEvents events, MasterConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lab-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = scheduler;
        this.reaper = reaper;
        this.healthChecks = healthChecks;
        this.config = config;

        events.onQueueChanged(this::requestPass);
        events.onDevicesChanged(this::requestPass);
    }

    public void start() {
        if (running) {
            log.warn("Scheduler daemon already running");
            return;
        }

        running = true;

        long passMs = config.passInterval().toMillis();
        executor.scheduleWithFixedDelay(wrapRunnable("scheduling-pass", this::pass), 0, passMs,
                TimeUnit.MILLISECONDS);
        log.info("Scheduling pass every {}ms", passMs);

        long reaperMs = config.reaperInterval().toMillis();
        executor.scheduleWithFixedDelay(reaper, reaperMs, reaperMs, TimeUnit.MILLISECONDS);
        log.info("Reservation reaper scheduled every {}ms", reaperMs);

        long healthMs = config.healthCheckInterval().toMillis();
        executor.scheduleWithFixedDelay(healthChecks, 0, healthMs, TimeUnit.MILLISECONDS);
        log.info("Health checks scheduled every {}ms", healthMs);

        log.info("Scheduler daemon started");
    }

    /**
     * Ask for a pass soon. Requests made while one is already pending are coalesced.
     */
    public void requestPass() {
        if (!running || !passPending.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(wrapRunnable("scheduling-pass", this::pass));
        } catch (RejectedExecutionException e) {
            passPending.set(false);
            log.debug("Pass request rejected: daemon stopping");
        }
    }

    private void pass() {
        passPending.set(false);
        scheduler.runPass();
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler daemon forcefully stopped");
            } else {
                log.info("Scheduler daemon stopped gracefully");
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

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
