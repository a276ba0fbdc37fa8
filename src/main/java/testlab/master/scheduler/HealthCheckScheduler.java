package testlab.master.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.model.Device;
import testlab.master.model.DeviceHealth;
import testlab.master.model.DeviceStatus;
import testlab.master.service.DeviceRegistry;
import testlab.master.service.JobQueue;
import testlab.master.service.JobService;

import java.time.Duration;
import java.time.Instant;

/**
 * Queues health checks for devices that need one: health UNKNOWN or LOOPING,
 * or a last check older than the configured age. Offline, BAD, MAINTENANCE
 * and RETIRED devices are skipped, as are devices with a check already queued.
 */
public class HealthCheckScheduler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckScheduler.class);

    private final DeviceRegistry registry;
    private final JobQueue queue;
    private final JobService jobService;
    private final Duration staleAfter;

    public HealthCheckScheduler(DeviceRegistry registry, JobQueue queue, JobService jobService,
            Duration staleAfter) {
        this.registry = registry;
        this.queue = queue;
        this.jobService = jobService;
        this.staleAfter = staleAfter;
    }

    @Override
    public void run() {
        try {
            submitDueChecks();
        } catch (Exception e) {
            log.error("Health check scheduler error", e);
        }
    }

    /**
     * @return number of health checks queued
     */
    public int submitDueChecks() {
        Instant now = Instant.now();
        int submitted = 0;
        for (Device device : registry.findAll()) {
            if (!isDue(device, now) || queue.hasActiveHealthCheck(device.hostname())) {
                continue;
            }
            jobService.submitHealthCheck(device);
            submitted++;
            log.info("Health check queued for {} (health={}, last={})", device.hostname(), device.health(),
                    device.lastHealthCheck());
        }
        return submitted;
    }

    boolean isDue(Device device, Instant now) {
        DeviceHealth health = device.health();
        if (!health.isReservable() || device.status() == DeviceStatus.OFFLINE) {
            return false;
        }
        if (health == DeviceHealth.UNKNOWN || health == DeviceHealth.LOOPING) {
            return true;
        }
        return device.lastHealthCheck() == null || device.lastHealthCheck().plus(staleAfter).isBefore(now);
    }
}
