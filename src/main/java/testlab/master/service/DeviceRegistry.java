package testlab.master.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.core.MasterEvents;
import testlab.master.model.Device;
import testlab.master.model.DeviceHealth;
import testlab.master.model.DeviceStatus;
import testlab.master.model.HealthProbeResult;
import testlab.master.model.ReservationResult;
import testlab.master.repository.DeviceRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Device identity, health and occupancy.
 *
 * Every write to a device row happens under that device's lock, so the
 * reservation compare-and-set and the administrative read-modify-write
 * updates never interleave on one device. Different devices never contend.
 */
public class DeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    /** Oldest idle first, then hostname. Devices that never went idle sort first. */
    static final Comparator<Device> IDLE_ORDER = Comparator
            .comparing(Device::idleSince, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Device::hostname);

    private final DeviceRepository deviceRepository;
    private final MasterEvents events;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public DeviceRegistry(DeviceRepository deviceRepository, MasterEvents events) {
        this.deviceRepository = deviceRepository;
        this.events = events;
    }

    // ==================== Queries ====================

    public Optional<Device> find(String hostname) {
        return deviceRepository.findByHostname(hostname);
    }

    public List<Device> findAll() {
        return deviceRepository.findAll();
    }

    public List<Device> findBusy() {
        return deviceRepository.findBusy();
    }

    /**
     * Devices of the type carrying every required tag whose health allows
     * reservation. With {@code excludeOffline} only unoccupied IDLE devices are
     * returned. Iteration order is oldest idle first.
     */
    public Set<Device> findEligible(String deviceType, Collection<String> tags, boolean excludeOffline) {
        return deviceRepository.findByType(deviceType).stream()
                .filter(d -> d.hasAllTags(tags))
                .filter(d -> d.health().isReservable())
                .filter(d -> !excludeOffline || d.isAvailable())
                .sorted(IDLE_ORDER)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<Device> findEligible(String deviceType, Collection<String> tags) {
        return findEligible(deviceType, tags, true);
    }

    /**
     * Per type counts of idle, busy and offline devices. Retired devices are not counted.
     */
    public List<DeviceTypeSummary> typeSummary() {
        Map<String, int[]> counts = new TreeMap<>();
        for (Device d : deviceRepository.findAll()) {
            if (d.health() == DeviceHealth.RETIRED) {
                continue;
            }
            int[] c = counts.computeIfAbsent(d.deviceType(), k -> new int[3]);
            if (d.status() == DeviceStatus.IDLE) {
                c[0]++;
            } else if (d.status().isBusy()) {
                c[1]++;
            } else {
                c[2]++;
            }
        }
        return counts.entrySet().stream()
                .map(e -> new DeviceTypeSummary(e.getKey(), e.getValue()[0], e.getValue()[1], e.getValue()[2]))
                .toList();
    }

    // ==================== Reservation ====================

    /**
     * Compare-and-set IDLE to RESERVED for the job. The row is committed before
     * this returns.
     */
    public ReservationResult reserve(String hostname, long jobId) {
        ReentrantLock lock = lockFor(hostname);
        lock.lock();
        try {
            ReservationResult result = deviceRepository.reserve(hostname, jobId);
            if (result == ReservationResult.RESERVED) {
                log.debug("Reserved {} for job {}", hostname, jobId);
            } else {
                log.debug("Reservation of {} for job {} refused: {}", hostname, jobId, result);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * RESERVED to RUNNING for the owning job.
     *
     * @return false if the device is not reserved by that job
     */
    public boolean markRunning(String hostname, long jobId) {
        ReentrantLock lock = lockFor(hostname);
        lock.lock();
        try {
            return deviceRepository.markRunning(hostname, jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a device held by the job to IDLE (or OFFLINE when its health
     * forbids reservation) and clear its current job.
     *
     * @return false if the device was not held by that job
     */
    public boolean release(String hostname, long jobId) {
        ReentrantLock lock = lockFor(hostname);
        boolean released;
        lock.lock();
        try {
            released = deviceRepository.release(hostname, jobId);
        } finally {
            lock.unlock();
        }
        if (released) {
            log.debug("Released {} from job {}", hostname, jobId);
            events.fireDevicesChanged();
        }
        return released;
    }

    /**
     * Release every device still held by the job.
     *
     * @return number of devices released
     */
    public int releaseAll(long jobId) {
        int released = 0;
        for (Device d : deviceRepository.findBusy()) {
            if (d.currentJobId() != null && d.currentJobId() == jobId && release(d.hostname(), jobId)) {
                released++;
            }
        }
        return released;
    }

    // ==================== Administration ====================

    /**
     * Register a new device: IDLE, health UNKNOWN (so a health check runs first).
     *
     * @throws IllegalArgumentException on invalid input or a duplicate hostname
     */
    public Device register(String hostname, String deviceType, Collection<String> tags) {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname is required");
        }
        if (deviceType == null || deviceType.isBlank()) {
            throw new IllegalArgumentException("deviceType is required");
        }
        if (tags != null && tags.stream().anyMatch(t -> t == null || t.isBlank() || t.contains(","))) {
            throw new IllegalArgumentException("tags must be non-blank and must not contain commas");
        }

        Instant now = Instant.now();
        Device device = Device.builder()
                .hostname(hostname.trim())
                .deviceType(deviceType.trim())
                .tags(tags)
                .health(DeviceHealth.UNKNOWN)
                .status(DeviceStatus.IDLE)
                .idleSince(now)
                .registeredAt(now)
                .build();

        ReentrantLock lock = lockFor(device.hostname());
        lock.lock();
        try {
            deviceRepository.save(device);
        } finally {
            lock.unlock();
        }

        log.info("Registered device {} ({}) tags={}", device.hostname(), device.deviceType(), device.tags());
        events.fireDevicesChanged();
        return device;
    }

    /**
     * Health MAINTENANCE; an idle device goes OFFLINE, a busy one when released.
     */
    public Device putIntoMaintenance(String hostname) {
        return modify(hostname, d -> {
            Device.Builder b = d.toBuilder().health(DeviceHealth.MAINTENANCE);
            if (d.status() == DeviceStatus.IDLE) {
                b.status(d.status().transitionTo(DeviceStatus.OFFLINE));
            }
            return b.build();
        });
    }

    /**
     * Bring a device back: health UNKNOWN (forces a health check) and, if
     * offline, IDLE again.
     */
    public Device putOnline(String hostname) {
        return modify(hostname, d -> {
            Device.Builder b = d.toBuilder().health(DeviceHealth.UNKNOWN);
            if (d.status() == DeviceStatus.OFFLINE) {
                b.status(d.status().transitionTo(DeviceStatus.IDLE)).idleSince(Instant.now());
            }
            return b.build();
        });
    }

    public Device retire(String hostname) {
        return modify(hostname, d -> {
            Device.Builder b = d.toBuilder().health(DeviceHealth.RETIRED);
            if (d.status() == DeviceStatus.IDLE) {
                b.status(d.status().transitionTo(DeviceStatus.OFFLINE));
            }
            return b.build();
        });
    }

    /** Health LOOPING: the device runs health checks back to back. */
    public Device setLooping(String hostname) {
        return modify(hostname, d -> d.toBuilder().health(DeviceHealth.LOOPING).build());
    }

    /**
     * Apply a health probe result. PASS makes the device GOOD and brings an
     * offline device back to IDLE; FAIL makes it BAD and takes it OFFLINE if idle. A LOOPING device keeps its health;
     * MAINTENANCE and RETIRED are administrative and are not overridden.
     */
    public Device reportHealth(String hostname, HealthProbeResult result) {
        return modify(hostname, d -> {
            Device.Builder b = d.toBuilder().lastHealthCheck(Instant.now());
            if (d.health() == DeviceHealth.LOOPING || d.health() == DeviceHealth.MAINTENANCE
                    || d.health() == DeviceHealth.RETIRED) {
                return b.build();
            }
            if (result == HealthProbeResult.PASS) {
                b.health(DeviceHealth.GOOD);
                if (d.status() == DeviceStatus.OFFLINE) {
                    b.status(d.status().transitionTo(DeviceStatus.IDLE)).idleSince(Instant.now());
                }
            } else {
                b.health(DeviceHealth.BAD);
                if (d.status() == DeviceStatus.IDLE) {
                    b.status(d.status().transitionTo(DeviceStatus.OFFLINE));
                }
            }
            return b.build();
        });
    }

    /**
     * Drop a GOOD or BAD device back to UNKNOWN so it gets a fresh health check.
     */
    public Device markHealthUnknown(String hostname) {
        return modify(hostname, d -> {
            if (d.health() == DeviceHealth.GOOD || d.health() == DeviceHealth.BAD) {
                return d.toBuilder().health(DeviceHealth.UNKNOWN).build();
            }
            return d;
        });
    }

    private Device modify(String hostname, UnaryOperator<Device> change) {
        ReentrantLock lock = lockFor(hostname);
        Device before;
        Device after;
        lock.lock();
        try {
            before = deviceRepository.findByHostname(hostname)
                    .orElseThrow(() -> new NoSuchElementException("Unknown device: " + hostname));
            after = change.apply(before);
            if (after != before) {
                deviceRepository.update(after);
            }
        } finally {
            lock.unlock();
        }

        if (before.health() != after.health() || before.status() != after.status()) {
            log.info("Device {}: health {} -> {}, status {} -> {}", hostname,
                    before.health(), after.health(), before.status(), after.status());
            events.fireDevicesChanged();
        }
        return after;
    }

    private ReentrantLock lockFor(String hostname) {
        return locks.computeIfAbsent(hostname, h -> new ReentrantLock());
    }
}
