package testlab.master.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.dispatch.Dispatcher;
import testlab.master.model.Device;
import testlab.master.model.DeviceGroup;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.GroupMember;
import testlab.master.model.Job;
import testlab.master.model.JobStatus;
import testlab.master.model.ReservationResult;
import testlab.master.multinode.MultiNodeCoordinator;
import testlab.master.repository.DeviceGroupRepository;
import testlab.master.service.DeviceRegistry;
import testlab.master.service.JobQueue;
import testlab.master.service.JobService;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Matches queued jobs to devices: plan first, then reserve by compare-and-set,
 * then commit the job and hand the devices to the dispatcher.
 *
 * Passes hold no global lock and may run concurrently: the queue's in-flight
 * claims keep two passes off the same job, and per-device reservation keeps
 * them off the same device.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobQueue queue;
    private final DeviceRegistry registry;
    private final DeviceGroupRepository groupRepository;
    private final MultiNodeCoordinator coordinator;
    private final Dispatcher dispatcher;
    private final JobService jobService;

    public JobScheduler(JobQueue queue, DeviceRegistry registry, DeviceGroupRepository groupRepository,
            MultiNodeCoordinator coordinator, Dispatcher dispatcher, JobService jobService) {
        this.queue = queue;
        this.registry = registry;
        this.groupRepository = groupRepository;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.jobService = jobService;
    }

    /**
     * Walk the queue once in priority order and schedule every job that can
     * be placed right now. Jobs that cannot stay SUBMITTED.
     */
    public PassSummary runPass() {
        PassStats stats = new PassStats();

        for (Job job : queue.nextCandidates()) {
            stats.examined++;
            if (!queue.tryClaim(job.id())) {
                continue;
            }
            try {
                // another pass may have scheduled it since the candidates were read
                Optional<Job> fresh = queue.find(job.id()).filter(j -> j.status() == JobStatus.SUBMITTED);
                if (fresh.isEmpty()) {
                    continue;
                }
                if (fresh.get().isMultinode()) {
                    scheduleGroup(fresh.get(), stats);
                } else {
                    scheduleSingle(fresh.get(), stats);
                }
            } catch (RuntimeException e) {
                log.error("Scheduling of job {} failed", job.id(), e);
            } finally {
                queue.releaseClaim(job.id());
            }
        }

        PassSummary summary = stats.summary();
        if (summary.scheduled() > 0 || summary.conflicts() > 0) {
            log.info("Scheduling pass: {}", summary);
        } else {
            log.debug("Scheduling pass: {}", summary);
        }
        return summary;
    }

    private boolean scheduleSingle(Job job, PassStats stats) {
        List<Device> candidates;
        if (job.healthCheck()) {
            candidates = registry.find(job.requestedDevice())
                    .filter(Device::isAvailable)
                    .map(List::of)
                    .orElse(List.of());
        } else {
            DeviceRequirement req = job.requirement();
            candidates = new ArrayList<>(registry.findEligible(req.deviceType(), req.tags()));
        }

        for (Device device : candidates) {
            ReservationResult result = registry.reserve(device.hostname(), job.id());
            if (result == ReservationResult.RESERVED) {
                return commit(job, List.of(device), null, stats);
            }
            if (result == ReservationResult.CONFLICT) {
                stats.conflicts++;
            }
        }

        log.debug("Job {}: no eligible device available", job.id());
        return false;
    }

    private boolean scheduleGroup(Job job, PassStats stats) {
        Map<String, List<Device>> eligible = job.roles().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> new ArrayList<>(registry.findEligible(e.getValue().deviceType(), e.getValue().tags()))));

        Optional<Map<String, List<Device>>> plan = DeviceMatcher.match(job.roles(), eligible);
        if (plan.isEmpty()) {
            log.debug("Job {}: roles {} cannot all be satisfied now", job.id(), job.roles().keySet());
            return false;
        }

        List<Device> chosen = plan.get().values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparing(Device::hostname))
                .toList();

        List<Device> reserved = new ArrayList<>();
        for (Device device : chosen) {
            ReservationResult result = registry.reserve(device.hostname(), job.id());
            if (result != ReservationResult.RESERVED) {
                stats.conflicts++;
                log.warn("Job {}: {} on {}, rolling back {} reservations", job.id(), result, device.hostname(),
                        reserved.size());
                reserved.forEach(d -> registry.release(d.hostname(), job.id()));
                return false;
            }
            reserved.add(device);
        }

        String groupId = UUID.randomUUID().toString();
        List<GroupMember> members = new ArrayList<>();
        plan.get().forEach((role, devices) -> devices.stream()
                .sorted(Comparator.comparing(Device::hostname))
                .forEach(d -> members.add(GroupMember.scheduled(groupId, job.id(), members.size(), role,
                        d.hostname()))));
        DeviceGroup group = new DeviceGroup(groupId, job.id(), members, Instant.now());

        return commit(job, chosen, group, stats);
    }

    private boolean commit(Job job, List<Device> devices, DeviceGroup group, PassStats stats) {
        String groupId = group != null ? group.groupId() : null;
        if (!queue.markScheduled(job, groupId)) {
            log.warn("Job {} left SUBMITTED before it could be scheduled; releasing {} devices", job.id(),
                    devices.size());
            devices.forEach(d -> registry.release(d.hostname(), job.id()));
            return false;
        }
        stats.scheduled++;
        stats.devicesReserved += devices.size();

        Job scheduled = job.toBuilder().status(JobStatus.SCHEDULED).groupId(groupId).build();
        if (group != null) {
            groupRepository.save(group);
            coordinator.declareGroup(groupId, group.roleByHostname());
        }
        log.info("Job {} scheduled on {}{}", job.id(),
                devices.stream().map(Device::hostname).toList(),
                group != null ? " as group " + groupId : "");

        Map<String, String> failures = dispatcher.dispatch(scheduled, devices, group);
        failures.forEach((hostname, reason) -> jobService.reportOutcome(job.id(), hostname,
                DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, reason)));

        // canceled while the devices were being handed over
        if (queue.find(job.id()).map(Job::isTerminal).orElse(true)) {
            dispatcher.cancel(job.id());
            registry.releaseAll(job.id());
            if (group != null) {
                cancelOpenMembers(job.id());
                if (coordinator.isDeclared(groupId)) {
                    coordinator.teardown(groupId);
                }
            }
        }
        return true;
    }

    /**
     * A cancel that ran before the group was saved found no members to close;
     * close them here so none stays SCHEDULED under a finished job.
     */
    private void cancelOpenMembers(long jobId) {
        groupRepository.findByJobId(jobId).ifPresent(g -> {
            for (GroupMember m : g.members()) {
                if (!m.isTerminal()) {
                    groupRepository.updateMember(m.status(), m.withOutcome(DispatchOutcome.canceled("job canceled")));
                }
            }
        });
    }

    private static final class PassStats {
        int examined;
        int scheduled;
        int devicesReserved;
        int conflicts;

        PassSummary summary() {
            return new PassSummary(examined, scheduled, devicesReserved, conflicts);
        }
    }
}
