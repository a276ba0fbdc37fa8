package testlab.master.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.dispatch.Dispatcher;
import testlab.master.model.Device;
import testlab.master.model.DeviceGroup;
import testlab.master.model.DeviceStatus;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.GroupMember;
import testlab.master.model.Job;
import testlab.master.model.JobStatus;
import testlab.master.multinode.MultiNodeCoordinator;
import testlab.master.repository.DeviceGroupRepository;
import testlab.master.service.DeviceRegistry;
import testlab.master.service.JobQueue;
import testlab.master.service.JobService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Brings stored state back in line with what is actually running. Idempotent;
 * run once at start-up and then periodically.
 *
 * <ul>
 * <li>SCHEDULED jobs whose devices are still reserved but have no live
 * dispatch are dispatched again.</li>
 * <li>RUNNING jobs (or members) with no live dispatch are ended INCOMPLETE
 * with an infrastructure failure.</li>
 * <li>Reservations held for no active job are released.</li>
 * </ul>
 * Jobs claimed by an ongoing scheduling pass are left alone.
 */
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    private final JobQueue queue;
    private final DeviceRegistry registry;
    private final DeviceGroupRepository groupRepository;
    private final MultiNodeCoordinator coordinator;
    private final Dispatcher dispatcher;
    private final JobService jobService;

    public RecoveryService(JobQueue queue, DeviceRegistry registry, DeviceGroupRepository groupRepository,
            MultiNodeCoordinator coordinator, Dispatcher dispatcher, JobService jobService) {
        this.queue = queue;
        this.registry = registry;
        this.groupRepository = groupRepository;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.jobService = jobService;
    }

    public RecoveryReport reconcile() {
        Counts counts = new Counts();

        for (Job job : queue.findByStatus(JobStatus.SCHEDULED)) {
            withClaim(job, () -> resumeScheduled(job, counts));
        }
        for (Job job : queue.findByStatus(JobStatus.RUNNING)) {
            withClaim(job, () -> failLost(job, counts));
        }
        releaseOrphans(counts);
        dispatcher.purgeFinished();

        RecoveryReport report = counts.report();
        if (!report.isEmpty()) {
            log.info("Reconciled state: {}", report);
        }
        return report;
    }

    private void resumeScheduled(Job job, Counts counts) {
        List<Device> held = devicesHeldBy(job.id());

        if (!job.isMultinode()) {
            if (dispatcher.hasLiveDispatch(job.id())) {
                return;
            }
            if (held.isEmpty()) {
                queue.markComplete(job.id(), DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE,
                        "reservation lost"));
                counts.failed++;
                return;
            }
            counts.resumed += redispatch(job, held, null);
            return;
        }

        Optional<DeviceGroup> group = groupRepository.findByJobId(job.id());
        if (group.isEmpty()) {
            queue.markComplete(job.id(), DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE,
                    "group lost"));
            registry.releaseAll(job.id());
            counts.failed++;
            return;
        }
        ensureDeclared(group.get());

        List<Device> toDispatch = new ArrayList<>();
        for (GroupMember m : group.get().members()) {
            if (m.isTerminal() || dispatcher.hasLiveDispatch(job.id(), m.hostname())) {
                continue;
            }
            Optional<Device> device = held.stream().filter(d -> d.hostname().equals(m.hostname())).findFirst();
            if (device.isPresent() && device.get().status() == DeviceStatus.RESERVED) {
                toDispatch.add(device.get());
            } else {
                jobService.reportOutcome(job.id(), m.hostname(),
                        DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, "reservation lost"));
                counts.failed++;
            }
        }
        if (!toDispatch.isEmpty()) {
            counts.resumed += redispatch(job, toDispatch, group.get());
        }
    }

    private void failLost(Job job, Counts counts) {
        if (!job.isMultinode()) {
            if (dispatcher.hasLiveDispatch(job.id())) {
                return;
            }
            DispatchOutcome lost = DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, "no live dispatch");
            List<Device> held = devicesHeldBy(job.id());
            if (held.isEmpty()) {
                queue.markComplete(job.id(), lost);
            } else {
                jobService.reportOutcome(job.id(), held.get(0).hostname(), lost);
            }
            counts.failed++;
            return;
        }

        Optional<DeviceGroup> group = groupRepository.findByJobId(job.id());
        if (group.isEmpty()) {
            queue.markComplete(job.id(), DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, "group lost"));
            registry.releaseAll(job.id());
            counts.failed++;
            return;
        }
        ensureDeclared(group.get());

        for (GroupMember m : group.get().members()) {
            if (m.isTerminal() || dispatcher.hasLiveDispatch(job.id(), m.hostname())) {
                continue;
            }
            jobService.reportOutcome(job.id(), m.hostname(),
                    DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, "no live dispatch"));
            counts.failed++;
        }
    }

    private int redispatch(Job job, List<Device> devices, DeviceGroup group) {
        log.info("Resuming dispatch of job {} on {}", job.id(), devices.stream().map(Device::hostname).toList());
        Map<String, String> failures = dispatcher.dispatch(job, devices, group);
        failures.forEach((hostname, reason) -> jobService.reportOutcome(job.id(), hostname,
                DispatchOutcome.incomplete(FailureKind.INFRASTRUCTURE, reason)));
        return devices.size() - failures.size();
    }

    private void ensureDeclared(DeviceGroup group) {
        if (!coordinator.isDeclared(group.groupId())) {
            coordinator.restoreGroup(group.groupId(), group.roleByHostname());
        }
    }

    /**
     * Release busy devices whose job is unknown, not active, or (for a group)
     * whose member has already finished.
     */
    private void releaseOrphans(Counts counts) {
        for (Device device : registry.findBusy()) {
            Long jobId = device.currentJobId();
            if (jobId == null) {
                continue;
            }
            if (queue.isClaimed(jobId)) {
                continue;
            }
            Optional<Job> job = queue.find(jobId);
            boolean orphan = job.isEmpty()
                    || job.get().status() == JobStatus.SUBMITTED
                    || job.get().isTerminal()
                    || (job.get().isMultinode() && memberFinished(jobId, device.hostname()));
            if (orphan && registry.release(device.hostname(), jobId)) {
                log.warn("Released orphan reservation of {} for job {}", device.hostname(), jobId);
                counts.released++;
            }
        }
    }

    private boolean memberFinished(long jobId, String hostname) {
        return groupRepository.findByJobId(jobId)
                .flatMap(g -> g.member(hostname))
                .map(GroupMember::isTerminal)
                .orElse(true);
    }

    private List<Device> devicesHeldBy(long jobId) {
        return registry.findBusy().stream()
                .filter(d -> d.currentJobId() != null && d.currentJobId() == jobId)
                .toList();
    }

    private void withClaim(Job job, Runnable action) {
        if (!queue.tryClaim(job.id())) {
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Reconciliation of job {} failed", job.id(), e);
        } finally {
            queue.releaseClaim(job.id());
        }
    }

    private static final class Counts {
        int resumed;
        int failed;
        int released;

        RecoveryReport report() {
            return new RecoveryReport(resumed, failed, released);
        }
    }
}
