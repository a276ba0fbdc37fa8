package testlab.master.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.dispatch.DispatchCallback;
import testlab.master.dispatch.Dispatcher;
import testlab.master.model.CancelResult;
import testlab.master.model.Device;
import testlab.master.model.DeviceGroup;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.GroupMember;
import testlab.master.model.HealthProbeResult;
import testlab.master.model.Job;
import testlab.master.model.JobPriority;
import testlab.master.model.JobStatus;
import testlab.master.model.OutcomeResult;
import testlab.master.multinode.MultiNodeCoordinator;
import testlab.master.multinode.Participant;
import testlab.master.repository.DeviceGroupRepository;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Business logic for the job lifecycle: submission, cancellation,
 * resubmission, and the started/outcome callbacks of device pipelines.
 *
 * Callbacks and cancellation of one job are serialized on a striped lock;
 * different jobs proceed in parallel.
 */
public class JobService implements DispatchCallback {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String MASTER_SUBMITTER = "lab-master";
    private static final int LOCK_STRIPES = 64;

    private final JobQueue queue;
    private final DeviceRegistry registry;
    private final DeviceGroupRepository groupRepository;
    private final MultiNodeCoordinator coordinator;
    private final Dispatcher dispatcher;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public JobService(JobQueue queue, DeviceRegistry registry, DeviceGroupRepository groupRepository,
            MultiNodeCoordinator coordinator, Dispatcher dispatcher) {
        this.queue = queue;
        this.registry = registry;
        this.groupRepository = groupRepository;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    // ==================== Submission ====================

    /**
     * Validate and enqueue a job.
     *
     * @throws IllegalArgumentException if the device request is invalid
     */
    public Job submit(Job draft) {
        if (draft.healthCheck()) {
            throw new IllegalArgumentException("health checks are submitted by the master");
        }
        if (draft.isMultinode()) {
            for (Map.Entry<String, DeviceRequirement> e : draft.roles().entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    throw new IllegalArgumentException("role names must not be blank");
                }
                e.getValue().validate();
            }
        } else {
            draft.requirement().validate();
            if (draft.requirement().count() != 1) {
                throw new IllegalArgumentException("a single-device job needs exactly one device; use roles");
            }
        }
        return queue.enqueue(draft);
    }

    /**
     * Queue a health check pinned to the device.
     */
    public Job submitHealthCheck(Device device) {
        Job draft = Job.builder()
                .description("Health check on " + device.hostname())
                .submitter(MASTER_SUBMITTER)
                .priority(JobPriority.HIGH)
                .requirement(DeviceRequirement.of(device.deviceType()))
                .healthCheck(true)
                .requestedDevice(device.hostname())
                .build();
        return queue.enqueue(draft);
    }

    public Optional<Job> find(long jobId) {
        return queue.find(jobId);
    }

    public Optional<DeviceGroup> findGroup(long jobId) {
        return groupRepository.findByJobId(jobId);
    }

    /**
     * Queue a fresh copy of a finished job.
     *
     * @throws NoSuchElementException   if the job does not exist
     * @throws IllegalStateException    if the job has not finished
     * @throws IllegalArgumentException for health checks
     */
    public Job resubmit(long jobId) {
        Job original = queue.find(jobId)
                .orElseThrow(() -> new NoSuchElementException("Job not found: " + jobId));
        if (!original.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is still " + original.status());
        }
        if (original.healthCheck()) {
            throw new IllegalArgumentException("health checks cannot be resubmitted");
        }
        Job copy = queue.enqueue(original);
        log.info("Job {} resubmitted as {}", jobId, copy.id());
        return copy;
    }

    // ==================== Cancellation ====================

    /**
     * Cancel a job. A MultiNode job is canceled as a whole: every member is
     * canceled, blocked coordinator calls return CANCELED and all devices are
     * released.
     */
    public CancelResult cancel(long jobId) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            Optional<Job> current = queue.find(jobId);
            if (current.isEmpty()) {
                return CancelResult.NOT_FOUND;
            }
            if (current.get().isTerminal()) {
                return CancelResult.ALREADY_TERMINAL;
            }

            Optional<Job> canceled = queue.markComplete(jobId, DispatchOutcome.canceled("Canceled by request"));
            if (canceled.isEmpty()) {
                return CancelResult.ALREADY_TERMINAL;
            }

            Job job = canceled.get();
            if (job.isMultinode()) {
                groupRepository.findByJobId(jobId).ifPresent(group -> {
                    for (GroupMember m : group.members()) {
                        if (!m.isTerminal()) {
                            groupRepository.updateMember(m.status(),
                                    m.withOutcome(DispatchOutcome.canceled("job canceled")));
                        }
                    }
                    coordinator.teardown(group.groupId());
                });
            }
            dispatcher.cancel(jobId);
            registry.releaseAll(jobId);
            if (job.healthCheck() && job.requestedDevice() != null) {
                registry.markHealthUnknown(job.requestedDevice());
            }
            log.info("Job {} canceled", jobId);
            return CancelResult.CANCELED;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Dispatch callbacks ====================

    @Override
    public OutcomeResult reportStarted(long jobId, String hostname) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            Optional<Job> found = queue.find(jobId);
            if (found.isEmpty()) {
                return OutcomeResult.NOT_FOUND;
            }
            Job job = found.get();
            if (job.isTerminal()) {
                return OutcomeResult.ALREADY_TERMINAL;
            }
            if (job.status() == JobStatus.SUBMITTED || !holdsDevice(jobId, hostname)) {
                return OutcomeResult.WRONG_DEVICE;
            }

            if (job.isMultinode()) {
                DeviceGroup group = groupRepository.findByJobId(jobId).orElse(null);
                GroupMember member = group == null ? null : group.member(hostname).orElse(null);
                if (member == null) {
                    return OutcomeResult.WRONG_DEVICE;
                }
                if (member.isTerminal()) {
                    return OutcomeResult.ALREADY_TERMINAL;
                }
                if (member.status() == JobStatus.SCHEDULED) {
                    groupRepository.updateMember(JobStatus.SCHEDULED, member.withStatus(JobStatus.RUNNING));
                }
            }

            registry.markRunning(hostname, jobId);
            if (queue.markRunning(jobId).isEmpty()) {
                return OutcomeResult.ALREADY_TERMINAL;
            }
            log.debug("Job {} started on {}", jobId, hostname);
            return OutcomeResult.RECORDED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OutcomeResult reportOutcome(long jobId, String hostname, DispatchOutcome outcome) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            Optional<Job> found = queue.find(jobId);
            if (found.isEmpty()) {
                return OutcomeResult.NOT_FOUND;
            }
            Job job = found.get();
            if (job.isTerminal()) {
                return OutcomeResult.ALREADY_TERMINAL;
            }

            OutcomeResult result = job.isMultinode()
                    ? recordMemberOutcome(job, hostname, outcome)
                    : recordSingleOutcome(job, hostname, outcome);
            if (result == OutcomeResult.RECORDED) {
                dispatcher.forget(jobId, hostname);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private OutcomeResult recordSingleOutcome(Job job, String hostname, DispatchOutcome outcome) {
        if (job.status() == JobStatus.SUBMITTED || !holdsDevice(job.id(), hostname)) {
            return OutcomeResult.WRONG_DEVICE;
        }
        if (queue.markComplete(job.id(), outcome).isEmpty()) {
            return OutcomeResult.ALREADY_TERMINAL;
        }
        applyHealth(job, hostname, outcome);
        registry.release(hostname, job.id());
        return OutcomeResult.RECORDED;
    }

    private OutcomeResult recordMemberOutcome(Job job, String hostname, DispatchOutcome outcome) {
        DeviceGroup group = groupRepository.findByJobId(job.id()).orElse(null);
        GroupMember member = group == null ? null : group.member(hostname).orElse(null);
        if (member == null) {
            return OutcomeResult.WRONG_DEVICE;
        }
        if (member.isTerminal()) {
            return OutcomeResult.ALREADY_TERMINAL;
        }

        if (member.status() == JobStatus.SCHEDULED && !member.status().canTransitionTo(outcome.status())) {
            GroupMember running = member.withStatus(JobStatus.RUNNING);
            if (groupRepository.updateMember(JobStatus.SCHEDULED, running)) {
                member = running;
            }
        }
        if (!groupRepository.updateMember(member.status(), member.withOutcome(outcome))) {
            return OutcomeResult.ALREADY_TERMINAL;
        }
        log.info("Job {} member {} ({} on {}) ended {}", job.id(), member.subId(), member.role(), hostname,
                outcome.status());

        applyHealth(job, hostname, outcome);
        registry.release(hostname, job.id());

        if (outcome.status() == JobStatus.INCOMPLETE) {
            coordinator.peerFailed(group.groupId(), new Participant(member.role(), hostname));
            DeviceRequirement role = job.roles().get(member.role());
            if (role != null && role.essential()) {
                cancelRemainingMembers(job, group.groupId(),
                        "essential role '" + member.role() + "' failed on " + hostname);
            }
        }

        finishGroupIfDone(job);
        return OutcomeResult.RECORDED;
    }

    private void cancelRemainingMembers(Job job, String groupId, String reason) {
        DeviceGroup group = groupRepository.findById(groupId).orElseThrow();
        for (GroupMember m : group.members()) {
            if (m.isTerminal()) {
                continue;
            }
            if (groupRepository.updateMember(m.status(), m.withOutcome(DispatchOutcome.canceled(reason)))) {
                log.warn("Job {}: canceling member {} on {}: {}", job.id(), m.subId(), m.hostname(), reason);
                dispatcher.cancel(job.id(), m.hostname());
                registry.release(m.hostname(), job.id());
            }
        }
    }

    /**
     * Once every member is terminal, finish the job and tear the group down.
     * Any INCOMPLETE member makes the job INCOMPLETE, reported with the first
     * failure that is not a peer failure; else any CANCELED member makes it CANCELED.
     */
    private void finishGroupIfDone(Job job) {
        DeviceGroup group = groupRepository.findByJobId(job.id()).orElseThrow();
        if (!group.allTerminal()) {
            return;
        }

        DispatchOutcome jobOutcome = DispatchOutcome.complete();
        GroupMember cause = null;
        for (GroupMember m : group.members()) {
            if (m.status() == JobStatus.INCOMPLETE
                    && (cause == null || cause.failureKind() == FailureKind.PEER_FAILED)) {
                cause = m;
            }
            if (m.status() == JobStatus.CANCELED && jobOutcome.status() == JobStatus.COMPLETE) {
                jobOutcome = DispatchOutcome.canceled(m.failureComment());
            }
        }
        if (cause != null) {
            jobOutcome = DispatchOutcome.incomplete(cause.failureKind(),
                    cause.subId() + " (" + cause.role() + " on " + cause.hostname() + "): " + cause.failureComment());
        }

        queue.markComplete(job.id(), jobOutcome);
        coordinator.teardown(group.groupId());
    }

    /**
     * Health checks set device health from their outcome; an infrastructure
     * failure of any other job demotes the device to UNKNOWN.
     */
    private void applyHealth(Job job, String hostname, DispatchOutcome outcome) {
        if (job.healthCheck()) {
            switch (outcome.status()) {
                case COMPLETE -> registry.reportHealth(hostname, HealthProbeResult.PASS);
                case INCOMPLETE -> registry.reportHealth(hostname, HealthProbeResult.FAIL);
                default -> registry.markHealthUnknown(hostname);
            }
        } else if (outcome.failureKind() == FailureKind.INFRASTRUCTURE) {
            registry.markHealthUnknown(hostname);
        }
    }

    private boolean holdsDevice(long jobId, String hostname) {
        return registry.find(hostname)
                .map(d -> d.currentJobId() != null && d.currentJobId() == jobId)
                .orElse(false);
    }

    private ReentrantLock lockFor(long jobId) {
        return stripes[(int) Math.floorMod(jobId, (long) LOCK_STRIPES)];
    }
}
