package testlab.master.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.core.MasterEvents;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.Job;
import testlab.master.model.JobStatus;
import testlab.master.repository.JobRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Submitted jobs in priority order, and the job lifecycle transitions.
 *
 * All status changes are compare-and-set against the stored status and are
 * validated against the {@link JobStatus} transition table. The in-flight
 * claim set keeps two scheduling passes from matching the same job.
 */
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private final JobRepository jobRepository;
    private final MasterEvents events;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public JobQueue(JobRepository jobRepository, MasterEvents events) {
        this.jobRepository = jobRepository;
        this.events = events;
    }

    /**
     * Store a new job as SUBMITTED with a fresh id and submit time.
     */
    public Job enqueue(Job draft) {
        Job job = draft.toBuilder()
                .id(jobRepository.nextId())
                .status(JobStatus.SUBMITTED)
                .submitTime(Instant.now())
                .startTime(null)
                .endTime(null)
                .groupId(null)
                .failureKind(null)
                .failureComment(null)
                .build();
        jobRepository.save(job);

        log.info("Job {} submitted (priority={}, {})", job.id(), job.priority(),
                job.isMultinode() ? "roles=" + job.roles().keySet() : "type=" + job.primaryDeviceType());
        events.fireQueueChanged();
        return job;
    }

    public Optional<Job> find(long jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> findByStatus(JobStatus status) {
        return jobRepository.findByStatus(status);
    }

    public List<Job> recent(int limit) {
        return jobRepository.findRecent(limit);
    }

    /**
     * SUBMITTED jobs: health checks first, then priority, submit time and id.
     * A job left SUBMITTED by a failed match shows up again on the next call.
     */
    public List<Job> nextCandidates() {
        return jobRepository.findSubmittedInQueueOrder();
    }

    public boolean hasActiveHealthCheck(String hostname) {
        return jobRepository.findActiveHealthCheck(hostname).isPresent();
    }

    // ==================== In-flight claims ====================

    /**
     * @return false if another pass is already working on the job
     */
    public boolean tryClaim(long jobId) {
        return inFlight.add(jobId);
    }

    public void releaseClaim(long jobId) {
        inFlight.remove(jobId);
    }

    public boolean isClaimed(long jobId) {
        return inFlight.contains(jobId);
    }

    // ==================== Transitions ====================

    /**
     * SUBMITTED to SCHEDULED, recording the group id of a MultiNode job.
     *
     * @return false if the job is no longer SUBMITTED (e.g. canceled meanwhile)
     */
    public boolean markScheduled(Job job, String groupId) {
        return transition(job.id(), JobStatus.SUBMITTED, JobStatus.SCHEDULED, b -> b.groupId(groupId))
                .isPresent();
    }

    /**
     * SCHEDULED to RUNNING, stamping the start time. A job already RUNNING is
     * left untouched.
     *
     * @return the running job, or empty if the job is in any other status
     */
    public Optional<Job> markRunning(long jobId) {
        Optional<Job> moved = transition(jobId, JobStatus.SCHEDULED, JobStatus.RUNNING,
                b -> b.startTime(Instant.now()));
        if (moved.isPresent()) {
            return moved;
        }
        return find(jobId).filter(j -> j.status() == JobStatus.RUNNING);
    }

    /**
     * Move a job to the terminal status of the outcome. A SCHEDULED job that
     * completes without having reported a start passes through RUNNING.
     *
     * @return the finished job, or empty if it was already terminal or unknown
     */
    public Optional<Job> markComplete(long jobId, DispatchOutcome outcome) {
        while (true) {
            Optional<Job> current = find(jobId);
            if (current.isEmpty() || current.get().isTerminal()) {
                return Optional.empty();
            }
            Job job = current.get();
            if (!job.status().canTransitionTo(outcome.status()) && job.status() == JobStatus.SCHEDULED) {
                markRunning(jobId);
                continue;
            }
            Optional<Job> done = transition(jobId, job.status(), outcome.status(), b -> b
                    .endTime(Instant.now())
                    .failureKind(outcome.failureKind())
                    .failureComment(outcome.reason()));
            if (done.isPresent()) {
                Job finished = done.get();
                log.info("Job {} finished: {}{}", jobId, finished.status(),
                        finished.failureKind() != null ? " (" + finished.failureKind() + ": "
                                + finished.failureComment() + ")" : "");
                events.fireQueueChanged();
                return done;
            }
            // lost a race with another transition; re-read
        }
    }

    /**
     * Compare-and-set {@code expected -> target} with extra column changes.
     *
     * @throws testlab.master.model.IllegalStateTransitionException if the table forbids the move
     */
    Optional<Job> transition(long jobId, JobStatus expected, JobStatus target, UnaryOperator<Job.Builder> changes) {
        JobStatus next = expected.transitionTo(target);
        Optional<Job> current = find(jobId);
        if (current.isEmpty() || current.get().status() != expected) {
            return Optional.empty();
        }
        Job updated = changes.apply(current.get().toBuilder().status(next)).build();
        if (!jobRepository.compareAndSet(expected, updated)) {
            log.debug("Job {} moved away from {} before {}", jobId, expected, target);
            return Optional.empty();
        }
        return Optional.of(updated);
    }

    // ==================== Metrics ====================

    public QueueMetrics metrics() {
        List<Job> submitted = jobRepository.findByStatus(JobStatus.SUBMITTED);
        long oldestAge = submitted.stream()
                .map(Job::submitTime)
                .filter(t -> t != null)
                .min(Instant::compareTo)
                .map(t -> Math.max(0, Duration.between(t, Instant.now()).toSeconds()))
                .orElse(0L);

        return new QueueMetrics(
                submitted.size(),
                jobRepository.countByStatus(JobStatus.SCHEDULED),
                jobRepository.countByStatus(JobStatus.RUNNING),
                oldestAge,
                jobRepository.countSubmittedByDeviceType());
    }
}
