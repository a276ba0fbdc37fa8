package testlab.master.repository;

import testlab.master.model.Job;
import testlab.master.model.JobStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Allocate a new unique job id.
     */
    long nextId();

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    Optional<Job> findById(long jobId);

    /**
     * Jobs in a status, oldest first.
     */
    List<Job> findByStatus(JobStatus status);

    /**
     * SUBMITTED jobs in queue order: health checks first, then priority
     * (highest first), then submit time, then id.
     */
    List<Job> findSubmittedInQueueOrder();

    /**
     * Non-terminal health-check job targeting a device, if any.
     */
    Optional<Job> findActiveHealthCheck(String hostname);

    /**
     * Write the status and lifecycle columns of {@code updated} if and only if
     * the stored job is still in {@code expected}.
     *
     * @return true if the row was updated
     */
    boolean compareAndSet(JobStatus expected, Job updated);

    int countByStatus(JobStatus status);

    /**
     * Number of SUBMITTED jobs per (primary) device type.
     */
    Map<String, Integer> countSubmittedByDeviceType();

    /**
     * Most recently submitted jobs first.
     */
    List<Job> findRecent(int limit);
}
