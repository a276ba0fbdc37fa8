package testlab.master.repository;

import testlab.master.model.DeviceGroup;
import testlab.master.model.GroupMember;
import testlab.master.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for MultiNode groups and their members.
 */
public interface DeviceGroupRepository {

    /**
     * Save a group together with all of its members.
     */
    void save(DeviceGroup group);

    Optional<DeviceGroup> findById(String groupId);

    Optional<DeviceGroup> findByJobId(long jobId);

    /**
     * Write the status and failure columns of {@code updated} if and only if the
     * stored member is still in {@code expected}.
     *
     * @return true if the member was in the expected status
     */
    boolean updateMember(JobStatus expected, GroupMember updated);

    /**
     * Groups with at least one non-terminal member.
     */
    List<DeviceGroup> findActive();
}
