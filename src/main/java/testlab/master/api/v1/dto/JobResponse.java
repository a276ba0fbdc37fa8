package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.model.DeviceGroup;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.GroupMember;
import testlab.master.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") long jobId,
        @JsonProperty("description") String description,
        @JsonProperty("submitter") String submitter,
        @JsonProperty("priority") String priority,
        @JsonProperty("status") String status,
        @JsonProperty("device") DeviceRequirement device,
        @JsonProperty("roles") Map<String, DeviceRequirement> roles,
        @JsonProperty("healthCheck") boolean healthCheck,
        @JsonProperty("requestedDevice") String requestedDevice,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("submitTime") Instant submitTime,
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("endTime") Instant endTime,
        @JsonProperty("failureKind") String failureKind,
        @JsonProperty("failureComment") String failureComment,
        @JsonProperty("members") List<MemberResponse> members) {

    /** One device of a MultiNode group. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MemberResponse(
            @JsonProperty("subId") String subId,
            @JsonProperty("role") String role,
            @JsonProperty("hostname") String hostname,
            @JsonProperty("status") String status,
            @JsonProperty("failureKind") String failureKind) {

        static MemberResponse from(GroupMember member) {
            return new MemberResponse(member.subId(), member.role(), member.hostname(), member.status().name(),
                    member.failureKind() == null ? null : member.failureKind().name());
        }
    }

    public static JobResponse from(Job job) {
        return from(job, null);
    }

    public static JobResponse from(Job job, DeviceGroup group) {
        List<MemberResponse> members = group == null ? null
                : group.members().stream().map(MemberResponse::from).toList();
        return new JobResponse(
                job.id(),
                job.description(),
                job.submitter(),
                job.priority().name(),
                job.status().name(),
                job.requirement(),
                job.isMultinode() ? job.roles() : null,
                job.healthCheck(),
                job.requestedDevice(),
                job.groupId(),
                job.submitTime(),
                job.startTime(),
                job.endTime(),
                job.failureKind() == null ? null : job.failureKind().name(),
                job.failureComment(),
                members);
    }
}
