package testlab.master.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.model.DeviceGroup;
import testlab.master.model.GroupMember;

import java.util.Map;

/**
 * What a MultiNode device needs to know about its group.
 *
 * @param roles hostname to role for every member of the group
 */
public record GroupBinding(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("role") String role,
        @JsonProperty("subId") String subId,
        @JsonProperty("roles") Map<String, String> roles) {

    public GroupBinding {
        roles = Map.copyOf(roles);
    }

    public static GroupBinding of(DeviceGroup group, GroupMember member) {
        return new GroupBinding(group.groupId(), member.role(), member.subId(), group.roleByHostname());
    }
}
