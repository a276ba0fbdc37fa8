package testlab.master.scheduler;

import testlab.master.model.Device;
import testlab.master.model.DeviceRequirement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assigns distinct devices to every role slot of a MultiNode job.
 *
 * Each role contributes {@code count} slots; a slot may take any device
 * eligible for its role. Slots are matched with augmenting paths (Kuhn's
 * algorithm), so roles whose eligible sets overlap still get a full
 * assignment whenever one exists. Candidates are tried in the order given,
 * which keeps the oldest-idle preference where it does not cost feasibility.
 */
public final class DeviceMatcher {

    private DeviceMatcher() {
    }

    /**
     * @param roles    role to requirement
     * @param eligible role to eligible devices, in preference order
     * @return role to assigned devices, or empty if no full assignment exists
     */
    public static Optional<Map<String, List<Device>>> match(Map<String, DeviceRequirement> roles,
            Map<String, List<Device>> eligible) {
        List<String> slots = new ArrayList<>();
        new TreeMap<>(roles).forEach((role, req) -> {
            for (int i = 0; i < req.count(); i++) {
                slots.add(role);
            }
        });

        Map<String, Integer> slotOfDevice = new HashMap<>();
        Device[] deviceOfSlot = new Device[slots.size()];

        for (int slot = 0; slot < slots.size(); slot++) {
            if (!augment(slot, slots, eligible, slotOfDevice, deviceOfSlot, new HashSet<>())) {
                return Optional.empty();
            }
        }

        Map<String, List<Device>> assignment = new TreeMap<>();
        for (int slot = 0; slot < slots.size(); slot++) {
            assignment.computeIfAbsent(slots.get(slot), r -> new ArrayList<>()).add(deviceOfSlot[slot]);
        }
        return Optional.of(assignment);
    }

    private static boolean augment(int slot, List<String> slots, Map<String, List<Device>> eligible,
            Map<String, Integer> slotOfDevice, Device[] deviceOfSlot, Set<String> visited) {
        for (Device candidate : eligible.getOrDefault(slots.get(slot), List.of())) {
            if (!visited.add(candidate.hostname())) {
                continue;
            }
            Integer holder = slotOfDevice.get(candidate.hostname());
            if (holder == null || augment(holder, slots, eligible, slotOfDevice, deviceOfSlot, visited)) {
                slotOfDevice.put(candidate.hostname(), slot);
                deviceOfSlot[slot] = candidate;
                return true;
            }
        }
        return false;
    }
}
