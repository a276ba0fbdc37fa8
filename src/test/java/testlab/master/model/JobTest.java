package testlab.master.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    @Test
    void buildSingleDeviceJob() {
        Job job = Job.builder()
                .id(3)
                .description("smoke")
                .requirement(DeviceRequirement.of("pixel", "wifi"))
                .build();

        assertEquals(JobPriority.MEDIUM, job.priority());
        assertEquals(JobStatus.SUBMITTED, job.status());
        assertFalse(job.isMultinode());
        assertEquals(1, job.deviceCount());
        assertEquals("pixel", job.primaryDeviceType());
        assertEquals(Set.of("wifi"), job.requirement().tags());
    }

    @Test
    void buildMultinodeJob() {
        Job job = Job.builder()
                .id(4)
                .roles(Map.of(
                        "server", DeviceRequirement.of("rack", 1, List.of()),
                        "client", DeviceRequirement.of("pixel", 3, List.of("5g"))))
                .build();

        assertTrue(job.isMultinode());
        assertEquals(4, job.deviceCount());
        assertEquals(List.of("client", "server"), List.copyOf(job.roles().keySet()));
        assertEquals("pixel", job.primaryDeviceType());
    }

    @Test
    void jobNeedsExactlyOneKindOfRequest() {
        assertThrows(IllegalArgumentException.class, () -> Job.builder().id(1).build());
        assertThrows(IllegalArgumentException.class, () -> Job.builder()
                .id(1)
                .requirement(DeviceRequirement.of("pixel"))
                .roles(Map.of("a", DeviceRequirement.of("pixel")))
                .build());
    }

    @Test
    void toBuilderKeepsIdentity() {
        Job original = Job.builder().id(9).requirement(DeviceRequirement.of("pixel")).build();
        Job running = original.toBuilder().status(JobStatus.RUNNING).build();

        assertEquals(JobStatus.SUBMITTED, original.status());
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals(original, running);
        assertTrue(running.toBuilder().status(JobStatus.CANCELED).build().isTerminal());
    }

    @Test
    void requirementMatchesTypeAndTagSubset() {
        Device device = Device.builder().hostname("h1").deviceType("pixel").tags(Set.of("wifi", "5g")).build();

        assertTrue(DeviceRequirement.of("pixel", "wifi").matches(device));
        assertTrue(DeviceRequirement.of("pixel").matches(device));
        assertFalse(DeviceRequirement.of("pixel", "nfc").matches(device));
        assertFalse(DeviceRequirement.of("rack").matches(device));
    }

    @Test
    void requirementValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new DeviceRequirement("pixel", 0, Set.of(), false).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new DeviceRequirement(" ", 1, Set.of(), false).validate());
        assertTrue(DeviceRequirement.of("pixel").asEssential().essential());
    }
}
