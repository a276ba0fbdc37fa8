package testlab.master.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.Job;
import testlab.master.model.JobPriority;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void singleDeviceJobFromJson() throws Exception {
        String json = """
                {
                  "description": "camera smoke test",
                  "submitter": "bob",
                  "priority": "low",
                  "device": { "deviceType": "pixel", "tags": ["camera", "nfc"] }
                }
                """;

        Job job = mapper.readValue(json, CreateJobRequest.class).toJob();

        assertEquals("camera smoke test", job.description());
        assertEquals("bob", job.submitter());
        assertEquals(JobPriority.LOW, job.priority());
        assertFalse(job.isMultinode());
        assertEquals(new DeviceRequirement("pixel", 1, Set.of("camera", "nfc"), false), job.requirement());
    }

    @Test
    void multinodeJobFromJson() throws Exception {
        String json = """
                {
                  "roles": {
                    "access-point": { "deviceType": "router", "essential": true },
                    "station":      { "deviceType": "pixel", "count": 3 }
                  }
                }
                """;

        Job job = mapper.readValue(json, CreateJobRequest.class).toJob();

        assertTrue(job.isMultinode());
        assertEquals(JobPriority.MEDIUM, job.priority());
        assertEquals(4, job.deviceCount());
        assertTrue(job.roles().get("access-point").essential());
        assertEquals(1, job.roles().get("access-point").count());
        assertEquals(3, job.roles().get("station").count());
    }

    @Test
    void deviceOrRolesButNotBoth() {
        DeviceRequirement pixel = DeviceRequirement.of("pixel");

        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest(null, null, null, null, null).toJob());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest(null, null, null, null, Map.of()).toJob());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest(null, null, null, pixel, Map.of("a", pixel)).toJob());
    }

    @Test
    void unknownPriorityIsRejected() {
        CreateJobRequest request = new CreateJobRequest(null, null, "urgent", DeviceRequirement.of("pixel"), null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, request::validate);
        assertTrue(e.getMessage().contains("urgent"));
    }
}
