package testlab.master.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Snapshot of the job queue.
 *
 * @param oldestSubmittedAgeSeconds age of the oldest SUBMITTED job, 0 when the queue is empty
 */
public record QueueMetrics(
        @JsonProperty("depth") int depth,
        @JsonProperty("scheduled") int scheduled,
        @JsonProperty("running") int running,
        @JsonProperty("oldestSubmittedAgeSeconds") long oldestSubmittedAgeSeconds,
        @JsonProperty("pendingByDeviceType") Map<String, Integer> pendingByDeviceType) {
}
