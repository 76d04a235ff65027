package com.llestrade.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while analysis jobs run.
 *
 * @param eventType event type (e.g. "job.queued", "job.progress", "job.failed")
 * @param groupId   the analysis group the job belongs to (nullable for project-wide conversion jobs)
 * @param jobId     the job this event relates to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AnalysisEvent(
    String eventType,
    String groupId,
    String jobId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    /** True for the last event a job publishes. */
    public boolean isTerminal() {
        return "job.succeeded".equals(eventType) || "job.failed".equals(eventType)
                || "job.cancelled".equals(eventType);
    }

    public static AnalysisEvent of(String eventType, String groupId, String jobId, Map<String, Object> payload) {
        return new AnalysisEvent(eventType, groupId, jobId, payload, Instant.now());
    }
}
