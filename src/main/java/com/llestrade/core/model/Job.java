package com.llestrade.core.model;

import java.time.Instant;

/**
 * Point-in-time snapshot of a job.
 *
 * @param id          job id
 * @param kind        convert, map or reduce
 * @param groupId     owning analysis group (null for conversion)
 * @param target      what the job produces, used for coalescing duplicates
 * @param status      lifecycle status
 * @param progress    latest progress text
 * @param error       failure message, set only when FAILED
 * @param submittedAt when the job was submitted
 * @param finishedAt  when the job reached a terminal status, or null
 */
public record Job(
    String id,
    JobKind kind,
    String groupId,
    String target,
    JobStatus status,
    String progress,
    String error,
    Instant submittedAt,
    Instant finishedAt
) {}
