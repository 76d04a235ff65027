package com.llestrade.core.coordinator;

import com.llestrade.core.model.JobKind;

import java.util.Objects;

/**
 * A unit of background work. Requests with the same kind, group and target coalesce while
 * one of them is still queued or running.
 *
 * @param kind    convert, map or reduce
 * @param groupId owning group, or null
 * @param target  what the job produces (output path, group slug, ...)
 * @param work    the job body
 */
public record JobRequest(JobKind kind, String groupId, String target, JobWork work) {

    public JobRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(work, "work");
    }

    String coalesceKey() {
        return kind + "|" + (groupId == null ? "" : groupId) + "|" + target;
    }
}
