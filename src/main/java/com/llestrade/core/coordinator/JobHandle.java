package com.llestrade.core.coordinator;

import com.llestrade.core.model.Job;
import com.llestrade.core.model.JobKind;

import java.util.concurrent.CompletableFuture;

/**
 * Returned by {@link WorkerCoordinator#submit}. Two submissions that coalesced share the same handle.
 */
public final class JobHandle {

    private final String jobId;
    private final JobKind kind;
    private final String groupId;
    private final String target;
    private final CompletableFuture<Job> completion;

    JobHandle(String jobId, JobKind kind, String groupId, String target, CompletableFuture<Job> completion) {
        this.jobId = jobId;
        this.kind = kind;
        this.groupId = groupId;
        this.target = target;
        this.completion = completion;
    }

    public String jobId() { return jobId; }

    public JobKind kind() { return kind; }

    public String groupId() { return groupId; }

    public String target() { return target; }

    /** Completes with the final snapshot once the job reaches a terminal status. */
    public CompletableFuture<Job> completion() {
        return completion.copy();
    }

    @Override
    public String toString() {
        return "JobHandle[" + jobId + " " + kind + " " + target + "]";
    }
}
