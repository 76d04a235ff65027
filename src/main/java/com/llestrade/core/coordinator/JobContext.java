package com.llestrade.core.coordinator;

/**
 * What a running job sees of the coordinator: its cancellation flag and a channel for
 * progress and log lines.
 */
public interface JobContext extends CancellationToken {

    String jobId();

    void progress(String message);

    void log(String message);
}
