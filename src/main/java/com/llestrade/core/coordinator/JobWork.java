package com.llestrade.core.coordinator;

/**
 * The body of a job. Throwing {@link com.llestrade.core.errors.CancellationRequestedException}
 * ends the job as CANCELLED; any other exception ends it as FAILED.
 */
@FunctionalInterface
public interface JobWork {

    void run(JobContext context) throws Exception;
}
