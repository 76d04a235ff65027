package com.llestrade.core.coordinator;

import com.llestrade.core.config.EngineProperties;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.events.AnalysisEvent;
import com.llestrade.core.events.EventBus;
import com.llestrade.core.logging.MdcContext;
import com.llestrade.core.metrics.AnalysisMetrics;
import com.llestrade.core.model.Job;
import com.llestrade.core.model.JobStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs convert, map and reduce jobs on a fixed pool of {@code maxConcurrency} threads fed by an
 * unbounded FIFO queue.
 * <p>
 * Each job moves {@code QUEUED -> RUNNING -> SUCCEEDED | FAILED | CANCELLED}. Cancelling a queued
 * job removes it before it starts; cancelling a running job moves it to CANCELLING and the job
 * stops at its next work-unit boundary. A failing job never affects its siblings. Lifecycle,
 * progress and log events go to the {@link EventBus} from the worker threads.
 */
@Service
public class WorkerCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkerCoordinator.class);

    private final AtomicLong jobCounter = new AtomicLong();
    private final int maxConcurrency;
    private final ThreadPoolExecutor executor;
    private final EventBus eventBus;
    private final AnalysisMetrics metrics;

    private final ConcurrentHashMap<String, TrackedJob> jobsById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TrackedJob> activeByKey = new ConcurrentHashMap<>();

    @Autowired
    public WorkerCoordinator(EngineProperties properties, EventBus eventBus, AnalysisMetrics metrics) {
        this(properties.getMaxConcurrency(), eventBus, metrics);
    }

    WorkerCoordinator(int maxConcurrency, EventBus eventBus, AnalysisMetrics metrics) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.maxConcurrency = maxConcurrency;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = new ThreadPoolExecutor(maxConcurrency, maxConcurrency, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), workerThreadFactory());
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Queues a job, or returns the handle of the queued/running job with the same kind, group
     * and target.
     */
    public JobHandle submit(JobRequest request) {
        TrackedJob fresh = new TrackedJob("job-" + jobCounter.incrementAndGet(), request);
        TrackedJob job = activeByKey.compute(request.coalesceKey(),
                (key, existing) -> existing != null && !existing.status.get().isTerminal() ? existing : fresh);
        if (job != fresh) {
            log.debug("Coalesced {} {} into {}", request.kind(), request.target(), job.id);
            return job.handle;
        }
        jobsById.put(job.id, job);
        publish(job, "job.queued", Map.of("target", request.target()));
        try {
            executor.execute(job.runnable);
        } catch (RejectedExecutionException e) {
            log.warn("Rejected {} job {} for {}: coordinator is shut down", request.kind(), job.id, request.target());
            if (job.status.compareAndSet(JobStatus.QUEUED, JobStatus.FAILED)) {
                finish(job, JobStatus.FAILED, "Coordinator is shut down");
            }
            return job.handle;
        }
        log.info("Queued {} job {} for {}", request.kind(), job.id, request.target());
        return job.handle;
    }

    /**
     * Requests cancellation. Returns false when the job had already finished.
     */
    public boolean cancel(JobHandle handle) {
        TrackedJob job = jobsById.get(handle.jobId());
        if (job == null) {
            return false;
        }
        job.cancelRequested = true;
        while (true) {
            JobStatus current = job.status.get();
            if (current == JobStatus.QUEUED) {
                if (job.status.compareAndSet(JobStatus.QUEUED, JobStatus.CANCELLED)) {
                    executor.remove(job.runnable);
                    log.info("Cancelled queued job {}", job.id);
                    finish(job, JobStatus.CANCELLED, null);
                    return true;
                }
            } else if (current == JobStatus.RUNNING) {
                if (job.status.compareAndSet(JobStatus.RUNNING, JobStatus.CANCELLING)) {
                    log.info("Cancellation requested for running job {}", job.id);
                    publish(job, "job.cancelling", Map.of());
                    return true;
                }
            } else {
                return current == JobStatus.CANCELLING;
            }
        }
    }

    /** Requests cancellation of every non-terminal job of a group. */
    public int cancelGroup(String groupId) {
        int count = 0;
        for (TrackedJob job : jobsById.values()) {
            if (groupId.equals(job.request.groupId()) && !job.status.get().isTerminal() && cancel(job.handle)) {
                count++;
            }
        }
        return count;
    }

    public JobStatus status(JobHandle handle) {
        return Optional.ofNullable(jobsById.get(handle.jobId()))
                .map(j -> j.status.get())
                .orElseThrow(() -> new IllegalArgumentException("Unknown job " + handle.jobId()));
    }

    public Optional<Job> job(JobHandle handle) {
        return Optional.ofNullable(jobsById.get(handle.jobId())).map(TrackedJob::snapshot);
    }

    public List<Job> activeJobs() {
        return jobsById.values().stream()
                .filter(j -> !j.status.get().isTerminal())
                .map(TrackedJob::snapshot)
                .sorted(Comparator.comparing(Job::submittedAt))
                .toList();
    }

    /** Jobs currently holding a worker thread. */
    public int runningCount() {
        return executor.getActiveCount();
    }

    @PreDestroy
    public void shutdown() {
        for (TrackedJob job : jobsById.values()) {
            if (!job.status.get().isTerminal()) {
                cancel(job.handle);
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after 30s; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void run(TrackedJob job) {
        if (!job.status.compareAndSet(JobStatus.QUEUED, JobStatus.RUNNING)) {
            return;
        }
        MdcContext.setJob(job.id, job.request.groupId(), job.request.kind().name());
        publish(job, "job.started", Map.of("target", job.request.target()));
        try {
            job.request.work().run(job.context);
            if (job.cancelRequested && job.status.get() == JobStatus.CANCELLING) {
                log.info("Job {} completed before observing cancellation", job.id);
            }
            finish(job, JobStatus.SUCCEEDED, null);
        } catch (CancellationRequestedException e) {
            log.info("Job {} cancelled: {}", job.id, e.getMessage());
            finish(job, JobStatus.CANCELLED, null);
        } catch (Exception e) {
            if (job.cancelRequested && Thread.currentThread().isInterrupted()) {
                finish(job, JobStatus.CANCELLED, null);
            } else {
                log.error("Job {} failed: {}", job.id, e.getMessage(), e);
                finish(job, JobStatus.FAILED, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        } catch (Error e) {
            log.error("Job {} failed with {}", job.id, e.toString(), e);
            finish(job, JobStatus.FAILED, e.toString());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void finish(TrackedJob job, JobStatus terminal, String error) {
        job.status.set(terminal);
        job.error = error;
        job.finishedAt = Instant.now();
        activeByKey.remove(job.request.coalesceKey(), job);

        Map<String, Object> payload = new HashMap<>();
        payload.put("target", job.request.target());
        if (error != null) {
            payload.put("error", error);
        }
        String eventType = switch (terminal) {
            case SUCCEEDED -> "job.succeeded";
            case FAILED -> "job.failed";
            default -> "job.cancelled";
        };
        publish(job, eventType, payload);
        if (metrics != null) {
            metrics.recordJobResult(job.request.kind().name(), terminal.name());
        }
        job.completion.complete(job.snapshot());
    }

    private void publish(TrackedJob job, String eventType, Map<String, Object> payload) {
        if (eventBus != null) {
            Map<String, Object> enriched = new HashMap<>(payload);
            enriched.put("kind", job.request.kind().name());
            eventBus.publish(AnalysisEvent.of(eventType, job.request.groupId(), job.id, enriched));
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class TrackedJob {
        final String id;
        final JobRequest request;
        final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.QUEUED);
        final CompletableFuture<Job> completion = new CompletableFuture<>();
        final Instant submittedAt = Instant.now();
        final JobHandle handle;
        final Runnable runnable;
        final JobContext context;
        volatile boolean cancelRequested;
        volatile String progress = "";
        volatile String error;
        volatile Instant finishedAt;

        TrackedJob(String id, JobRequest request) {
            this.id = id;
            this.request = request;
            this.handle = new JobHandle(id, request.kind(), request.groupId(), request.target(), completion);
            this.runnable = () -> WorkerCoordinator.this.run(this);
            this.context = new JobContext() {
                @Override
                public String jobId() {
                    return id;
                }

                @Override
                public boolean isCancellationRequested() {
                    return cancelRequested;
                }

                @Override
                public void progress(String message) {
                    progress = message;
                    publish(TrackedJob.this, "job.progress", Map.of("message", message));
                }

                @Override
                public void log(String message) {
                    log.info(message);
                    publish(TrackedJob.this, "job.log", Map.of("message", message));
                }
            };
        }

        Job snapshot() {
            return new Job(id, request.kind(), request.groupId(), request.target(), status.get(),
                    progress, error, submittedAt, finishedAt);
        }
    }
}
