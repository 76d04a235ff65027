package com.llestrade.core.coordinator;

import com.llestrade.core.events.AnalysisEvent;
import com.llestrade.core.events.EventBus;
import com.llestrade.core.metrics.AnalysisMetrics;
import com.llestrade.core.model.Job;
import com.llestrade.core.model.JobKind;
import com.llestrade.core.model.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerCoordinatorTest {

    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private WorkerCoordinator coordinator;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        coordinator = new WorkerCoordinator(2, eventBus, new AnalysisMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private static JobRequest request(String target, JobWork work) {
        return new JobRequest(JobKind.MAP, "G-1", target, work);
    }

    private static Job await(JobHandle handle) throws Exception {
        return handle.completion().get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("never runs more jobs than the concurrency limit")
    void concurrencyLimit() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch twoStarted = new CountDownLatch(2);
        List<JobHandle> handles = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            handles.add(coordinator.submit(request("doc-" + i, context -> {
                maxSeen.accumulateAndGet(running.incrementAndGet(), Math::max);
                twoStarted.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } finally {
                    running.decrementAndGet();
                }
            })));
        }

        assertTrue(twoStarted.await(5, TimeUnit.SECONDS));
        long queued = handles.stream().filter(h -> coordinator.status(h) == JobStatus.QUEUED).count();
        assertEquals(4, queued);
        release.countDown();

        for (JobHandle handle : handles) {
            assertEquals(JobStatus.SUCCEEDED, await(handle).status());
        }
        assertEquals(2, maxSeen.get());
    }

    @Nested
    @DisplayName("coalescing")
    class Coalescing {

        @Test
        @DisplayName("a duplicate of an active job returns the same handle")
        void duplicateReturnsSameHandle() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger runs = new AtomicInteger();
            JobWork work = context -> {
                runs.incrementAndGet();
                release.await(5, TimeUnit.SECONDS);
            };

            JobHandle first = coordinator.submit(request("out/a.md", work));
            JobHandle second = coordinator.submit(request("out/a.md", work));
            JobHandle other = coordinator.submit(request("out/b.md", work));

            assertSame(first, second);
            assertNotEquals(first.jobId(), other.jobId());
            release.countDown();
            await(first);
            await(other);
            assertEquals(2, runs.get());
        }

        @Test
        @DisplayName("a finished job does not absorb a new submission")
        void finishedJobIsNotReused() throws Exception {
            JobHandle first = coordinator.submit(request("out/a.md", context -> { }));
            await(first);

            JobHandle second = coordinator.submit(request("out/a.md", context -> { }));

            assertNotEquals(first.jobId(), second.jobId());
            assertEquals(JobStatus.SUCCEEDED, await(second).status());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("a queued job is cancelled without ever running")
        void cancelQueued() throws Exception {
            WorkerCoordinator single = new WorkerCoordinator(1, eventBus, null);
            try {
                CountDownLatch release = new CountDownLatch(1);
                AtomicBoolean secondRan = new AtomicBoolean();
                JobHandle blocker = single.submit(request("a", context -> release.await(5, TimeUnit.SECONDS)));
                JobHandle queued = single.submit(request("b", context -> secondRan.set(true)));

                assertTrue(single.cancel(queued));
                assertEquals(JobStatus.CANCELLED, single.status(queued));
                release.countDown();

                assertEquals(JobStatus.SUCCEEDED, await(blocker).status());
                assertEquals(JobStatus.CANCELLED, await(queued).status());
                assertFalse(secondRan.get());
            } finally {
                single.shutdown();
            }
        }

        @Test
        @DisplayName("a running job stops at its next check")
        void cancelRunning() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            AtomicInteger units = new AtomicInteger();
            JobHandle handle = coordinator.submit(request("long", context -> {
                started.countDown();
                for (int i = 0; i < 500; i++) {
                    context.throwIfCancellationRequested();
                    units.incrementAndGet();
                    Thread.sleep(10);
                }
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(coordinator.cancel(handle));

            Job job = await(handle);
            assertEquals(JobStatus.CANCELLED, job.status());
            assertNull(job.error());
            assertTrue(units.get() < 500);
        }

        @Test
        @DisplayName("cancelling a finished job reports false")
        void cancelFinished() throws Exception {
            JobHandle handle = coordinator.submit(request("quick", context -> { }));
            await(handle);

            assertFalse(coordinator.cancel(handle));
            assertEquals(JobStatus.SUCCEEDED, coordinator.status(handle));
        }

        @Test
        @DisplayName("cancelGroup reaches every active job of the group")
        void cancelGroup() throws Exception {
            List<JobHandle> handles = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                handles.add(coordinator.submit(request("doc-" + i, context -> {
                    while (true) {
                        context.throwIfCancellationRequested();
                        Thread.sleep(5);
                    }
                })));
            }

            assertEquals(4, coordinator.cancelGroup("G-1"));

            for (JobHandle handle : handles) {
                assertEquals(JobStatus.CANCELLED, await(handle).status());
            }
            assertTrue(coordinator.activeJobs().isEmpty());
        }
    }

    @Test
    @DisplayName("a failing job does not affect its siblings")
    void failureIsolation() throws Exception {
        JobHandle bad = coordinator.submit(request("bad", context -> {
            throw new IllegalStateException("provider exploded");
        }));
        JobHandle good = coordinator.submit(request("good", context -> context.progress("done")));

        Job failed = await(bad);
        Job succeeded = await(good);

        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("provider exploded", failed.error());
        assertNotNull(failed.finishedAt());
        assertEquals(JobStatus.SUCCEEDED, succeeded.status());
        assertEquals("done", succeeded.progress());
        assertEquals(1.0, registry.find("llestrade.jobs.total").tag("status", "FAILED").counter().count());
        assertEquals(1.0, registry.find("llestrade.jobs.total").tag("status", "SUCCEEDED").counter().count());
    }

    @Test
    @DisplayName("a job that throws an Error still fails and frees its target")
    void errorFailsJob() throws Exception {
        JobHandle broken = coordinator.submit(request("out/a.md", context -> {
            throw new AssertionError("stack corrupted");
        }));

        Job failed = await(broken);

        assertEquals(JobStatus.FAILED, failed.status());
        assertTrue(failed.error().contains("stack corrupted"), failed.error());
        JobHandle retry = coordinator.submit(request("out/a.md", context -> { }));
        assertNotEquals(broken.jobId(), retry.jobId());
        assertEquals(JobStatus.SUCCEEDED, await(retry).status());
    }

    @Test
    @DisplayName("a submission after shutdown fails instead of staying queued")
    void submitAfterShutdown() throws Exception {
        coordinator.shutdown();

        JobHandle late = coordinator.submit(request("out/a.md", context -> { }));

        Job job = await(late);
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("Coordinator is shut down", job.error());
        assertTrue(coordinator.activeJobs().isEmpty());
    }

    @Test
    @DisplayName("publishes lifecycle events in order")
    void lifecycleEvents() throws Exception {
        List<AnalysisEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("G-1", events::add);

        JobHandle handle = coordinator.submit(request("doc", context -> {
            context.progress("halfway");
            context.log("note");
        }));
        await(handle);

        assertEquals(List.of("job.queued", "job.started", "job.progress", "job.log", "job.succeeded"),
                events.stream().map(AnalysisEvent::eventType).toList());
        assertTrue(events.stream().allMatch(e -> handle.jobId().equals(e.jobId())));
        assertEquals("MAP", events.get(0).payload().get("kind"));
    }

    @Test
    @DisplayName("rejects a non-positive concurrency limit")
    void rejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerCoordinator(0, eventBus, null));
    }
}
