package com.llestrade.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for job events, called from worker threads.
 * <p>
 * Subscribers attach to one analysis group, to a single job, or to everything. Job
 * subscriptions end on their own once the job publishes its terminal event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AnalysisEvent>>> groupSubscribers =
            new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AnalysisEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AnalysisEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AnalysisEvent event) {
        log.debug("Publishing {} for job {}", event.eventType(), event.jobId());

        if (event.groupId() != null) {
            deliverAll(groupSubscribers.get(event.groupId()), event);
        }
        if (event.jobId() != null) {
            deliverAll(event.isTerminal() ? jobSubscribers.remove(event.jobId()) : jobSubscribers.get(event.jobId()),
                    event);
        }
        deliverAll(globalSubscribers, event);
    }

    /**
     * Subscribe to every job of one analysis group.
     *
     * @param groupId  the group to follow
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String groupId, Consumer<AnalysisEvent> consumer) {
        log.debug("Subscribed to group {}", groupId);
        return register(groupSubscribers, groupId, consumer);
    }

    /** Follows one job until its succeeded, failed or cancelled event. */
    public Subscription subscribeJob(String jobId, Consumer<AnalysisEvent> consumer) {
        log.debug("Subscribed to job {}", jobId);
        return register(jobSubscribers, jobId, consumer);
    }

    public Subscription subscribeAll(Consumer<AnalysisEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of jobs that still have subscribers. */
    int jobSubscriptionCount() {
        return jobSubscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static Subscription register(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AnalysisEvent>>> byKey,
                                         String key, Consumer<AnalysisEvent> consumer) {
        byKey.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> byKey.computeIfPresent(key, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    private void deliverAll(List<Consumer<AnalysisEvent>> subscribers, AnalysisEvent event) {
        if (subscribers == null) {
            return;
        }
        for (Consumer<AnalysisEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for job {}: {}", event.eventType(), event.jobId(), e.getMessage(), e);
            }
        }
    }
}
