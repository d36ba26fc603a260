package com.contextflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory event bus for task, workflow and phase lifecycle events.
 * <p>
 * Each subscriber registers with an {@link EventFilter} and only sees matching events.
 * Delivery is synchronous on the publishing thread, which for parallel groups is a phase
 * worker, so subscribers must be thread-safe. A subscriber that throws is logged and counted;
 * the remaining subscribers still receive the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong deliveryFailures = new AtomicLong();

    public void publish(WorkflowEvent event) {
        log.debug("Publishing {} for workflow {} phase {}", event.eventType(), event.workflowId(), event.phaseId());
        for (Registration registration : registrations) {
            if (registration.filter().accepts(event)) {
                deliver(registration, event);
            }
        }
    }

    /**
     * @return a {@link Subscription} handle that removes exactly this registration
     */
    public Subscription subscribe(EventFilter filter, Consumer<WorkflowEvent> consumer) {
        var registration = new Registration(filter, consumer);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /** Events of one workflow, or of one task for {@code task.analyzed}. */
    public Subscription subscribe(String workflowId, Consumer<WorkflowEvent> consumer) {
        return subscribe(EventFilter.workflow(workflowId), consumer);
    }

    public Subscription subscribeAll(Consumer<WorkflowEvent> consumer) {
        return subscribe(EventFilter.all(), consumer);
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /** Number of deliveries that failed because the subscriber threw. */
    public long deliveryFailures() {
        return deliveryFailures.get();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Registration registration, WorkflowEvent event) {
        try {
            registration.consumer().accept(event);
        } catch (RuntimeException e) {
            deliveryFailures.incrementAndGet();
            log.warn("Subscriber failed on {} for workflow {}: {}",
                    event.eventType(), event.workflowId(), e.getMessage(), e);
        }
    }

    // identity equality so that the same consumer can be registered twice and removed once
    private static final class Registration {
        private final EventFilter filter;
        private final Consumer<WorkflowEvent> consumer;

        Registration(EventFilter filter, Consumer<WorkflowEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        EventFilter filter() {
            return filter;
        }

        Consumer<WorkflowEvent> consumer() {
            return consumer;
        }
    }
}
