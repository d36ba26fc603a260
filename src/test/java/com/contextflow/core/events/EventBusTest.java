package com.contextflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("Workflow subscribers only see their workflow, global subscribers see all")
    void routing() {
        var wf1 = new CopyOnWriteArrayList<WorkflowEvent>();
        var all = new CopyOnWriteArrayList<WorkflowEvent>();
        eventBus.subscribe("wf-1", wf1::add);
        eventBus.subscribeAll(all::add);

        eventBus.publish(WorkflowEvent.of("phase.completed", "wf-1", "p1", Map.of()));
        eventBus.publish(WorkflowEvent.of("phase.completed", "wf-2", "p1", Map.of()));

        assertEquals(1, wf1.size());
        assertEquals(2, all.size());
    }

    @Test
    @DisplayName("Filters select by category, type and phase, and compose with and")
    void filters() {
        var phaseEvents = new CopyOnWriteArrayList<WorkflowEvent>();
        var outcomes = new CopyOnWriteArrayList<WorkflowEvent>();
        var verifyPhase = new CopyOnWriteArrayList<WorkflowEvent>();
        eventBus.subscribe(EventFilter.category("phase"), phaseEvents::add);
        eventBus.subscribe(EventFilter.types(WorkflowEvent.WORKFLOW_COMPLETED, WorkflowEvent.WORKFLOW_FAILED),
                outcomes::add);
        eventBus.subscribe(EventFilter.workflow("wf-1").and(EventFilter.phase("verify")), verifyPhase::add);

        eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_STARTED, "wf-1", null, Map.of()));
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_STARTED, "wf-1", "build", Map.of()));
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_FAILED, "wf-1", "verify", Map.of()));
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_COMPLETED, "wf-2", "verify", Map.of()));
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_FAILED, "wf-1", null, Map.of()));

        assertEquals(3, phaseEvents.size());
        assertEquals(List.of(WorkflowEvent.WORKFLOW_FAILED),
                outcomes.stream().map(WorkflowEvent::eventType).toList());
        assertEquals(1, verifyPhase.size());
        assertEquals(WorkflowEvent.PHASE_FAILED, verifyPhase.get(0).eventType());
    }

    @Test
    @DisplayName("The same consumer registered twice is removed one registration at a time")
    void duplicateRegistrations() {
        var received = new CopyOnWriteArrayList<WorkflowEvent>();
        EventBus.Subscription first = eventBus.subscribeAll(received::add);
        eventBus.subscribeAll(received::add);
        assertEquals(2, eventBus.subscriberCount());

        first.unsubscribe();
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_STARTED, "wf-1", null, Map.of()));

        assertEquals(1, eventBus.subscriberCount());
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Unsubscribed consumers receive nothing further")
    void unsubscribe() {
        var received = new CopyOnWriteArrayList<WorkflowEvent>();
        EventBus.Subscription subscription = eventBus.subscribe("wf-1", received::add);

        eventBus.publish(WorkflowEvent.of("workflow.started", "wf-1", null, Map.of()));
        subscription.unsubscribe();
        eventBus.publish(WorkflowEvent.of("workflow.completed", "wf-1", null, Map.of()));

        assertEquals(List.of("workflow.started"), received.stream().map(WorkflowEvent::eventType).toList());
    }

    @Test
    @DisplayName("A failing subscriber does not stop delivery to others")
    void failingSubscriber() {
        var received = new CopyOnWriteArrayList<WorkflowEvent>();
        eventBus.subscribeAll(e -> {
            throw new IllegalStateException("subscriber bug");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(WorkflowEvent.of("task.analyzed", "task_1", null, Map.of())));
        assertEquals(1, received.size());
        assertEquals(1, eventBus.deliveryFailures());
    }

    @Test
    @DisplayName("Concurrent publishers deliver every event")
    void concurrentPublish() throws InterruptedException {
        var received = new CopyOnWriteArrayList<WorkflowEvent>();
        eventBus.subscribeAll(received::add);
        int threads = 8;
        var done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            String phaseId = "p" + t;
            new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    eventBus.publish(WorkflowEvent.of("phase.started", "wf", phaseId, Map.of("i", i)));
                }
                done.countDown();
            }).start();
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(threads * 50, received.size());
    }
}
