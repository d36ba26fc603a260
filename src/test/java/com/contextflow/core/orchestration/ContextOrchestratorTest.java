package com.contextflow.core.orchestration;

import com.contextflow.config.ContextFlowProperties;
import com.contextflow.core.context.ContextCatalog;
import com.contextflow.core.events.EventBus;
import com.contextflow.core.metrics.ContextFlowMetrics;
import com.contextflow.core.model.PhaseCondition;
import com.contextflow.core.model.RecoveryAction;
import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowResult;
import com.contextflow.core.model.WorkflowStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ContextOrchestratorTest {

    private final ContextCatalog catalog = ContextCatalog.defaults();
    private ExecutorService pool;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private List<String> events;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(e -> events.add(e.eventType()));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ContextOrchestrator orchestrator(RecoveryPolicy policy, PhaseExecutor... executors) {
        var registry = new PhaseExecutorRegistry(List.of(executors), new SimulatedPhaseExecutor(catalog));
        return new ContextOrchestrator(registry, policy, pool, eventBus,
                new ContextFlowMetrics(meterRegistry), null, null, 4, 0);
    }

    private ContextOrchestrator orchestrator(PhaseExecutor... executors) {
        return orchestrator(RecoveryPolicy.defaults(new ContextFlowProperties().getOrchestrator()), executors);
    }

    private static WorkflowPhase phase(String id, String context) {
        return phase(id, context, 30, 0, List.of());
    }

    private static WorkflowPhase phase(String id, String context, int timeout, int retries, List<String> outputs) {
        return new WorkflowPhase(id, context, id, "", List.of(), outputs, null, timeout, retries, List.of(), null);
    }

    private static WorkflowPhase grouped(String id, String context, String group) {
        return new WorkflowPhase(id, context, id, "", List.of(), List.of(), null, 30, 0, List.of(), group);
    }

    private static WorkflowDefinition workflow(List<WorkflowPhase> phases, Map<String, List<String>> deps) {
        return new WorkflowDefinition("wf_test", "test", "", phases, deps, 15, List.of(), Map.of(), null);
    }

    private static WorkflowDefinition linear() {
        return workflow(List.of(
                        phase("impl", "implementation", 30, 0, List.of("source_code")),
                        phase("test", "verification", 30, 0, List.of("test_results")),
                        phase("ship", "release", 30, 0, List.of("commit_hash"))),
                Map.of("test", List.of("impl"), "ship", List.of("test")));
    }

    private static void assertEveryPhaseTerminal(WorkflowResult result) {
        int total = (int) result.metrics().get("total_phases");
        int completed = (int) result.metrics().get("completed_phases");
        int failed = (int) result.metrics().get("failed_phases");
        int skipped = (int) result.metrics().get("skipped_phases");
        assertEquals(total, completed + failed + skipped, "every phase ends completed, failed or skipped");
    }

    @Nested
    @DisplayName("Successful execution")
    class Success {

        @Test
        @DisplayName("Linear workflow completes every phase in order")
        void linearWorkflow() {
            WorkflowResult result = orchestrator().execute(linear());

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(List.of("impl", "test", "ship"), result.phasesExecuted());
            assertTrue(result.phasesFailed().isEmpty());
            assertEquals(1.0, result.successRate(), 1e-9);
            assertEquals("source_code from impl", result.results().get("impl").get("source_code"));
            assertNotNull(result.completedAt());
            assertEquals(1.0, result.qualityScore(), 1e-9);
            assertEveryPhaseTerminal(result);
        }

        @Test
        @DisplayName("Lifecycle events bracket the phase events")
        void events() {
            orchestrator().execute(linear());

            assertEquals("workflow.started", events.get(0));
            assertEquals("workflow.completed", events.get(events.size() - 1));
            assertEquals(3, events.stream().filter("phase.completed"::equals).count());
        }

        @Test
        @DisplayName("Executing the same workflow twice yields the same results")
        void idempotent() {
            var orchestrator = orchestrator();
            WorkflowResult first = orchestrator.execute(linear());
            WorkflowResult second = orchestrator.execute(linear());

            assertEquals(first.status(), second.status());
            assertEquals(first.phasesExecuted(), second.phasesExecuted());
            assertEquals(first.results(), second.results());
            assertTrue(orchestrator.activeWorkflowIds().isEmpty());
        }

        @Test
        @DisplayName("Later phases receive propagated results and declared inputs")
        void inputPropagation() {
            var captured = new AtomicReference<Map<String, Object>>();
            var verification = new StubPhaseExecutor("verification", (phase, inputs, state) -> {
                captured.set(inputs);
                return Map.of("test_results", "ok");
            });
            var impl = phase("impl", "implementation", 30, 0, List.of("source_code"));
            var test = new WorkflowPhase("test", "verification", "test", "", List.of("source_code", "ticket"),
                    List.of("test_results"), null, 30, 0, List.of(), null);

            orchestrator(verification).execute(workflow(List.of(impl, test), Map.of("test", List.of("impl"))),
                    Map.of("ticket", "ABC-1"));

            Map<String, Object> inputs = captured.get();
            assertEquals("source_code from impl", inputs.get("source_code"));
            assertEquals("ABC-1", inputs.get("ticket"));
            @SuppressWarnings("unchecked")
            var previous = (Map<String, Object>) inputs.get("previous_impl");
            assertEquals("impl", previous.get(ResultPropagator.SOURCE_PHASE));
            assertEquals("test", previous.get(ResultPropagator.TARGET_PHASE));
        }

        @Test
        @DisplayName("Parallel group members run concurrently")
        void parallelGroup() {
            var bothStarted = new CountDownLatch(2);
            StubPhaseExecutor.Body rendezvous = (phase, inputs, state) -> {
                bothStarted.countDown();
                return Map.of("overlapped", bothStarted.await(5, TimeUnit.SECONDS));
            };
            var workflow = workflow(List.of(
                            phase("impl", "implementation"),
                            phase("test", "verification").withParallelGroup("parallel_group_1"),
                            phase("audit", "security-review").withParallelGroup("parallel_group_1")),
                    Map.of("test", List.of("impl"), "audit", List.of("impl")));

            WorkflowResult result = orchestrator(
                    new StubPhaseExecutor("verification", rendezvous),
                    new StubPhaseExecutor("security-review", rendezvous)).execute(workflow);

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(Boolean.TRUE, result.results().get("test").get("overlapped"));
            assertEquals(Boolean.TRUE, result.results().get("audit").get("overlapped"));
            assertNotNull(meterRegistry.find("contextflow.parallel.group_size").summary());
        }

        @Test
        @DisplayName("Phase whose condition is not met is skipped")
        void conditionSkip() {
            var guarded = new WorkflowPhase("docs", "documentation", "docs", "", List.of(), List.of(),
                    PhaseCondition.inputPresent("publish_docs"), 30, 0, List.of(), null);
            var wf = workflow(List.of(phase("impl", "implementation"), guarded), Map.of("docs", List.of("impl")));

            WorkflowResult skipped = orchestrator().execute(wf);
            assertEquals(WorkflowStatus.COMPLETED, skipped.status());
            assertEquals(List.of("impl"), skipped.phasesExecuted());
            assertEquals(1, skipped.metrics().get("skipped_phases"));

            WorkflowResult ran = orchestrator().execute(wf, Map.of("publish_docs", true));
            assertEquals(List.of("impl", "docs"), ran.phasesExecuted());
        }
    }

    @Nested
    @DisplayName("Failures and recovery")
    class Failures {

        @Test
        @DisplayName("Phase exceeding its timeout fails while the rest of the workflow completes")
        void timeout() {
            var slow = new StubPhaseExecutor("verification", (phase, inputs, state) -> {
                Thread.sleep(3000);
                return Map.of();
            });
            var workflow = workflow(List.of(
                            phase("impl", "implementation"),
                            new WorkflowPhase("test", "verification", "Slow Tests", "", List.of(), List.of(),
                                    null, 1, 0, List.of(), null),
                            phase("docs", "documentation")),
                    Map.of("test", List.of("impl"), "docs", List.of("impl")));

            long start = System.currentTimeMillis();
            WorkflowResult result = orchestrator(slow).execute(workflow);
            long elapsed = System.currentTimeMillis() - start;

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(List.of("test"), result.phasesFailed());
            assertEquals(List.of("impl", "docs"), result.phasesExecuted());
            assertTrue(result.errors().contains("Phase timeout: Slow Tests exceeded 1s"), result.errors().toString());
            assertTrue(result.warnings().contains("Consider increasing timeout for phase: Slow Tests"));
            assertTrue(elapsed < 3000, "timed-out phase must not block for its full duration");
            assertEquals(1.0, meterRegistry.find("contextflow.phase.timeouts").counter().count());
            assertEveryPhaseTerminal(result);
        }

        @Test
        @DisplayName("A timeout inside one parallel group does not stop its sibling or a later group")
        void timeoutInParallelGroup() {
            var slow = new StubPhaseExecutor("verification", (phase, inputs, state) -> {
                Thread.sleep(3000);
                return Map.of();
            });
            var workflow = workflow(List.of(
                            phase("impl", "implementation"),
                            new WorkflowPhase("test", "verification", "Slow Tests", "", List.of(), List.of(),
                                    null, 1, 0, List.of(), "group_checks"),
                            grouped("sec", "security-review", "group_checks"),
                            grouped("docs", "documentation", "group_writeup"),
                            grouped("notes", "research", "group_writeup"),
                            phase("ship", "release")),
                    Map.of("test", List.of("impl"), "sec", List.of("impl"),
                            "docs", List.of("impl"), "notes", List.of("impl"),
                            "ship", List.of("test", "sec", "docs", "notes")));

            WorkflowResult result = orchestrator(slow).execute(workflow);

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(List.of("test"), result.phasesFailed());
            assertEquals(5, result.phasesExecuted().size());
            assertTrue(result.phasesExecuted().containsAll(List.of("impl", "sec", "docs", "notes", "ship")));
            assertEquals("ship", result.phasesExecuted().get(4));
            assertEquals(List.of("Consider increasing timeout for phase: Slow Tests"), result.warnings());
            assertEquals(4, result.metrics().get("execution_steps"));
            assertEquals(2, meterRegistry.find("contextflow.parallel.group_size").summary().count());
            assertEveryPhaseTerminal(result);
        }

        @Test
        @DisplayName("Retryable failure is retried and then succeeds")
        void retryThenSucceed() {
            var flaky = new StubPhaseExecutor("implementation", (phase, inputs, state) -> {
                if (state.attempts(phase.phaseId()) == 1) {
                    throw new PhaseExecutionException(phase.phaseId(), "implementation", "connection reset", true, null);
                }
                return Map.of("source_code", "ok");
            });
            var workflow = workflow(List.of(phase("impl", "implementation", 30, 2, List.of("source_code"))), Map.of());

            WorkflowResult result = orchestrator(flaky).execute(workflow);

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(List.of("impl"), result.phasesExecuted());
            assertEquals(2, flaky.calls());
            assertEquals(1, result.metrics().get("recovery_actions"));
            assertTrue(events.contains("phase.recovery"));
        }

        @Test
        @DisplayName("Retries stop at the phase retry count")
        void retriesExhausted() {
            var broken = new StubPhaseExecutor("implementation", (phase, inputs, state) -> {
                throw new PhaseExecutionException(phase.phaseId(), "implementation", "connection reset", true, null);
            });
            var workflow = workflow(List.of(phase("impl", "implementation", 30, 1, List.of())), Map.of());

            WorkflowResult result = orchestrator(broken).execute(workflow);

            assertEquals(2, broken.calls());
            assertEquals(List.of("impl"), result.phasesFailed());
            assertEquals(WorkflowStatus.COMPLETED, result.status());
        }

        @Test
        @DisplayName("Missing declared outputs abort the workflow")
        void validationAbort() {
            var incomplete = new StubPhaseExecutor("implementation", (phase, inputs, state) -> Map.of("other", 1));

            WorkflowResult result = orchestrator(incomplete).execute(linear());

            assertEquals(WorkflowStatus.FAILED, result.status());
            assertEquals(List.of("impl"), result.phasesFailed());
            assertTrue(result.phasesExecuted().isEmpty());
            assertEquals(2, result.metrics().get("skipped_phases"));
            assertTrue(result.metrics().containsKey("failure_reason"));
            assertTrue(result.errors().stream().anyMatch(e -> e.contains("Missing expected output: source_code")));
            assertNull(result.qualityScore());
            assertEquals("workflow.failed", events.get(events.size() - 1));
            assertEveryPhaseTerminal(result);
        }

        @Test
        @DisplayName("Results carrying an error key fail validation")
        void errorKey() {
            var erroring = new StubPhaseExecutor("implementation",
                    (phase, inputs, state) -> Map.of("source_code", "x", "error", "compile failed"));

            assertEquals(WorkflowStatus.FAILED, orchestrator(erroring).execute(linear()).status());
        }

        @Test
        @DisplayName("Critical errors abort")
        void criticalAbort() {
            var critical = new StubPhaseExecutor("verification", (phase, inputs, state) -> {
                throw new IllegalStateException("Critical: test database corrupted");
            });

            WorkflowResult result = orchestrator(critical).execute(linear());

            assertEquals(WorkflowStatus.FAILED, result.status());
            assertEquals(List.of("impl"), result.phasesExecuted());
            assertEquals(List.of("test"), result.phasesFailed());
        }

        @Test
        @DisplayName("Unmatched errors abort")
        void unmatchedAbort() {
            var failing = new StubPhaseExecutor("release", (phase, inputs, state) -> {
                throw new IllegalStateException("remote rejected push");
            });

            WorkflowResult result = orchestrator(failing).execute(linear());

            assertEquals(WorkflowStatus.FAILED, result.status());
            assertTrue(String.valueOf(result.metrics().get("failure_reason")).contains("No recovery strategy found"));
        }

        @Test
        @DisplayName("Unknown context fails the context transition")
        void unknownContext() {
            WorkflowResult result = orchestrator().execute(workflow(List.of(phase("x", "astrology")), Map.of()));

            assertEquals(WorkflowStatus.FAILED, result.status());
            assertTrue(result.errors().stream().anyMatch(e -> e.contains("Invalid context transition")));
        }

        @Test
        @DisplayName("Alternating errors escalate instead of retrying further")
        void oscillationEscalates() {
            var alternating = new StubPhaseExecutor("implementation", (phase, inputs, state) -> {
                String message = state.attempts(phase.phaseId()) % 2 == 1 ? "lock timeout" : "stale cache";
                throw new PhaseExecutionException(phase.phaseId(), "implementation", message, true, null);
            });
            var workflow = workflow(List.of(
                            phase("impl", "implementation", 30, 5, List.of()),
                            phase("docs", "documentation")),
                    Map.of());

            WorkflowResult result = orchestrator(alternating).execute(workflow);

            assertEquals(3, alternating.calls());
            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(List.of("impl"), result.phasesFailed());
            assertEquals(List.of("docs"), result.phasesExecuted());
            assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("Escalated phase impl")));
        }

        @Test
        @DisplayName("Rollback restores context data before the next attempt")
        void rollback() {
            var policy = new RecoveryPolicy(List.of(RecoveryStrategy.of("always_rollback",
                    (phase, error, state) -> true, () -> RecoveryAction.rollback(1, "Roll back and retry"))));
            var dirtying = new StubPhaseExecutor("implementation", (phase, inputs, state) -> {
                if (state.attempts(phase.phaseId()) == 1) {
                    state.putContextData("half_written", true);
                    throw new IllegalStateException("write interrupted");
                }
                return Map.of("clean", !state.contextData().containsKey("half_written"));
            });
            var workflow = workflow(List.of(phase("impl", "implementation", 30, 1, List.of())), Map.of());

            WorkflowResult result = orchestrator(policy, dirtying).execute(workflow, Map.of("branch", "main"));

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(Boolean.TRUE, result.results().get("impl").get("clean"));
        }

        @Test
        @DisplayName("Skip action marks the phase skipped and continues")
        void skip() {
            var policy = new RecoveryPolicy(List.of(RecoveryStrategy.of("always_skip",
                    (phase, error, state) -> true, () -> RecoveryAction.skip("Optional phase"))));
            var failing = new StubPhaseExecutor("verification", (phase, inputs, state) -> {
                throw new IllegalStateException("flaky runner");
            });

            WorkflowResult result = orchestrator(policy, failing).execute(linear());

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(List.of("impl", "ship"), result.phasesExecuted());
            assertTrue(result.phasesFailed().isEmpty());
            assertEquals(1, result.metrics().get("skipped_phases"));
        }
    }

    @Test
    @DisplayName("Cancelling an in-flight workflow stops remaining steps")
    void cancel() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var blocking = new StubPhaseExecutor("implementation", (phase, inputs, state) -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Map.of("source_code", "done");
        });
        var orchestrator = orchestrator(blocking);

        CompletableFuture<WorkflowResult> running = CompletableFuture.supplyAsync(() -> orchestrator.execute(linear()));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(orchestrator.activeWorkflowIds().contains("wf_test"));

        assertTrue(orchestrator.cancel("wf_test"));
        release.countDown();
        WorkflowResult result = running.get(10, TimeUnit.SECONDS);

        assertEquals(WorkflowStatus.CANCELLED, result.status());
        assertEquals(List.of("impl"), result.phasesExecuted());
        assertEquals(2, result.metrics().get("skipped_phases"));
        assertFalse(orchestrator.cancel("wf_test"));
        assertTrue(events.contains("workflow.cancelled"));
    }

    @Test
    @DisplayName("Context switcher and policy loader are consulted on every transition")
    void collaborators() {
        var transitions = new CopyOnWriteArrayList<String>();
        ContextSwitcher switcher = (from, to, state) -> transitions.add(from + "->" + to);
        ContextPolicyLoader loader = context -> Map.of("max_files", 10);
        var captured = new AtomicReference<Map<String, Object>>();
        var release = new StubPhaseExecutor("release", (phase, inputs, state) -> {
            captured.set(inputs);
            return Map.of("commit_hash", "abc123");
        });
        var orchestrator = new ContextOrchestrator(
                new PhaseExecutorRegistry(List.of(release), new SimulatedPhaseExecutor(catalog)),
                RecoveryPolicy.defaults(new ContextFlowProperties().getOrchestrator()),
                pool, eventBus, null, switcher, loader, 2, 0);

        WorkflowResult result = orchestrator.execute(linear());

        assertEquals(WorkflowStatus.COMPLETED, result.status());
        assertEquals(List.of("null->implementation", "implementation->verification", "verification->release"),
                transitions);
        assertEquals(Map.of("max_files", 10), captured.get().get("verification_rules"));
    }
}
