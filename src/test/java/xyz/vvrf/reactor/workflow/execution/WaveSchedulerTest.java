package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.workflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.reactor.workflow.core.CallFrame;
import xyz.vvrf.reactor.workflow.core.CallStack;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.NodeStatus;
import xyz.vvrf.reactor.workflow.core.OutputBinding;
import xyz.vvrf.reactor.workflow.core.ResiliencePolicy;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.exception.NodeFailedException;
import xyz.vvrf.reactor.workflow.exception.OutputUnavailableException;
import xyz.vvrf.reactor.workflow.exception.RunCancelledException;
import xyz.vvrf.reactor.workflow.exception.RunFailedException;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.test.util.RecordingMonitorListener;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WaveSchedulerTest {

    private RecordingMonitorListener listener;
    private WaveScheduler waveScheduler;

    @BeforeEach
    void setUp() {
        listener = new RecordingMonitorListener();
        List<WorkflowMonitorListener> listeners = Collections.<WorkflowMonitorListener>singletonList(listener);
        ResilientNodeInvoker invoker = new ResilientNodeInvoker(ResiliencePolicy.noRetry(Duration.ofSeconds(5)),
                Schedulers.boundedElastic(), Schedulers.parallel(), listeners);
        CompensationCoordinator coordinator = new CompensationCoordinator(Duration.ofSeconds(5),
                Schedulers.parallel(), listeners);
        waveScheduler = new WaveScheduler(invoker, coordinator, listeners);
    }

    private static ExecutionContext newContext(WorkflowGraph graph, Map<String, Object> input, RunOptions options) {
        RunOptions effective = options.mergedWith(WorkflowOrchestrator.BUILT_IN_DEFAULTS);
        return new ExecutionContext("run-" + graph.getName(), graph, input,
                CallStack.empty().push(new CallFrame(graph.getName(), "run-" + graph.getName())),
                effective, CancellationToken.create());
    }

    private static ExecutionContext newContext(WorkflowGraph graph) {
        return newContext(graph, Collections.<String, Object>emptyMap(), RunOptions.defaults());
    }

    private static NodeExecutor constant(Object value) {
        return (input, results) -> Mono.just(value);
    }

    @Test
    void execute_shouldRunDependentsOnlyAfterTheirDependenciesFinish() {
        WorkflowGraph graph = WorkflowGraphBuilder.named("chain")
                .addNode("A", constant("a"))
                .addNode("B", constant("b"), "A")
                .addNode("C", (input, results) -> Mono.just(input.getDependencyOutputs()), "A", "B")
                .outputFromNode("result", "C")
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
                    assertThat(result.getWaves()).containsExactly(
                            Collections.singletonList("A"),
                            Collections.singletonList("B"),
                            Collections.singletonList("C"));
                    assertThat(result.getNodeResults().keySet()).containsExactly("A", "B", "C");

                    NodeResult a = result.getNodeResults().get("A");
                    NodeResult b = result.getNodeResults().get("B");
                    NodeResult c = result.getNodeResults().get("C");
                    assertThat(b.getStartedAt()).isAfterOrEqualTo(a.getFinishedAt());
                    assertThat(c.getStartedAt()).isAfterOrEqualTo(b.getFinishedAt());

                    @SuppressWarnings("unchecked")
                    Map<String, Object> seenByC = result.getOutput("result", Map.class);
                    assertThat(seenByC).containsEntry("A", "a").containsEntry("B", "b");
                })
                .verifyComplete();

        assertThat(listener.eventsStartingWith("runComplete")).containsExactly("runComplete:chain:COMPLETED");
    }

    @Test
    void execute_shouldHideSiblingResultsWithinTheSameWave() {
        Map<String, Set<String>> visible = new ConcurrentHashMap<>();
        NodeExecutor recordingView = (input, results) -> {
            visible.put(input.getNodeId(), new HashSet<>(results.getCompletedNodeIds()));
            return Mono.delay(Duration.ofMillis(20)).thenReturn(input.getNodeId());
        };
        WorkflowGraph graph = WorkflowGraphBuilder.named("diamond")
                .addNode("A", constant("a"))
                .addNode("B", recordingView, "A")
                .addNode("C", recordingView, "A")
                .addNode("D", recordingView, "B", "C")
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .assertNext(result -> assertThat(result.getWaves()).containsExactly(
                        Collections.singletonList("A"),
                        Arrays.asList("B", "C"),
                        Collections.singletonList("D")))
                .verifyComplete();

        assertThat(visible.get("B")).containsExactly("A");
        assertThat(visible.get("C")).containsExactly("A");
        assertThat(visible.get("D")).containsExactlyInAnyOrder("A", "B", "C");
    }

    @Test
    void execute_shouldPropagateSkipToDependentsButNotToIndependentNodes() {
        AtomicInteger dependentCalls = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraphBuilder.named("skip")
                .addNode("A", constant("a"))
                .withCondition("A", (input, results) -> false)
                .addNode("B", (input, results) -> {
                    dependentCalls.incrementAndGet();
                    return Mono.just("b");
                }, "A")
                .addNode("C", constant("c"))
                .output("fromB", OutputBinding.fromNode("B", "none"))
                .outputFromNode("fromC", "C")
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .assertNext(result -> {
                    assertThat(result.getNodeResults().get("A").getStatus()).isEqualTo(NodeStatus.SKIPPED);
                    assertThat(result.getNodeResults().get("B").getStatus()).isEqualTo(NodeStatus.SKIPPED);
                    assertThat(result.getNodeResults().get("C").getStatus()).isEqualTo(NodeStatus.COMPLETED);
                    assertThat(result.getOutputs()).containsEntry("fromB", "none").containsEntry("fromC", "c");
                })
                .verifyComplete();

        assertThat(dependentCalls.get()).isZero();
        assertThat(listener.eventsStartingWith("nodeSkipped")).containsExactlyInAnyOrder(
                "nodeSkipped:skip:A", "nodeSkipped:skip:B");
    }

    @Test
    void execute_shouldLetInFlightSiblingsFinishAndStopDispatchingAfterFailure() {
        List<String> compensated = new CopyOnWriteArrayList<>();
        AtomicInteger downstreamCalls = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraphBuilder.named("sibling")
                .addNode("F", (input, results) -> Mono.error(new IllegalStateException("F broke")))
                .addNode("S", (input, results) -> Mono.delay(Duration.ofMillis(200)).thenReturn("s"))
                .addNode("D", (input, results) -> {
                    downstreamCalls.incrementAndGet();
                    return Mono.just("d");
                }, "F", "S")
                .withCompensation("S", output -> Mono.fromRunnable(() -> compensated.add("S=" + output)))
                .build();
        ExecutionContext context = newContext(graph);

        StepVerifier.create(waveScheduler.execute(context))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RunFailedException.class);
                    RunFailure failure = ((RunFailedException) error).getFailure();
                    assertThat(failure.getStatus()).isEqualTo(RunStatus.COMPENSATED);
                    assertThat(failure.getTriggeringNodeId()).contains("F");
                    assertThat(failure.getCause()).isInstanceOf(NodeFailedException.class);
                    assertThat(failure.getPartialResults().get("S").getStatus()).isEqualTo(NodeStatus.COMPLETED);
                    assertThat(failure.getPartialResults().get("F").getStatus()).isEqualTo(NodeStatus.FAILED);
                    assertThat(failure.getPendingNodeIds()).containsExactly("D");
                    assertThat(failure.getCompensationReport().getCompensatedNodeIds()).containsExactly("S");
                })
                .verify(Duration.ofSeconds(5));

        assertThat(downstreamCalls.get()).isZero();
        assertThat(compensated).containsExactly("S=s");
        assertThat(context.getStatus()).isEqualTo(RunStatus.COMPENSATED);
        assertThat(listener.eventsStartingWith("runComplete")).containsExactly("runComplete:sibling:COMPENSATED");
    }

    @Test
    void execute_shouldCompensateCompletedNodesInReverseCompletionOrder() {
        List<String> compensated = new CopyOnWriteArrayList<>();
        WorkflowGraph graph = WorkflowGraphBuilder.named("saga")
                .addNode("reserve", constant("r"))
                .addNode("charge", constant("c"), "reserve")
                .addNode("ship", constant("s"), "charge")
                .addNode("notify", (input, results) -> Mono.error(new IllegalStateException("mail down")), "ship")
                .withCompensation("reserve", output -> Mono.fromRunnable(() -> compensated.add("reserve")))
                .withCompensation("charge", output -> Mono.fromRunnable(() -> compensated.add("charge")))
                .withCompensation("ship", output -> Mono.fromRunnable(() -> compensated.add("ship")))
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .expectError(RunFailedException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(compensated).containsExactly("ship", "charge", "reserve");
    }

    @Test
    void execute_shouldDeriveOutputsOfEmptyGraphFromRunInput() {
        WorkflowGraph graph = WorkflowGraphBuilder.named("empty")
                .input("x")
                .output("echo", OutputBinding.fromInput("x"))
                .build();
        ExecutionContext context = newContext(graph, Collections.<String, Object>singletonMap("x", 7), RunOptions.defaults());

        StepVerifier.create(waveScheduler.execute(context))
                .assertNext(result -> {
                    assertThat(result.getOutputs()).containsEntry("echo", 7);
                    assertThat(result.getWaves()).isEmpty();
                    assertThat(result.getNodeResults()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void execute_shouldFailAndCompensateWhenOutputCannotBeDerived() {
        List<String> compensated = new CopyOnWriteArrayList<>();
        WorkflowGraph graph = WorkflowGraphBuilder.named("no-output")
                .addNode("A", constant("a"))
                .addNode("B", constant("b"))
                .withCondition("B", (input, results) -> false)
                .withCompensation("A", output -> Mono.fromRunnable(() -> compensated.add("A")))
                .outputFromNode("result", "B")
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .expectErrorSatisfies(error -> {
                    RunFailure failure = ((RunFailedException) error).getFailure();
                    assertThat(failure.getCause()).isInstanceOf(OutputUnavailableException.class);
                    assertThat(failure.getTriggeringNodeId()).isEmpty();
                    assertThat(failure.getPendingNodeIds()).isEmpty();
                })
                .verify(Duration.ofSeconds(5));

        assertThat(compensated).containsExactly("A");
    }

    @Test
    void execute_shouldTreatThrowingConditionAsNodeFailure() {
        AtomicInteger calls = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraphBuilder.named("bad-condition")
                .addNode("A", (input, results) -> {
                    calls.incrementAndGet();
                    return Mono.just("a");
                })
                .withCondition("A", (input, results) -> {
                    throw new IllegalArgumentException("cannot decide");
                })
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .expectErrorSatisfies(error -> {
                    RunFailure failure = ((RunFailedException) error).getFailure();
                    assertThat(failure.getTriggeringNodeId()).contains("A");
                    assertThat(failure.getPartialResults().get("A").getAttempts()).isZero();
                })
                .verify(Duration.ofSeconds(5));
        assertThat(calls.get()).isZero();
    }

    @Test
    void execute_shouldRespectConcurrencyLimitWithinWave() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        NodeExecutor tracked = (input, results) -> Mono.defer(() -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return Mono.delay(Duration.ofMillis(30))
                    .then(Mono.fromCallable(() -> {
                        inFlight.decrementAndGet();
                        return input.getNodeId();
                    }));
        });
        WorkflowGraph graph = WorkflowGraphBuilder.named("limited")
                .addNode("A", tracked)
                .addNode("B", tracked)
                .addNode("C", tracked)
                .addNode("D", tracked)
                .build();
        ExecutionContext context = newContext(graph, Collections.<String, Object>emptyMap(),
                RunOptions.builder().concurrencyLimit(1).build());

        StepVerifier.create(waveScheduler.execute(context))
                .assertNext(result -> assertThat(result.getNodeResults()).hasSize(4))
                .verifyComplete();

        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    void execute_shouldRunWaveNodesConcurrentlyWhenUnbounded() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        NodeExecutor tracked = (input, results) -> Mono.defer(() -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return Mono.delay(Duration.ofMillis(200))
                    .then(Mono.fromCallable(() -> {
                        inFlight.decrementAndGet();
                        return input.getNodeId();
                    }));
        });
        WorkflowGraph graph = WorkflowGraphBuilder.named("unbounded")
                .addNode("A", tracked)
                .addNode("B", tracked)
                .addNode("C", tracked)
                .build();

        StepVerifier.create(waveScheduler.execute(newContext(graph)))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(maxInFlight.get()).isGreaterThan(1);
    }

    @Test
    void execute_shouldNotDispatchAnyWaveWhenAlreadyCancelled() {
        AtomicInteger calls = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraphBuilder.named("cancelled")
                .addNode("A", (input, results) -> {
                    calls.incrementAndGet();
                    return Mono.just("a");
                })
                .build();
        ExecutionContext context = newContext(graph);
        context.getCancellationToken().cancel();

        StepVerifier.create(waveScheduler.execute(context))
                .expectErrorSatisfies(error -> {
                    RunFailure failure = ((RunFailedException) error).getFailure();
                    assertThat(failure.getCause()).isInstanceOf(RunCancelledException.class);
                    assertThat(failure.getPendingNodeIds()).containsExactly("A");
                })
                .verify(Duration.ofSeconds(5));
        assertThat(calls.get()).isZero();
    }

    @Test
    void execute_shouldRefuseToStartContextTwice() {
        WorkflowGraph graph = WorkflowGraphBuilder.named("twice").addNode("A", constant("a")).build();
        ExecutionContext context = newContext(graph);

        StepVerifier.create(waveScheduler.execute(context)).expectNextCount(1).verifyComplete();
        StepVerifier.create(waveScheduler.execute(context))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
