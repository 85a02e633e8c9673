package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.workflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.reactor.workflow.core.CallFrame;
import xyz.vvrf.reactor.workflow.core.CallStack;
import xyz.vvrf.reactor.workflow.core.InputValidators;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.NodeStatus;
import xyz.vvrf.reactor.workflow.core.ResiliencePolicy;
import xyz.vvrf.reactor.workflow.core.ResultView;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.NodeFailedException;
import xyz.vvrf.reactor.workflow.exception.RunCancelledException;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.test.util.RecordingMonitorListener;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientNodeInvokerTest {

    private RecordingMonitorListener listener;
    private ResilientNodeInvoker invoker;

    @BeforeEach
    void setUp() {
        listener = new RecordingMonitorListener();
        invoker = new ResilientNodeInvoker(ResiliencePolicy.noRetry(Duration.ofSeconds(5)),
                Schedulers.boundedElastic(), Schedulers.parallel(),
                Collections.<WorkflowMonitorListener>singletonList(listener));
    }

    private static ExecutionContext contextFor(WorkflowGraph graph) {
        return new ExecutionContext("run-test", graph, Collections.<String, Object>emptyMap(),
                CallStack.empty().push(new CallFrame(graph.getName(), "run-test")),
                WorkflowOrchestrator.BUILT_IN_DEFAULTS, CancellationToken.create());
    }

    private Mono<NodeResult> invoke(ExecutionContext context, String nodeId) {
        WorkflowNode node = context.getGraph().getNode(nodeId).orElseThrow(IllegalStateException::new);
        return invoker.invoke(context, node, context.resolveInput(node, ResultView.empty()), ResultView.empty());
    }

    @Test
    void invoke_shouldRetryWithExactExponentialBackoffUntilAttemptsExhausted() {
        AtomicInteger calls = new AtomicInteger();
        NodeExecutor alwaysFails = (input, results) -> Mono.error(
                new IllegalStateException("failure #" + calls.incrementAndGet()));
        WorkflowGraph graph = WorkflowGraphBuilder.named("retry")
                .addNode("P", alwaysFails)
                .withRetry("P", 3, Duration.ofMillis(50), Duration.ofSeconds(1))
                .build();
        ExecutionContext context = contextFor(graph);

        long start = System.nanoTime();
        StepVerifier.create(invoke(context, "P"))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(NodeStatus.FAILED);
                    assertThat(result.getAttempts()).isEqualTo(3);
                    assertThat(result.getError()).hasValueSatisfying(error -> {
                        assertThat(error).isInstanceOf(NodeFailedException.class);
                        assertThat(((NodeFailedException) error).getAttempts()).isEqualTo(3);
                        assertThat(error.getCause()).hasMessage("failure #3");
                    });
                })
                .verifyComplete();
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(listener.getRetryBackoffs()).containsExactly(Duration.ofMillis(50), Duration.ofMillis(100));
        assertThat(listener.eventsStartingWith("nodeStart:retry:P")).containsExactly(
                "nodeStart:retry:P:1", "nodeStart:retry:P:2", "nodeStart:retry:P:3");
        assertThat(listener.eventsStartingWith("nodeFailure")).containsExactly("nodeFailure:retry:P:3");
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(150);
    }

    @Test
    void invoke_shouldSucceedOnLaterAttempt() {
        AtomicInteger calls = new AtomicInteger();
        NodeExecutor flaky = (input, results) -> calls.incrementAndGet() < 2
                ? Mono.error(new IllegalStateException("transient"))
                : Mono.just("done");
        WorkflowGraph graph = WorkflowGraphBuilder.named("flaky")
                .addNode("F", flaky)
                .withRetry("F", 3, Duration.ofMillis(10), Duration.ofSeconds(1))
                .build();

        StepVerifier.create(invoke(contextFor(graph), "F"))
                .assertNext(result -> {
                    assertThat(result.isCompleted()).isTrue();
                    assertThat(result.getOutput()).contains("done");
                    assertThat(result.getAttempts()).isEqualTo(2);
                })
                .verifyComplete();
        assertThat(listener.eventsStartingWith("nodeSuccess")).containsExactly("nodeSuccess:flaky:F");
    }

    @Test
    void invoke_shouldCountTimeoutAsFailedAttempt() {
        NodeExecutor slow = (input, results) -> Mono.delay(Duration.ofSeconds(2)).thenReturn("late");
        WorkflowGraph graph = WorkflowGraphBuilder.named("slow")
                .addNode("S", slow)
                .withRetry("S", 2, Duration.ofMillis(10), Duration.ofMillis(100))
                .build();

        StepVerifier.create(invoke(contextFor(graph), "S"))
                .assertNext(result -> {
                    assertThat(result.isFailed()).isTrue();
                    assertThat(result.getAttempts()).isEqualTo(2);
                    assertThat(result.getError().map(Throwable::getCause).orElse(null))
                            .isInstanceOf(TimeoutException.class);
                })
                .verifyComplete();
        assertThat(listener.eventsStartingWith("nodeTimeout")).containsExactly(
                "nodeTimeout:slow:S:1", "nodeTimeout:slow:S:2");
    }

    @Test
    void invoke_shouldNotRetryNonRetryableErrors() {
        AtomicInteger calls = new AtomicInteger();
        NodeExecutor cancelled = (input, results) -> {
            calls.incrementAndGet();
            return Mono.error(new RunCancelledException("other-run"));
        };
        WorkflowGraph graph = WorkflowGraphBuilder.named("fatal")
                .addNode("X", cancelled)
                .withRetry("X", 5, Duration.ofMillis(10), Duration.ofSeconds(1))
                .build();

        StepVerifier.create(invoke(contextFor(graph), "X"))
                .assertNext(result -> assertThat(result.getAttempts()).isEqualTo(1))
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(listener.getRetryBackoffs()).isEmpty();
    }

    @Test
    void invoke_shouldStopRetryingOnceRunIsCancelled() {
        AtomicInteger calls = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraphBuilder.named("cancelled")
                .addNode("X", (input, results) -> {
                    calls.incrementAndGet();
                    return Mono.error(new IllegalStateException("boom"));
                })
                .withRetry("X", 5, Duration.ofMillis(10), Duration.ofSeconds(1))
                .build();
        ExecutionContext context = contextFor(graph);
        context.getCancellationToken().cancel();

        StepVerifier.create(invoke(context, "X"))
                .assertNext(result -> assertThat(result.isFailed()).isTrue())
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void invoke_shouldRejectOutputFailingValidator() {
        WorkflowGraph graph = WorkflowGraphBuilder.named("validated")
                .addNode("V", (input, results) -> Mono.just("not-a-number"))
                .withOutputValidator("V", InputValidators.ofType(Integer.class))
                .build();

        StepVerifier.create(invoke(contextFor(graph), "V"))
                .assertNext(result -> {
                    assertThat(result.isFailed()).isTrue();
                    assertThat(result.getError().map(Throwable::getCause).orElse(null))
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("Output of node 'V' rejected");
                })
                .verifyComplete();
    }

    @Test
    void invoke_shouldRecordEmptyOutputAsCompleted() {
        WorkflowGraph graph = WorkflowGraphBuilder.named("empty-output")
                .addNode("E", (input, results) -> Mono.empty())
                .build();

        StepVerifier.create(invoke(contextFor(graph), "E"))
                .assertNext(result -> {
                    assertThat(result.isCompleted()).isTrue();
                    assertThat(result.getOutput()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void effectivePolicy_shouldPreferNodePolicyOverDefault() {
        ResiliencePolicy custom = ResiliencePolicy.of(4, Duration.ofMillis(1), Duration.ofSeconds(1));
        WorkflowGraph graph = WorkflowGraphBuilder.named("policies")
                .addNode("A", (input, results) -> Mono.empty())
                .addNode("B", (input, results) -> Mono.empty())
                .withPolicy("B", custom)
                .build();

        assertThat(Arrays.asList(
                invoker.effectivePolicy(graph.getNode("A").orElseThrow(IllegalStateException::new)),
                invoker.effectivePolicy(graph.getNode("B").orElseThrow(IllegalStateException::new))))
                .containsExactly(invoker.getDefaultPolicy(), custom);
    }
}
