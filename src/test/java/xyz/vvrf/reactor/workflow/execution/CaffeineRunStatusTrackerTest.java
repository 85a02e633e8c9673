package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.reactor.workflow.core.CallFrame;
import xyz.vvrf.reactor.workflow.core.CallStack;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;

import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineRunStatusTrackerTest {

    private static final WorkflowGraph GRAPH = WorkflowGraphBuilder.named("tracked")
            .addNode("A", (input, results) -> Mono.empty())
            .build();

    private static ExecutionContext context(String runId, CallStack parent) {
        return new ExecutionContext(runId, GRAPH, Collections.<String, Object>emptyMap(),
                parent.push(new CallFrame(GRAPH.getName(), runId)),
                WorkflowOrchestrator.BUILT_IN_DEFAULTS, CancellationToken.create());
    }

    @Test
    void getStatus_shouldReflectLiveContext() {
        CaffeineRunStatusTracker tracker = new CaffeineRunStatusTracker();
        ExecutionContext root = context("run-root", CallStack.empty());
        ExecutionContext nested = context("run-nested", root.getCallStack());
        tracker.track(root);
        tracker.track(nested);

        root.transition(RunStatus.PENDING, RunStatus.RUNNING);

        assertThat(tracker.getStatus("run-root")).hasValueSatisfying(status -> {
            assertThat(status.getStatus()).isEqualTo(RunStatus.RUNNING);
            assertThat(status.getGraphName()).isEqualTo("tracked");
            assertThat(status.getParentRunId()).isEmpty();
        });
        assertThat(tracker.getStatus("run-nested")).hasValueSatisfying(status -> {
            assertThat(status.getStatus()).isEqualTo(RunStatus.PENDING);
            assertThat(status.getDepth()).isEqualTo(2);
            assertThat(status.getParentRunId()).contains("run-root");
        });
        assertThat(tracker.find(null)).isEmpty();
    }

    @Test
    void find_shouldKeepRunningRunsAndForgetThemAfterRetentionOnceFinished() throws InterruptedException {
        CaffeineRunStatusTracker tracker = new CaffeineRunStatusTracker(Duration.ofMillis(100), 100);
        ExecutionContext context = context("run-expiring", CallStack.empty());
        context.transition(RunStatus.PENDING, RunStatus.RUNNING);
        tracker.track(context);

        Thread.sleep(300);
        assertThat(tracker.find("run-expiring")).isPresent();

        context.transition(RunStatus.RUNNING, RunStatus.COMPLETED);
        tracker.markFinished(context);
        assertThat(tracker.find("run-expiring")).isPresent();

        Thread.sleep(300);
        assertThat(tracker.find("run-expiring")).isEmpty();
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new CaffeineRunStatusTracker(Duration.ZERO, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CaffeineRunStatusTracker(Duration.ofMinutes(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
