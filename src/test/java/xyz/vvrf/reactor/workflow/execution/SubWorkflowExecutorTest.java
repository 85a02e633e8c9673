package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.test.util.TestWorkflowEngine;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SubWorkflowExecutorTest {

    private TestWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestWorkflowEngine();
        engine.register(WorkflowGraphBuilder.named("echo")
                .input("message")
                .addNode("upper", NodeExecutor.fromFunction(in -> in.getRunInput("message", String.class).toUpperCase()))
                .outputFromNode("shout", "upper")
                .build());
    }

    @Test
    void execute_shouldPassParentRunInputByDefault() {
        WorkflowOrchestrator orchestrator = engine.getOrchestrator();
        engine.register(WorkflowGraphBuilder.named("caller")
                .addNode("call", orchestrator.subWorkflow("echo"))
                .outputFromNode("child", "call")
                .build());

        Map<String, Object> input = new HashMap<>();
        input.put("message", "hi");
        RunResult result = orchestrator.submitRun("caller", input);

        assertThat(result.getOutputs().get("child")).isEqualTo(Collections.singletonMap("shout", "HI"));
    }

    @Test
    void exposingRunResult_shouldUseWholeChildResultAsOutput() {
        WorkflowOrchestrator orchestrator = engine.getOrchestrator();
        SubWorkflowExecutor executor = new SubWorkflowExecutor(orchestrator, "echo",
                in -> Collections.<String, Object>singletonMap("message", "quiet"), false).exposingRunResult();
        engine.register(WorkflowGraphBuilder.named("inspector")
                .addNode("call", executor)
                .addNode("count", (in, results) -> Mono.just(
                        in.getDependencyOutput("call", RunResult.class).getNodeResults().size()), "call")
                .outputFromNode("childNodes", "count")
                .build());

        RunResult result = orchestrator.submitRun("inspector", null);

        assertThat(result.getOutputs()).containsEntry("childNodes", 1);
        assertThat(executor.getGraphName()).isEqualTo("echo");
    }
}
