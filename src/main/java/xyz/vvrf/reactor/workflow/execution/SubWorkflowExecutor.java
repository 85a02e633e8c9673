package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.core.ResolvedInput;
import xyz.vvrf.reactor.workflow.core.ResultView;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 以一次嵌套运行作为节点逻辑的执行器。
 * <p>
 * 子运行的输出 Map（或在 exposeRunResult 时为完整的 {@link RunResult}）即为本节点的输出；
 * 子运行失败时以 {@link xyz.vvrf.reactor.workflow.exception.RunFailedException} 作为本次尝试的错误，
 * 深度或循环检查未通过时的错误不可重试。
 */
@Slf4j
public class SubWorkflowExecutor implements NodeExecutor {

    /** 把父运行的运行输入原样传给子运行。*/
    public static final Function<ResolvedInput, Map<String, Object>> PASS_RUN_INPUT = ResolvedInput::getRunInput;

    private final WorkflowOrchestrator orchestrator;
    private final String graphName;
    private final Function<ResolvedInput, Map<String, Object>> inputMapper;
    private final boolean exposeRunResult;

    public SubWorkflowExecutor(WorkflowOrchestrator orchestrator,
                               String graphName,
                               Function<ResolvedInput, Map<String, Object>> inputMapper,
                               boolean exposeRunResult) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "WorkflowOrchestrator 不能为空");
        this.graphName = Objects.requireNonNull(graphName, "子图名称不能为空");
        this.inputMapper = Objects.requireNonNull(inputMapper, "输入映射函数不能为空");
        this.exposeRunResult = exposeRunResult;
    }

    /**
     * 返回一个以完整 {@link RunResult} 作为节点输出的执行器副本。
     */
    public SubWorkflowExecutor exposingRunResult() {
        return new SubWorkflowExecutor(orchestrator, graphName, inputMapper, true);
    }

    @Override
    public Mono<?> execute(ResolvedInput input, ResultView results) {
        Map<String, Object> childInput = inputMapper.apply(input);
        log.debug("[RunId: {}] Node '{}' invoking sub-workflow '{}' with inputs {}",
                input.getRunId(), input.getNodeId(), graphName, childInput != null ? childInput.keySet() : "[]");

        Mono<RunResult> childRun = orchestrator.run(graphName, childInput, null);
        if (exposeRunResult) {
            return childRun;
        }
        return childRun.map(RunResult::getOutputs);
    }

    public String getGraphName() {
        return graphName;
    }

    @Override
    public String toString() {
        return "SubWorkflowExecutor[" + graphName + "]";
    }
}
