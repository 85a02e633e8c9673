package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.NodeStatus;
import xyz.vvrf.reactor.workflow.core.OutputBinding;
import xyz.vvrf.reactor.workflow.core.ResolvedInput;
import xyz.vvrf.reactor.workflow.core.ResultView;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.NodeFailedException;
import xyz.vvrf.reactor.workflow.exception.OutputUnavailableException;
import xyz.vvrf.reactor.workflow.exception.RunCancelledException;
import xyz.vvrf.reactor.workflow.exception.RunFailedException;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.util.GraphUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 波次调度器 - 驱动单次运行从 PENDING 到终态。
 * <p>
 * 入度为 0 的节点组成一个波次，按插入顺序经由 {@link ResilientNodeInvoker} 并发分派，
 * 并发度受 {@link RunOptions#getConcurrencyLimit()} 限制。整个波次结束后才计算下一个波次。
 * 任一节点失败后不再分派新的波次，同波次中已在执行的兄弟节点照常完成并保留结果，
 * 随后运行进入 FAILED 并交给 {@link CompensationCoordinator}。
 */
@Slf4j
public class WaveScheduler {

    private final ResilientNodeInvoker nodeInvoker;
    private final CompensationCoordinator compensationCoordinator;
    private final MonitorNotifier notifier;

    public WaveScheduler(ResilientNodeInvoker nodeInvoker,
                         CompensationCoordinator compensationCoordinator,
                         List<WorkflowMonitorListener> monitorListeners) {
        this.nodeInvoker = Objects.requireNonNull(nodeInvoker, "ResilientNodeInvoker 不能为空");
        this.compensationCoordinator = Objects.requireNonNull(compensationCoordinator, "CompensationCoordinator 不能为空");
        this.notifier = new MonitorNotifier(monitorListeners);
        log.info("WaveScheduler initialized. Listeners: {}", notifier.size());
    }

    /**
     * 执行一次运行。
     *
     * @param context 处于 PENDING 状态的运行上下文
     * @return 成功时发出 {@link RunResult}；失败时在补偿结束后以 {@link RunFailedException} 终止
     */
    public Mono<RunResult> execute(ExecutionContext context) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        return Mono.defer(() -> {
            if (!context.transition(RunStatus.PENDING, RunStatus.RUNNING)) {
                return Mono.error(new IllegalStateException(
                        String.format("Run '%s' cannot be started from status %s", runId, context.getStatus())));
            }
            log.info("[RunId: {}][Graph: '{}'] Starting execution (Nodes: {}, Depth: {}, Concurrency: {})",
                    runId, graphName, context.getGraph().size(), context.getDepth(),
                    describeConcurrency(context.getOptions()));
            notifier.safeNotify(l -> l.onRunStart(runId, graphName, context.getDepth(), context.getRunInput()));

            if (context.getGraph().isEmpty()) {
                log.info("[RunId: {}][Graph: '{}'] Graph has no nodes to execute. Deriving outputs.", runId, graphName);
            }

            InDegreeTracker tracker = new InDegreeTracker(context.getGraph());
            return dispatchWaves(context, tracker, tracker.initialWave())
                    .then(Mono.defer(() -> finish(context)));
        });
    }

    private Mono<Void> dispatchWaves(ExecutionContext context, InDegreeTracker tracker, List<String> wave) {
        return Mono.defer(() -> {
            if (wave.isEmpty() || context.hasFailed()) {
                return Mono.empty();
            }
            if (context.getCancellationToken().isCancelled()) {
                log.warn("[RunId: {}][Graph: '{}'] Run cancelled, not dispatching remaining nodes {}",
                        context.getRunId(), context.getGraphName(), context.getPendingNodeIds());
                context.markFailed(null, new RunCancelledException(context.getRunId()));
                return Mono.empty();
            }

            context.recordDispatchedWave(wave);
            ResultView view = context.snapshotView();
            log.debug("[RunId: {}][Graph: '{}'] Dispatching wave {}: {}",
                    context.getRunId(), context.getGraphName(), context.getDispatchedWaves().size(), wave);

            return Flux.fromIterable(wave)
                    .flatMap(nodeId -> dispatchNode(context, nodeId, view), context.getOptions().effectiveConcurrency())
                    .then(Mono.defer(() -> dispatchWaves(context, tracker, tracker.release(wave))));
        });
    }

    /**
     * 分派单个节点并记录其结果。返回的 Mono 从不以错误终止。
     */
    private Mono<NodeResult> dispatchNode(ExecutionContext context, String nodeId, ResultView view) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        return Mono.defer(() -> {
            WorkflowNode node = context.getGraph().getNode(nodeId)
                    .orElseThrow(() -> new IllegalStateException(
                            String.format("Node '%s' not found in graph '%s'", nodeId, graphName)));

            if (context.anyDependencyHasStatus(node, NodeStatus.SKIPPED)) {
                log.debug("[RunId: {}][Graph: '{}'] Node '{}' skipped because a dependency was skipped.",
                        runId, graphName, nodeId);
                return Mono.just(skip(context, nodeId));
            }

            ResolvedInput input = context.resolveInput(node, view);

            if (node.getCondition().isPresent()) {
                boolean shouldExecute;
                try {
                    shouldExecute = node.getCondition().get().shouldExecute(input, view);
                } catch (RuntimeException e) {
                    log.error("[RunId: {}][Graph: '{}'] Node '{}' condition threw exception. Treating as failed.",
                            runId, graphName, nodeId, e);
                    Instant now = Instant.now();
                    NodeResult failed = NodeResult.failed(new NodeFailedException(nodeId, e, 0), now, now, 0,
                            context.nextSequence());
                    notifier.safeNotify(l -> l.onNodeFailure(runId, graphName, nodeId, failed.getDuration(), e, 0));
                    return Mono.just(failed);
                }
                if (!shouldExecute) {
                    log.debug("[RunId: {}][Graph: '{}'] Node '{}' condition not met, skipping execution.",
                            runId, graphName, nodeId);
                    return Mono.just(skip(context, nodeId));
                }
            }

            return nodeInvoker.invoke(context, node, input, view);
        }).doOnNext(result -> {
            context.recordResult(nodeId, result);
            if (result.isFailed()) {
                context.markFailed(nodeId, result.getError().orElseThrow(IllegalStateException::new));
            }
        });
    }

    private NodeResult skip(ExecutionContext context, String nodeId) {
        NodeResult skipped = NodeResult.skipped(Instant.now(), context.nextSequence());
        notifier.safeNotify(l -> l.onNodeSkipped(context.getRunId(), context.getGraphName(), nodeId));
        return skipped;
    }

    private Mono<RunResult> finish(ExecutionContext context) {
        if (!context.hasFailed() && context.getCancellationToken().isCancelled()) {
            log.warn("[RunId: {}][Graph: '{}'] Run cancelled while its last wave was in flight.",
                    context.getRunId(), context.getGraphName());
            context.markFailed(null, new RunCancelledException(context.getRunId()));
        }
        if (!context.hasFailed()) {
            Map<String, Object> outputs;
            try {
                outputs = deriveOutputs(context);
            } catch (OutputUnavailableException e) {
                log.error("[RunId: {}][Graph: '{}'] Failed to derive run outputs: {}",
                        context.getRunId(), context.getGraphName(), e.getMessage());
                context.markFailed(null, e);
                return fail(context);
            }
            return complete(context, outputs);
        }
        return fail(context);
    }

    private Map<String, Object> deriveOutputs(ExecutionContext context) {
        ResultView finalView = context.snapshotView();
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, OutputBinding> entry : context.getGraph().getOutputBindings().entrySet()) {
            outputs.put(entry.getKey(), entry.getValue().derive(entry.getKey(), finalView, context.getRunInput()));
        }
        return outputs;
    }

    private Mono<RunResult> complete(ExecutionContext context, Map<String, Object> outputs) {
        context.transition(RunStatus.RUNNING, RunStatus.COMPLETED);
        Map<String, NodeResult> results = context.getResultsInCompletionOrder();
        RunResult runResult = new RunResult(context.getRunId(), context.getGraphName(), outputs, results,
                new ArrayList<>(context.getDispatchedWaves()), context.getStartedAt(),
                context.getFinishedAt().orElseGet(Instant::now));

        log.info("[RunId: {}][Graph: '{}'] Execution completed successfully in {}. Outputs: {}",
                context.getRunId(), context.getGraphName(), runResult.getDuration(), outputs.keySet());
        notifier.safeNotify(l -> l.onRunComplete(context.getRunId(), context.getGraphName(), runResult.getDuration(),
                RunStatus.COMPLETED, results, null));
        return Mono.just(runResult);
    }

    private Mono<RunResult> fail(ExecutionContext context) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();
        Throwable cause = context.getFailureCause()
                .orElseThrow(() -> new IllegalStateException("Run '" + runId + "' failed without a recorded cause"));

        context.transition(RunStatus.RUNNING, RunStatus.FAILED);
        log.error("[RunId: {}][Graph: '{}'] Execution failed{}. Pending nodes: {}. Cause: {}",
                runId, graphName,
                context.getTriggeringNodeId().map(id -> " at node '" + id + "'").orElse(""),
                context.getPendingNodeIds(), cause.toString());

        return compensationCoordinator.compensate(context, cause)
                .flatMap(report -> {
                    Map<String, NodeResult> results = context.getResultsInCompletionOrder();
                    RunFailure failure = new RunFailure(runId, graphName, context.getStatus(),
                            context.getTriggeringNodeId().orElse(null), cause, report, results,
                            context.getPendingNodeIds());
                    notifier.safeNotify(l -> l.onRunComplete(runId, graphName, context.getElapsed(),
                            context.getStatus(), results, cause));
                    return Mono.<RunResult>error(new RunFailedException(failure));
                });
    }

    private static String describeConcurrency(RunOptions options) {
        int concurrency = options.effectiveConcurrency();
        return concurrency == Integer.MAX_VALUE ? "unbounded" : String.valueOf(concurrency);
    }

    /**
     * 跟踪每个节点剩余的未满足依赖数。只在调度链上被顺序访问。
     */
    private static final class InDegreeTracker {
        private final WorkflowGraph graph;
        private final Map<String, Integer> remaining;

        private InDegreeTracker(WorkflowGraph graph) {
            this.graph = graph;
            this.remaining = GraphUtils.computeInDegrees(graph);
        }

        List<String> initialWave() {
            List<String> wave = new ArrayList<>();
            for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
                if (entry.getValue() == 0) {
                    wave.add(entry.getKey());
                }
            }
            return wave;
        }

        /**
         * 释放一个已结束波次的下游，返回新的就绪节点（按插入顺序）。
         */
        List<String> release(List<String> finishedWave) {
            Set<String> ready = new HashSet<>();
            for (String nodeId : finishedWave) {
                for (String dependent : graph.getDependents(nodeId)) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
            return GraphUtils.orderByInsertion(graph, ready);
        }
    }
}
