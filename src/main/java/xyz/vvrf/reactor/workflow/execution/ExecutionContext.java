package xyz.vvrf.reactor.workflow.execution;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.CallStack;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.NodeStatus;
import xyz.vvrf.reactor.workflow.core.ResolvedInput;
import xyz.vvrf.reactor.workflow.core.ResultView;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 封装单次工作流运行的上下文和运行时状态。
 * 每次 {@link WorkflowOrchestrator#run} 调用（包括嵌套调用）都会创建一个此类的实例。
 * <p>
 * 节点结果通过 {@link ConcurrentHashMap#putIfAbsent} 写入且每个节点只写一次，
 * 这次写入即结果对其他线程可见的发布点。
 */
@Slf4j
@Getter
public class ExecutionContext {

    private final String runId;
    private final WorkflowGraph graph;
    private final String graphName;
    private final Map<String, Object> runInput;
    private final CallStack callStack;
    private final RunOptions options;
    private final CancellationToken cancellationToken;
    private final Instant startedAt;

    private final Map<String, NodeResult> results = new ConcurrentHashMap<>();
    private final List<List<String>> dispatchedWaves = new CopyOnWriteArrayList<>();

    // 以下字段由 @Getter 排除，通过专门的方法访问
    @Getter(AccessLevel.NONE)
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.PENDING);
    @Getter(AccessLevel.NONE)
    private final AtomicLong sequence = new AtomicLong(0);
    @Getter(AccessLevel.NONE)
    private final AtomicReference<Failure> failure = new AtomicReference<>();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean compensationTriggered = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private volatile Instant finishedAt;

    public ExecutionContext(String runId, WorkflowGraph graph, Map<String, Object> runInput,
                            CallStack callStack, RunOptions options, CancellationToken cancellationToken) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.graph = Objects.requireNonNull(graph, "图定义不能为空");
        this.graphName = graph.getName();
        this.runInput = Collections.unmodifiableMap(new LinkedHashMap<>(
                runInput != null ? runInput : Collections.<String, Object>emptyMap()));
        this.callStack = Objects.requireNonNull(callStack, "调用栈不能为空");
        this.options = Objects.requireNonNull(options, "运行选项不能为空");
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "取消令牌不能为空");
        this.startedAt = Instant.now();

        log.info("[RunId: {}][Graph: '{}'] 创建 ExecutionContext (Nodes: {}, Depth: {}, Stack: {})",
                runId, graphName, graph.size(), callStack.depth(), callStack);
    }

    public RunStatus getStatus() {
        return status.get();
    }

    /**
     * 原子地执行状态迁移。
     *
     * @return 当前状态等于 expected 并成功迁移时返回 true
     */
    public boolean transition(RunStatus expected, RunStatus next) {
        if (status.compareAndSet(expected, next)) {
            log.debug("[RunId: {}][Graph: '{}'] Status {} -> {}", runId, graphName, expected, next);
            if (next.isTerminal()) {
                finishedAt = Instant.now();
            }
            return true;
        }
        log.warn("[RunId: {}][Graph: '{}'] Rejected status transition {} -> {} (current: {})",
                runId, graphName, expected, next, status.get());
        return false;
    }

    /**
     * 为即将记录的结果分配完成序号。序号在本次运行内单调递增。
     */
    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    /**
     * 原子性地记录一个节点的结果。
     *
     * @return 如果结果是新记录的，则返回 true；如果该节点的结果已存在，则返回 false。
     */
    public boolean recordResult(String nodeId, NodeResult result) {
        if (results.putIfAbsent(nodeId, result) == null) {
            log.debug("[RunId: {}][Graph: '{}'] Node '{}' finished with status: {}. Progress: {}/{}",
                    runId, graphName, nodeId, result.getStatus(), results.size(), graph.size());
            return true;
        }
        log.warn("[RunId: {}][Graph: '{}'] Node '{}' result ALREADY recorded when trying to add status: {}. Ignored.",
                runId, graphName, nodeId, result.getStatus());
        return false;
    }

    /**
     * 记录运行失败的原因。只有第一次调用生效。
     *
     * @param nodeId 触发失败的节点，取消或输出不可用时为 null
     * @return 如果本次调用记录了失败，返回 true
     */
    public boolean markFailed(String nodeId, Throwable cause) {
        if (failure.compareAndSet(null, new Failure(nodeId, cause))) {
            log.warn("[RunId: {}][Graph: '{}'] Run marked as failed{}: {}",
                    runId, graphName, nodeId != null ? " by node '" + nodeId + "'" : "", cause.toString());
            return true;
        }
        return false;
    }

    public boolean hasFailed() {
        return failure.get() != null;
    }

    public Optional<String> getTriggeringNodeId() {
        Failure f = failure.get();
        return f == null ? Optional.empty() : Optional.ofNullable(f.nodeId);
    }

    public Optional<Throwable> getFailureCause() {
        Failure f = failure.get();
        return f == null ? Optional.empty() : Optional.of(f.cause);
    }

    /**
     * 标记补偿已触发。每次运行只会成功一次。
     */
    public boolean tryTriggerCompensation() {
        return compensationTriggered.compareAndSet(false, true);
    }

    public void recordDispatchedWave(List<String> wave) {
        dispatchedWaves.add(Collections.unmodifiableList(new ArrayList<>(wave)));
    }

    /**
     * 创建当前已完成结果的快照视图。
     */
    public ResultView snapshotView() {
        return ResultView.snapshotOf(results);
    }

    /**
     * 从快照视图组装节点输入：运行输入 + 直接依赖的输出。
     */
    public ResolvedInput resolveInput(WorkflowNode node, ResultView view) {
        Map<String, Object> dependencyOutputs = new LinkedHashMap<>();
        for (String dependency : node.getDependencies()) {
            dependencyOutputs.put(dependency, view.getOutput(dependency).orElse(null));
        }
        return new ResolvedInput(runId, node.getId(), runInput, dependencyOutputs);
    }

    public boolean anyDependencyHasStatus(WorkflowNode node, NodeStatus nodeStatus) {
        for (String dependency : node.getDependencies()) {
            NodeResult result = results.get(dependency);
            if (result != null && result.getStatus() == nodeStatus) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return 节点结果，按完成序号排序。
     */
    public Map<String, NodeResult> getResultsInCompletionOrder() {
        List<Map.Entry<String, NodeResult>> entries = new ArrayList<>(results.entrySet());
        entries.sort(Comparator.comparingLong(e -> e.getValue().getSequence()));
        Map<String, NodeResult> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, NodeResult> entry : entries) {
            ordered.put(entry.getKey(), entry.getValue());
        }
        return ordered;
    }

    /**
     * @return 状态为 COMPLETED 的节点 ID，按完成逆序。
     */
    public List<String> getCompletedNodeIdsInReverseOrder() {
        List<String> completed = new ArrayList<>();
        for (Map.Entry<String, NodeResult> entry : getResultsInCompletionOrder().entrySet()) {
            if (entry.getValue().isCompleted()) {
                completed.add(entry.getKey());
            }
        }
        Collections.reverse(completed);
        return completed;
    }

    /**
     * @return 尚未记录结果的节点 ID，按插入顺序。
     */
    public Set<String> getPendingNodeIds() {
        Set<String> pending = new LinkedHashSet<>();
        for (String nodeId : graph.getNodeIds()) {
            if (!results.containsKey(nodeId)) {
                pending.add(nodeId);
            }
        }
        return pending;
    }

    public int getDepth() {
        return callStack.depth();
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Duration getElapsed() {
        Instant end = finishedAt;
        return Duration.between(startedAt, end != null ? end : Instant.now());
    }

    private static final class Failure {
        private final String nodeId;
        private final Throwable cause;

        private Failure(String nodeId, Throwable cause) {
            this.nodeId = nodeId;
            this.cause = Objects.requireNonNull(cause, "失败原因不能为空");
        }
    }
}
