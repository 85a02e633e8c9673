package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 失败运行的报告（不可变）。
 * 包含触发失败的节点（取消或输出不可用时为空）、根本错误、补偿报告、
 * 失败时已记录的部分结果以及从未开始的节点。
 */
public final class RunFailure {

    private final String runId;
    private final String graphName;
    private final RunStatus status;
    private final String triggeringNodeId;
    private final Throwable cause;
    private final CompensationReport compensationReport;
    private final Map<String, NodeResult> partialResults;
    private final Set<String> pendingNodeIds;

    public RunFailure(String runId, String graphName, RunStatus status, String triggeringNodeId, Throwable cause,
                      CompensationReport compensationReport, Map<String, NodeResult> partialResults,
                      Set<String> pendingNodeIds) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
        this.status = Objects.requireNonNull(status, "运行状态不能为空");
        this.triggeringNodeId = triggeringNodeId;
        this.cause = Objects.requireNonNull(cause, "失败原因不能为空");
        this.compensationReport = Objects.requireNonNull(compensationReport, "补偿报告不能为空");
        this.partialResults = Collections.unmodifiableMap(new LinkedHashMap<>(partialResults));
        this.pendingNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(pendingNodeIds));
    }

    public String getRunId() {
        return runId;
    }

    public String getGraphName() {
        return graphName;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Optional<String> getTriggeringNodeId() {
        return Optional.ofNullable(triggeringNodeId);
    }

    public Throwable getCause() {
        return cause;
    }

    public CompensationReport getCompensationReport() {
        return compensationReport;
    }

    /**
     * @return 失败时已记录的节点结果（含 COMPLETED / FAILED / SKIPPED），按完成顺序。
     */
    public Map<String, NodeResult> getPartialResults() {
        return partialResults;
    }

    /**
     * @return 从未开始执行的节点，按插入顺序。
     */
    public Set<String> getPendingNodeIds() {
        return pendingNodeIds;
    }

    @Override
    public String toString() {
        return String.format("RunFailure[runId=%s, graph=%s, status=%s, node=%s, cause=%s, pending=%s]",
                runId, graphName, status, triggeringNodeId, cause, pendingNodeIds);
    }
}
