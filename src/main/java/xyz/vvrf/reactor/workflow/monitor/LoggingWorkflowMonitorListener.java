package xyz.vvrf.reactor.workflow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.execution.CompensationReport;

import java.time.Duration;
import java.util.Map;

@Slf4j
public class LoggingWorkflowMonitorListener implements WorkflowMonitorListener {

    @Override
    public void onRunStart(String runId, String graphName, int depth, Map<String, Object> runInput) {
        log.info("[MONITOR] 运行:[{}] 图:[{}] 开始。 深度:[{}], 输入:[{}]",
                runId, graphName, depth, runInput.keySet());
    }

    @Override
    public void onRunComplete(String runId, String graphName, Duration totalDuration, RunStatus finalStatus,
                              Map<String, NodeResult> finalResults, Throwable error) {
        if (error == null) {
            log.info("[MONITOR] 运行:[{}] 图:[{}] 结束。 状态:[{}], 耗时:[{}ms], 节点结果:[{}]",
                    runId, graphName, finalStatus, totalDuration.toMillis(), finalResults.size());
        } else {
            log.error("[MONITOR] 运行:[{}] 图:[{}] 结束。 状态:[{}], 耗时:[{}ms], 节点结果:[{}], 错误:[{}]",
                    runId, graphName, finalStatus, totalDuration.toMillis(), finalResults.size(), error.getMessage());
        }
    }

    @Override
    public void onNodeStart(String runId, String graphName, String nodeId, int attempt) {
        log.info("[MONITOR] 运行:[{}] 图:[{}] 节点:[{}] 开始。 尝试:[{}]", runId, graphName, nodeId, attempt);
    }

    @Override
    public void onNodeSuccess(String runId, String graphName, String nodeId, Duration totalDuration, NodeResult result) {
        log.info("[MONITOR] 运行:[{}] 图:[{}] 节点:[{}] 成功。 耗时:[{}ms], 尝试:[{}], 输出存在:[{}]",
                runId, graphName, nodeId, totalDuration.toMillis(), result.getAttempts(), result.getOutput().isPresent());
    }

    @Override
    public void onNodeFailure(String runId, String graphName, String nodeId, Duration totalDuration,
                              Throwable error, int attempts) {
        log.error("[MONITOR] 运行:[{}] 图:[{}] 节点:[{}] 失败。 耗时:[{}ms], 尝试:[{}], 错误:[{}]",
                runId, graphName, nodeId, totalDuration.toMillis(), attempts, error.getMessage(), error);
    }

    @Override
    public void onNodeRetry(String runId, String graphName, String nodeId, int failedAttempt,
                            Duration backoff, Throwable error) {
        log.warn("[MONITOR] 运行:[{}] 图:[{}] 节点:[{}] 第 {} 次尝试失败，{}ms 后重试。 错误:[{}]",
                runId, graphName, nodeId, failedAttempt, backoff.toMillis(), error.getMessage());
    }

    @Override
    public void onNodeTimeout(String runId, String graphName, String nodeId, Duration timeout, int attempt) {
        log.warn("[MONITOR] 运行:[{}] 图:[{}] 节点:[{}] 超时。 配置:[{}ms], 尝试:[{}]",
                runId, graphName, nodeId, timeout.toMillis(), attempt);
    }

    @Override
    public void onNodeSkipped(String runId, String graphName, String nodeId) {
        log.info("[MONITOR] 运行:[{}] 图:[{}] 节点:[{}] 跳过。", runId, graphName, nodeId);
    }

    @Override
    public void onCompensation(String runId, String graphName, CompensationReport report) {
        if (report.isClean()) {
            log.info("[MONITOR] 运行:[{}] 图:[{}] 补偿完成。 已补偿:[{}]",
                    runId, graphName, report.getCompensatedNodeIds());
        } else {
            log.warn("[MONITOR] 运行:[{}] 图:[{}] 补偿完成但存在错误。 已补偿:[{}], 失败:[{}]",
                    runId, graphName, report.getCompensatedNodeIds(), report.getFailedNodeIds());
        }
    }
}
