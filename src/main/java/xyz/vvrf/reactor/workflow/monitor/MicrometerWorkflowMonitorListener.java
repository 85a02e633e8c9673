package xyz.vvrf.reactor.workflow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.execution.CompensationReport;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 将工作流事件记录为 Micrometer 指标。
 */
@Slf4j
public class MicrometerWorkflowMonitorListener implements WorkflowMonitorListener {

    // 指标名称
    public static final String METRIC_NODE_EXECUTION_TIME = "workflow.node.execution.time";
    public static final String METRIC_NODE_EXECUTION_TOTAL = "workflow.node.execution.total";
    public static final String METRIC_NODE_RETRY_TOTAL = "workflow.node.retry.total";
    public static final String METRIC_NODE_TIMEOUT_TOTAL = "workflow.node.timeout.total";
    public static final String METRIC_RUN_EXECUTION_TIME = "workflow.run.execution.time";
    public static final String METRIC_RUN_COMPENSATION_TOTAL = "workflow.run.compensation.total";

    // 标签键
    public static final String TAG_GRAPH_NAME = "graph.name";
    public static final String TAG_NODE_ID = "node.id";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";
    public static final String TAG_OUTCOME = "outcome";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_SKIPPED = "SKIPPED";
    private static final String STATUS_TIMEOUT = "TIMEOUT";

    private final MeterRegistry meterRegistry;

    public MicrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onRunComplete(String runId, String graphName, Duration totalDuration, RunStatus finalStatus,
                              Map<String, NodeResult> finalResults, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_STATUS, finalStatus.name())
        );
        recordTimer(METRIC_RUN_EXECUTION_TIME, "工作流运行时间", tags, totalDuration);
    }

    @Override
    public void onNodeSuccess(String runId, String graphName, String nodeId, Duration totalDuration, NodeResult result) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "工作流节点执行时间", tags, totalDuration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, tags);
    }

    @Override
    public void onNodeFailure(String runId, String graphName, String nodeId, Duration totalDuration,
                              Throwable error, int attempts) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        String status = (error instanceof TimeoutException) ? STATUS_TIMEOUT : STATUS_FAILURE;

        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, status),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "工作流节点执行时间", tags, totalDuration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, tags);
    }

    @Override
    public void onNodeSkipped(String runId, String graphName, String nodeId) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, STATUS_SKIPPED)
        );
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, tags);
    }

    @Override
    public void onNodeRetry(String runId, String graphName, String nodeId, int failedAttempt,
                            Duration backoff, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_ERROR, error != null ? error.getClass().getSimpleName() : "Unknown")
        );
        incrementCounter(METRIC_NODE_RETRY_TOTAL, tags);
    }

    @Override
    public void onNodeTimeout(String runId, String graphName, String nodeId, Duration timeout, int attempt) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId)
        );
        incrementCounter(METRIC_NODE_TIMEOUT_TOTAL, tags);
        log.debug("Micrometer 监听器捕获到节点 {} 的第 {} 次尝试超时", nodeId, attempt);
    }

    @Override
    public void onCompensation(String runId, String graphName, CompensationReport report) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_OUTCOME, report.isClean() ? "CLEAN" : "PARTIAL")
        );
        incrementCounter(METRIC_RUN_COMPENSATION_TOTAL, tags);
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, Tags tags) {
        try {
            Counter.builder(name)
                    .tags(tags)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
