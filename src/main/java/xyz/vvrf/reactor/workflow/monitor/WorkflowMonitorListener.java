package xyz.vvrf.reactor.workflow.monitor;

import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.execution.CompensationReport;

import java.time.Duration;
import java.util.Map;

/**
 * 用于监控工作流运行事件的监听器接口。
 * 包括运行级别、节点级别和补偿事件。
 * <p>
 * 所有回调都在引擎线程上同步调用，实现应尽量轻量；抛出的异常会被引擎捕获并记录，不影响运行。
 * 默认方法均为空实现，按需覆盖即可。
 */
public interface WorkflowMonitorListener {

    /**
     * 运行开始时调用（输入校验已通过，第一个波次尚未分派）。
     *
     * @param runId     运行 ID
     * @param graphName 图名称
     * @param depth     嵌套深度，顶层运行为 1
     * @param runInput  运行输入 (注意: 实现者应考虑处理其中的敏感信息)
     */
    default void onRunStart(String runId, String graphName, int depth, Map<String, Object> runInput) {
    }

    /**
     * 运行到达终态时调用 (无论成功或失败)。
     *
     * @param runId         运行 ID
     * @param graphName     图名称
     * @param totalDuration 运行总耗时 (包括补偿)
     * @param finalStatus   终态：COMPLETED 或 COMPENSATED
     * @param finalResults  所有已记录的节点结果 (节点 ID -> NodeResult)
     * @param error         运行失败的原因；成功时为 null
     */
    default void onRunComplete(String runId, String graphName, Duration totalDuration, RunStatus finalStatus,
                               Map<String, NodeResult> finalResults, Throwable error) {
    }

    /**
     * 节点的每一次执行尝试开始时调用。
     *
     * @param attempt 尝试序号，从 1 开始
     */
    default void onNodeStart(String runId, String graphName, String nodeId, int attempt) {
    }

    /**
     * 节点成功完成时调用。
     *
     * @param totalDuration 节点总耗时 (包括重试和退避等待)
     * @param result        节点结果
     */
    default void onNodeSuccess(String runId, String graphName, String nodeId, Duration totalDuration, NodeResult result) {
    }

    /**
     * 节点最终失败（重试耗尽或不可重试的错误）时调用。
     *
     * @param totalDuration 节点总耗时
     * @param error         最后一次尝试的错误
     * @param attempts      实际发生的尝试次数
     */
    default void onNodeFailure(String runId, String graphName, String nodeId, Duration totalDuration,
                               Throwable error, int attempts) {
    }

    /**
     * 某次尝试失败、即将在退避后重试时调用。
     *
     * @param failedAttempt 刚刚失败的尝试序号
     * @param backoff       下一次尝试前的等待时长
     * @param error         本次尝试的错误
     */
    default void onNodeRetry(String runId, String graphName, String nodeId, int failedAttempt,
                             Duration backoff, Throwable error) {
    }

    /**
     * 某次尝试超时时调用。
     * 这是一次失败尝试的特定原因，为方便监控单独列出。
     *
     * @param timeout 配置的超时时长
     * @param attempt 超时的尝试序号
     */
    default void onNodeTimeout(String runId, String graphName, String nodeId, Duration timeout, int attempt) {
    }

    /**
     * 节点被跳过时调用（条件不满足，或某个依赖被跳过）。
     */
    default void onNodeSkipped(String runId, String graphName, String nodeId) {
    }

    /**
     * 失败运行的补偿结束后调用。
     *
     * @param report 补偿报告
     */
    default void onCompensation(String runId, String graphName, CompensationReport report) {
    }
}
