package xyz.vvrf.reactor.workflow.execution;

import java.util.Optional;

/**
 * 运行状态查询接口。编排器在每次运行（包括嵌套运行）创建时登记其上下文。
 */
public interface RunStatusTracker {

    void track(ExecutionContext context);

    /**
     * 运行到达终态后调用，此后开始计算保留时长。
     */
    void markFinished(ExecutionContext context);

    /**
     * 查找仍被跟踪的运行上下文，用于取消等操作。
     */
    Optional<ExecutionContext> find(String runId);

    default Optional<RunStatusSnapshot> getStatus(String runId) {
        return find(runId).map(RunStatusSnapshot::of);
    }

    /**
     * @return 当前跟踪的运行数量（近似值）。
     */
    long size();
}
