package xyz.vvrf.reactor.workflow.exception;

import xyz.vvrf.reactor.workflow.execution.RunFailure;

import java.util.Objects;

/**
 * 运行失败（节点失败、取消或输出不可用），补偿已经执行完毕。
 * 携带完整的失败报告；嵌套运行中它作为父节点的错误向上传播。
 */
public class RunFailedException extends WorkflowException {

    private final transient RunFailure failure;

    public RunFailedException(RunFailure failure) {
        super(describe(Objects.requireNonNull(failure, "失败报告不能为空")), failure.getCause());
        this.failure = failure;
    }

    private static String describe(RunFailure failure) {
        return String.format("Run '%s' of graph '%s' failed%s: %s",
                failure.getRunId(), failure.getGraphName(),
                failure.getTriggeringNodeId().map(id -> " at node '" + id + "'").orElse(""),
                failure.getCause().getMessage());
    }

    public RunFailure getFailure() {
        return failure;
    }

    /**
     * 子运行失败可以按父节点的弹性策略整体重试。
     * 原因链中出现取消、嵌套限制、图缺失或输入校验失败时不可重试。
     */
    @Override
    public boolean isRetryable() {
        Throwable current = failure.getCause();
        while (current != null) {
            if (current instanceof RunCancelledException
                    || current instanceof MaxNestingDepthExceededException
                    || current instanceof NestedWorkflowCycleException
                    || current instanceof GraphNotFoundException
                    || current instanceof InputValidationException) {
                return false;
            }
            current = current.getCause();
        }
        return true;
    }
}
