package xyz.vvrf.reactor.workflow.exception;

/**
 * 工作流引擎所有异常的基类（非受检）。
 * {@link #isRetryable()} 决定弹性包装器是否对该错误重试：
 * 引擎自身产生的结构性/前置性错误默认不可重试。
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return 该错误作为节点尝试失败出现时，是否值得再次尝试。
     */
    public boolean isRetryable() {
        return false;
    }
}
