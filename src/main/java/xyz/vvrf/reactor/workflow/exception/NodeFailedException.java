package xyz.vvrf.reactor.workflow.exception;

/**
 * 节点在弹性包装器耗尽全部尝试后仍然失败。会使所在运行失败并触发补偿。
 */
public class NodeFailedException extends WorkflowException {

    private final String nodeId;
    private final int attempts;

    public NodeFailedException(String nodeId, Throwable lastError, int attempts) {
        super(String.format("Node '%s' failed after %d attempt(s): %s",
                nodeId, attempts, lastError != null ? lastError.toString() : "unknown error"), lastError);
        this.nodeId = nodeId;
        this.attempts = attempts;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return 最后一次尝试的错误，等同于 {@link #getCause()}。
     */
    public Throwable getLastError() {
        return getCause();
    }
}
