package xyz.vvrf.reactor.workflow.exception;

/**
 * 单个节点的补偿失败。只附加在失败运行的补偿报告中，不会中断补偿过程。
 */
public class CompensationException extends WorkflowException {

    private final String nodeId;

    public CompensationException(String nodeId, Throwable cause) {
        super(String.format("Compensation of node '%s' failed: %s", nodeId, cause), cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
