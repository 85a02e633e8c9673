package xyz.vvrf.reactor.workflow.exception;

/**
 * 嵌套调用时目标图已在调用栈中出现超过允许次数。
 * 用于拦截单图无环校验无法发现的跨图间接循环。
 */
public class NestedWorkflowCycleException extends WorkflowException {

    private final String graphName;
    private final String callStack;

    public NestedWorkflowCycleException(String graphName, String callStack, int allowedRepeats) {
        super(String.format("Graph '%s' already appears on call stack %s (allowed repeats: %d)",
                graphName, callStack, allowedRepeats));
        this.graphName = graphName;
        this.callStack = callStack;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getCallStack() {
        return callStack;
    }
}
