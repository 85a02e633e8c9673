package xyz.vvrf.reactor.workflow.exception;

public class MaxNestingDepthExceededException extends WorkflowException {

    private final String graphName;
    private final int currentDepth;
    private final int maxDepth;

    public MaxNestingDepthExceededException(String graphName, int currentDepth, int maxDepth) {
        super(String.format("Cannot invoke graph '%s' at nesting depth %d: maximum depth is %d",
                graphName, currentDepth + 1, maxDepth));
        this.graphName = graphName;
        this.currentDepth = currentDepth;
        this.maxDepth = maxDepth;
    }

    public String getGraphName() {
        return graphName;
    }

    public int getCurrentDepth() {
        return currentDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
