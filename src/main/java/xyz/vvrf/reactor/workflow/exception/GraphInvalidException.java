package xyz.vvrf.reactor.workflow.exception;

/**
 * 图结构非法：存在环、悬空引用或重复的节点 ID。注册阶段抛出，不可重试。
 */
public class GraphInvalidException extends WorkflowException {

    private final String graphName;

    public GraphInvalidException(String graphName, String message) {
        super(String.format("Graph '%s' is invalid: %s", graphName, message));
        this.graphName = graphName;
    }

    public String getGraphName() {
        return graphName;
    }
}
