package xyz.vvrf.reactor.workflow.exception;

public class GraphNotFoundException extends WorkflowException {

    private final String graphName;

    public GraphNotFoundException(String graphName) {
        super(String.format("Graph '%s' is not registered", graphName));
        this.graphName = graphName;
    }

    public String getGraphName() {
        return graphName;
    }
}
