package xyz.vvrf.reactor.workflow.exception;

public class RunCancelledException extends WorkflowException {

    private final String runId;

    public RunCancelledException(String runId) {
        super(String.format("Run '%s' was cancelled", runId));
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
