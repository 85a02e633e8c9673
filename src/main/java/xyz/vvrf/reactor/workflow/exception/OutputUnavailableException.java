package xyz.vvrf.reactor.workflow.exception;

public class OutputUnavailableException extends WorkflowException {

    private final String outputName;

    public OutputUnavailableException(String outputName, String reason) {
        super(String.format("Output '%s' is unavailable: %s", outputName, reason));
        this.outputName = outputName;
    }

    public OutputUnavailableException(String outputName, String reason, Throwable cause) {
        super(String.format("Output '%s' is unavailable: %s", outputName, reason), cause);
        this.outputName = outputName;
    }

    public String getOutputName() {
        return outputName;
    }
}
