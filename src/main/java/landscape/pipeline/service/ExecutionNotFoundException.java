package landscape.pipeline.service;

public class ExecutionNotFoundException extends NotFoundException {

    private final String executionId;

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
        this.executionId = executionId;
    }

    public String executionId() {
        return executionId;
    }
}
