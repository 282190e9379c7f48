package io.github.jbellis.gitstate.repo;

/** An operation invoked on a repository in a state that has no content to operate on. */
public class NotReadyException extends RuntimeException {
    private final String stateName;
    private final String operation;

    public NotReadyException(String stateName, String operation) {
        super(operation + " is not available in state " + stateName);
        this.stateName = stateName;
        this.operation = operation;
    }

    public String getStateName() {
        return stateName;
    }

    public String getOperation() {
        return operation;
    }
}
