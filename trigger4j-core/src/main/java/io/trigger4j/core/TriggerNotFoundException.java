package io.trigger4j.core;

public class TriggerNotFoundException extends Trigger4jException {

    private final String triggerId;

    public TriggerNotFoundException(String triggerId) {
        super("Trigger not found: " + triggerId);
        this.triggerId = triggerId;
    }

    public String triggerId() {
        return triggerId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
