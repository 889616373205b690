package io.trigger4j.core;

public record RegistrationResult(
        boolean created,
        boolean replaced
) {
    public static RegistrationResult createdResult() {
        return new RegistrationResult(true, false);
    }

    public static RegistrationResult replacedResult() {
        return new RegistrationResult(false, true);
    }
}
