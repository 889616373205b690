package io.trigger4j.core;

/**
 * Raised when a payload, an API schema or a query argument is rejected.
 */
public class ValidationException extends Trigger4jException {

    public enum Reason {
        MISSING_FIELD,
        TYPE_MISMATCH,
        UNKNOWN_FIELD_TYPE,
        INVALID_ARGUMENT
    }

    private final Reason reason;
    private final String field;
    private final String expected;
    private final String actual;

    private ValidationException(Reason reason, String field, String expected, String actual, String message) {
        super(message);
        this.reason = reason;
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public static ValidationException missingField(String field) {
        return new ValidationException(Reason.MISSING_FIELD, field, null, null,
                "Missing required field: " + field);
    }

    public static ValidationException typeMismatch(String field, String expected, String actual) {
        return new ValidationException(Reason.TYPE_MISMATCH, field, expected, actual,
                "Invalid type for field '" + field + "'. Expected " + expected + ", got " + actual);
    }

    public static ValidationException unknownFieldType(String field, String tag) {
        return new ValidationException(Reason.UNKNOWN_FIELD_TYPE, field, null, tag,
                "Invalid type '" + tag + "' for field '" + field + "'. Must be one of: " + FieldType.supportedTags());
    }

    public static ValidationException invalidArgument(String message) {
        return new ValidationException(Reason.INVALID_ARGUMENT, null, null, null, message);
    }

    public Reason reason() {
        return reason;
    }

    public String field() {
        return field;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
