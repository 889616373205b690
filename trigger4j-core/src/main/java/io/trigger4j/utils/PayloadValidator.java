package io.trigger4j.utils;

import io.trigger4j.core.FieldType;
import io.trigger4j.core.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Checks API trigger payloads against the field types declared by the trigger.
 */
public final class PayloadValidator {
    private PayloadValidator() {
    }

    /**
     * Fails on the first schema field (in declaration order) that is missing from the payload or
     * whose value has a different runtime type. Fields not declared in the schema are ignored.
     */
    public static void validate(Map<String, ?> payload, Map<String, FieldType> schema) {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        for (var e : schema.entrySet()) {
            String field = e.getKey();
            FieldType expected = e.getValue();

            if (!payload.containsKey(field)) {
                throw ValidationException.missingField(field);
            }

            Object value = payload.get(field);
            if (!expected.matches(value)) {
                throw ValidationException.typeMismatch(field, expected.tag(), FieldType.describe(value));
            }
        }
    }

    /**
     * Resolve raw type tags (e.g. {"amount": "float"}) into a typed schema.
     */
    public static Map<String, FieldType> parseSchema(Map<String, String> rawSchema) {
        if (rawSchema == null) {
            throw ValidationException.invalidArgument("api schema must not be null");
        }

        Map<String, FieldType> schema = new LinkedHashMap<>();
        for (var e : rawSchema.entrySet()) {
            String field = e.getKey();
            if (field == null || field.isBlank()) {
                throw ValidationException.invalidArgument("api schema contains a blank field name");
            }
            FieldType type = FieldType.fromTag(e.getValue())
                    .orElseThrow(() -> ValidationException.unknownFieldType(field, e.getValue()));
            schema.put(field, type);
        }
        return Collections.unmodifiableMap(schema);
    }
}
