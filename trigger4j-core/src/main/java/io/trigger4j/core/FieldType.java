package io.trigger4j.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Primitive field types an API trigger schema may declare.
 *
 * <p>Matching is exact: a boolean never satisfies {@code int} or {@code float}, and an integer
 * never satisfies {@code float}.
 */
public enum FieldType {

    STRING("string", "str") {
        @Override
        public boolean matches(Object value) {
            return value instanceof String;
        }
    },
    INT("int") {
        @Override
        public boolean matches(Object value) {
            return isIntegral(value);
        }
    },
    FLOAT("float") {
        @Override
        public boolean matches(Object value) {
            return isFloating(value);
        }
    },
    BOOL("bool") {
        @Override
        public boolean matches(Object value) {
            return value instanceof Boolean;
        }
    };

    private final String tag;
    private final List<String> aliases;

    FieldType(String tag, String... aliases) {
        this.tag = tag;
        this.aliases = List.of(aliases);
    }

    public abstract boolean matches(Object value);

    /**
     * Canonical tag, used in error messages and when persisting a schema.
     */
    public String tag() {
        return tag;
    }

    public static Optional<FieldType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.tag.equals(t) || type.aliases.contains(t)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static List<String> supportedTags() {
        return List.of(STRING.tag, INT.tag, FLOAT.tag, BOOL.tag);
    }

    /**
     * Name of the runtime type of a decoded payload value, in the same vocabulary as the tags.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return STRING.tag;
        }
        if (value instanceof Boolean) {
            return BOOL.tag;
        }
        if (isIntegral(value)) {
            return INT.tag;
        }
        if (isFloating(value)) {
            return FLOAT.tag;
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof Collection || value.getClass().isArray()) {
            return "array";
        }
        return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    private static boolean isFloating(Object value) {
        return value instanceof Double
                || value instanceof Float
                || value instanceof BigDecimal;
    }
}
