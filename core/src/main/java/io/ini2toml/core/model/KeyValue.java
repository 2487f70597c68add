package io.ini2toml.core.model;

import java.util.Objects;

/**
 * One key/value pair of a {@link GroupedTable} group.
 *
 * @param key   the table key
 * @param value the value
 */
public record KeyValue(String key, StructuralValue value) {

    public KeyValue {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static KeyValue of(String key, Object scalar) {
        return new KeyValue(key, scalar instanceof StructuralValue sv ? sv : Scalar.of(scalar));
    }
}
