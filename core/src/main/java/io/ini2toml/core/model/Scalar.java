package io.ini2toml.core.model;

import io.ini2toml.core.error.StructuralException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Leaf value without a comment: a string, boolean, number or local/offset date-time.
 *
 * @param value the wrapped value; never null
 */
public record Scalar(Object value) implements StructuralValue {

    public Scalar {
        Objects.requireNonNull(value, "scalar value must not be null");
        if (!isSupported(value)) {
            throw new StructuralException("Unsupported scalar type: "
                    + value.getClass().getName());
        }
    }

    public static Scalar of(Object value) {
        return new Scalar(value);
    }

    public boolean isString() {
        return value instanceof String;
    }

    /** Returns the value as a string if it is one, {@code null} otherwise. */
    public String asString() {
        return value instanceof String s ? s : null;
    }

    @Override
    public Object flatten() {
        return value;
    }

    private static boolean isSupported(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigDecimal
                || value instanceof LocalDate
                || value instanceof LocalTime
                || value instanceof LocalDateTime
                || value instanceof OffsetDateTime;
    }
}
