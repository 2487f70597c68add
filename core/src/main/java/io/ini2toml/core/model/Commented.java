package io.ini2toml.core.model;

import java.util.Objects;

/**
 * Wraps a value with an optional trailing comment. The value itself is optional too: a
 * "comment-only" instance stands for a line that held nothing but a comment.
 *
 * <p>
 * As a container value, {@code T} is expected to be a {@link StructuralValue}; grouped
 * lists and tables use {@code Commented<List<...>>} for their groups, one per output line.
 *
 * @param <T> type of the wrapped value
 */
public final class Commented<T> implements StructuralValue {

    private final T value;
    private final String comment;

    private Commented(T value, String comment) {
        this.value = value;
        this.comment = comment;
    }

    public static <T> Commented<T> of(T value, String comment) {
        return new Commented<>(Objects.requireNonNull(value, "value must not be null"), comment);
    }

    public static <T> Commented<T> of(T value) {
        return of(value, null);
    }

    /** A line that carries only a comment. */
    public static <T> Commented<T> commentOnly(String comment) {
        return new Commented<>(null, Objects.requireNonNull(comment, "comment must not be null"));
    }

    /** The wrapped value, or {@code null} for comment-only instances. */
    public T value() {
        return value;
    }

    public T valueOr(T fallback) {
        return value != null ? value : fallback;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isCommentOnly() {
        return value == null;
    }

    /** The comment text, or {@code null} if none was given. */
    public String comment() {
        return comment;
    }

    public boolean hasComment() {
        return comment != null && !comment.isEmpty();
    }

    /** Returns a copy wrapping {@code newValue} with the same comment. */
    public <R> Commented<R> withValue(R newValue) {
        return new Commented<>(newValue, comment);
    }

    @Override
    public Object flatten() {
        return StructuralValue.flattenValue(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Commented<?> that)) return false;
        return Objects.equals(value, that.value) && Objects.equals(comment, that.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, comment);
    }

    @Override
    public String toString() {
        return "Commented[value=" + value + ", comment=" + comment + "]";
    }
}
