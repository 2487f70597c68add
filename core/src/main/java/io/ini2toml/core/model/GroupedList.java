package io.ini2toml.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Array value whose elements are split into groups. Each group carries its own optional
 * comment and renders as one output line; the logical array is the concatenation of all
 * groups in order.
 *
 * <p>
 * Immutable.
 */
public final class GroupedList implements StructuralValue {

    private final List<Commented<List<StructuralValue>>> groups;

    private GroupedList(List<Commented<List<StructuralValue>>> groups) {
        this.groups = groups;
    }

    public static GroupedList of(List<Commented<List<StructuralValue>>> groups) {
        Objects.requireNonNull(groups, "groups must not be null");
        List<Commented<List<StructuralValue>>> copy = new ArrayList<>(groups.size());
        for (Commented<List<StructuralValue>> group : groups) {
            Objects.requireNonNull(group, "group must not be null");
            copy.add(group.hasValue() ? group.withValue(List.copyOf(group.value())) : group);
        }
        return new GroupedList(Collections.unmodifiableList(copy));
    }

    /** A list made of a single group without comment. */
    public static GroupedList single(List<? extends StructuralValue> values) {
        return of(List.of(group(values, null)));
    }

    /** Builds one group; {@code comment} may be {@code null}. */
    public static Commented<List<StructuralValue>> group(List<? extends StructuralValue> values, String comment) {
        return Commented.of(List.copyOf(values), comment);
    }

    /** Builds a group holding only a comment line. */
    public static Commented<List<StructuralValue>> commentGroup(String comment) {
        return Commented.commentOnly(comment);
    }

    public List<Commented<List<StructuralValue>>> groups() {
        return groups;
    }

    public int groupCount() {
        return groups.size();
    }

    /** All values of all groups, in order. */
    public List<StructuralValue> values() {
        List<StructuralValue> out = new ArrayList<>();
        for (Commented<List<StructuralValue>> group : groups) {
            out.addAll(group.valueOr(List.of()));
        }
        return Collections.unmodifiableList(out);
    }

    /** {@code true} if any group carries a comment. */
    public boolean hasComments() {
        return groups.stream().anyMatch(Commented::hasComment);
    }

    @Override
    public Object flatten() {
        return StructuralValue.flattenValue(values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupedList that)) return false;
        return groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "GroupedList" + groups;
    }
}
