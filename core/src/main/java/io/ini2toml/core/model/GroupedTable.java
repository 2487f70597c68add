package io.ini2toml.core.model;

import io.ini2toml.core.error.DuplicateKeyException;
import io.ini2toml.core.error.StructuralException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Table value whose key/value pairs are split into groups, each with its own optional
 * comment. The logical table is the ordered merge of all groups; keys are unique across
 * groups, which is checked at construction.
 *
 * <p>
 * A grouped table with more than one group always renders as a block table.
 *
 * <p>
 * Immutable.
 */
public final class GroupedTable implements StructuralValue {

    private final List<Commented<List<KeyValue>>> groups;

    private GroupedTable(List<Commented<List<KeyValue>>> groups) {
        this.groups = groups;
    }

    /**
     * Creates a grouped table.
     *
     * @throws StructuralException if a key appears more than once across the groups
     */
    public static GroupedTable of(List<Commented<List<KeyValue>>> groups) {
        Objects.requireNonNull(groups, "groups must not be null");
        Set<String> seen = new HashSet<>();
        List<Commented<List<KeyValue>>> copy = new ArrayList<>(groups.size());
        for (Commented<List<KeyValue>> group : groups) {
            Objects.requireNonNull(group, "group must not be null");
            for (KeyValue pair : group.valueOr(List.of())) {
                if (!seen.add(pair.key())) {
                    throw new StructuralException(
                            "Grouped table repeats key '" + pair.key() + "'", new DuplicateKeyException(pair.key()));
                }
            }
            copy.add(group.hasValue() ? group.withValue(List.copyOf(group.value())) : group);
        }
        return new GroupedTable(Collections.unmodifiableList(copy));
    }

    /** Builds one group; {@code comment} may be {@code null}. */
    public static Commented<List<KeyValue>> group(List<KeyValue> pairs, String comment) {
        return Commented.of(List.copyOf(pairs), comment);
    }

    /** Builds a group holding only a comment line. */
    public static Commented<List<KeyValue>> commentGroup(String comment) {
        return Commented.commentOnly(comment);
    }

    public List<Commented<List<KeyValue>>> groups() {
        return groups;
    }

    public int groupCount() {
        return groups.size();
    }

    /** All pairs of all groups, in order. */
    public List<KeyValue> pairs() {
        List<KeyValue> out = new ArrayList<>();
        for (Commented<List<KeyValue>> group : groups) {
            out.addAll(group.valueOr(List.of()));
        }
        return Collections.unmodifiableList(out);
    }

    public Optional<StructuralValue> find(String key) {
        for (KeyValue pair : pairs()) {
            if (pair.key().equals(key)) {
                return Optional.of(pair.value());
            }
        }
        return Optional.empty();
    }

    public boolean containsKey(String key) {
        return find(key).isPresent();
    }

    /** Returns a copy without {@code key}; the group that held it keeps its comment. */
    public GroupedTable without(String key) {
        List<Commented<List<KeyValue>>> out = new ArrayList<>(groups.size());
        for (Commented<List<KeyValue>> group : groups) {
            if (!group.hasValue()) {
                out.add(group);
                continue;
            }
            List<KeyValue> kept = group.value().stream()
                    .filter(pair -> !pair.key().equals(key))
                    .toList();
            out.add(group.withValue(kept));
        }
        return new GroupedTable(Collections.unmodifiableList(out));
    }

    public boolean hasComments() {
        return groups.stream().anyMatch(Commented::hasComment);
    }

    @Override
    public Object flatten() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (KeyValue pair : pairs()) {
            out.put(pair.key(), pair.value().flatten());
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupedTable that)) return false;
        return groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "GroupedTable" + groups;
    }
}
