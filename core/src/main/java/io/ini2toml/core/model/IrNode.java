package io.ini2toml.core.model;

import io.ini2toml.core.error.DuplicateKeyException;
import io.ini2toml.core.error.IndexOutOfRangeException;
import io.ini2toml.core.error.KeyNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, comment-bearing container of the intermediate representation. Holds real
 * key/value {@link Field}s interleaved with {@link Hidden} layout markers, in stored order.
 *
 * <p>
 * Real keys are unique within one node; hidden entries may repeat. Iteration order is the
 * insertion order unless changed by {@link #insert}, {@link #rename} or
 * {@link #replaceFirstRemoveOthers}. Nesting is expressed by storing another
 * {@code IrNode} as a field value.
 *
 * <p>
 * Mutable and not thread-safe: a tree is created by the parser for one translation call and
 * is only touched by that call's processors.
 */
public final class IrNode implements StructuralValue {

    /** A stored entry: either a real field or a hidden layout marker. */
    public sealed interface Entry permits Field, Hidden {}

    /** A real key/value entry. */
    public record Field(String key, StructuralValue value) implements Entry {
        public Field {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** A comment or blank line kept at its position. */
    public record Hidden(HiddenMarker marker) implements Entry {
        public Hidden {
            Objects.requireNonNull(marker, "marker must not be null");
        }
    }

    private final List<Entry> entries = new ArrayList<>();
    private String inlineComment;
    private boolean alwaysEmit;

    public IrNode() {}

    /** Creates a node with the given fields, in map iteration order. */
    public static IrNode of(Map<String, ? extends StructuralValue> fields) {
        IrNode node = new IrNode();
        fields.forEach(node::append);
        return node;
    }

    // --- Lookup ---

    /**
     * Returns the value stored under {@code key}.
     *
     * @throws KeyNotFoundException if the key is absent
     */
    public StructuralValue get(String key) {
        return find(key).orElseThrow(() -> new KeyNotFoundException(key));
    }

    public Optional<StructuralValue> find(String key) {
        int i = positionOf(key);
        return i < 0 ? Optional.empty() : Optional.of(((Field) entries.get(i)).value());
    }

    public boolean containsKey(String key) {
        return positionOf(key) >= 0;
    }

    /**
     * Position of {@code key} among all entries, hidden ones included.
     *
     * @throws KeyNotFoundException if the key is absent
     */
    public int indexOf(String key) {
        int i = positionOf(key);
        if (i < 0) {
            throw new KeyNotFoundException(key);
        }
        return i;
    }

    // --- Mutation ---

    /** Replaces the value in place if {@code key} exists, otherwise appends it. */
    public IrNode set(String key, StructuralValue value) {
        int i = positionOf(key);
        if (i < 0) {
            entries.add(new Field(key, value));
        } else {
            entries.set(i, new Field(key, value));
        }
        return this;
    }

    /**
     * Appends a new field.
     *
     * @throws DuplicateKeyException if the key already exists
     */
    public IrNode append(String key, StructuralValue value) {
        return insert(entries.size(), key, value);
    }

    /**
     * Inserts a new field at {@code index}, shifting later entries.
     *
     * @throws IndexOutOfRangeException if {@code index} is outside {@code [0, size]}
     * @throws DuplicateKeyException    if the key already exists
     */
    public IrNode insert(int index, String key, StructuralValue value) {
        checkPosition(index);
        if (containsKey(key)) {
            throw new DuplicateKeyException(key);
        }
        entries.add(index, new Field(key, value));
        return this;
    }

    /**
     * Renames a field, keeping its position and value. Renaming a key to itself is a no-op.
     *
     * @throws KeyNotFoundException  if {@code oldKey} is absent
     * @throws DuplicateKeyException if {@code newKey} is already used by another entry
     */
    public IrNode rename(String oldKey, String newKey) {
        return rename(oldKey, newKey, false);
    }

    /** Like {@link #rename(String, String)}, but silently ignores a missing {@code oldKey} on request. */
    public IrNode rename(String oldKey, String newKey, boolean ignoreMissing) {
        Objects.requireNonNull(newKey, "newKey must not be null");
        int i = positionOf(oldKey);
        if (i < 0) {
            if (ignoreMissing) {
                return this;
            }
            throw new KeyNotFoundException(oldKey);
        }
        if (oldKey.equals(newKey)) {
            return this;
        }
        if (containsKey(newKey)) {
            throw new DuplicateKeyException(newKey);
        }
        entries.set(i, new Field(newKey, ((Field) entries.get(i)).value()));
        return this;
    }

    /**
     * Removes a field; the relative order of the remaining entries is unchanged.
     *
     * @return the removed value
     * @throws KeyNotFoundException if the key is absent
     */
    public StructuralValue remove(String key) {
        int i = indexOf(key);
        return ((Field) entries.remove(i)).value();
    }

    /** Appends a hidden marker. */
    public IrNode addHidden(HiddenMarker marker) {
        entries.add(new Hidden(marker));
        return this;
    }

    /**
     * Inserts a hidden marker at {@code index}.
     *
     * @throws IndexOutOfRangeException if {@code index} is outside {@code [0, size]}
     */
    public IrNode addHidden(HiddenMarker marker, int index) {
        checkPosition(index);
        entries.add(index, new Hidden(marker));
        return this;
    }

    /**
     * Removes every key of {@code existingKeys} that is present and stores {@code value}
     * under {@code newKey} at the position of the first of them (or at the end when none is
     * present).
     *
     * @return the position of the new entry
     * @throws DuplicateKeyException if {@code newKey} is present and not among
     *                               {@code existingKeys}; the node is left unchanged
     */
    public int replaceFirstRemoveOthers(List<String> existingKeys, String newKey, StructuralValue value) {
        if (containsKey(newKey) && !existingKeys.contains(newKey)) {
            throw new DuplicateKeyException(newKey);
        }
        int insertAt = entries.size();
        for (String key : existingKeys) {
            int i = positionOf(key);
            if (i >= 0) {
                insertAt = Math.min(insertAt, i);
            }
        }
        for (String key : existingKeys) {
            int i = positionOf(key);
            if (i >= 0) {
                entries.remove(i);
            }
        }
        insertAt = Math.min(insertAt, entries.size());
        entries.add(insertAt, new Field(newKey, value));
        return insertAt;
    }

    // --- Views ---

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** All entries, hidden ones included, in stored order (unmodifiable snapshot). */
    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    /** Real fields only, in stored order. */
    public List<Field> fields() {
        List<Field> out = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry instanceof Field field) {
                out.add(field);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public List<String> keys() {
        return fields().stream().map(Field::key).toList();
    }

    /** Comment rendered after the table header, or {@code null}. */
    public String inlineComment() {
        return inlineComment;
    }

    public IrNode inlineComment(String comment) {
        this.inlineComment = comment;
        return this;
    }

    /** {@code true} if this table must be emitted even when it holds no real data. */
    public boolean alwaysEmit() {
        return alwaysEmit;
    }

    public IrNode alwaysEmit(boolean alwaysEmit) {
        this.alwaysEmit = alwaysEmit;
        return this;
    }

    /** Shallow copy: nested values are shared. */
    public IrNode copy() {
        IrNode copy = new IrNode();
        copy.entries.addAll(entries);
        copy.inlineComment = inlineComment;
        copy.alwaysEmit = alwaysEmit;
        return copy;
    }

    @Override
    public Object flatten() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Entry entry : entries) {
            if (entry instanceof Field field) {
                out.put(field.key(), field.value().flatten());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    // --- Private helpers ---

    private int positionOf(String key) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) instanceof Field field && field.key().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    private void checkPosition(int index) {
        if (index < 0 || index > entries.size()) {
            throw new IndexOutOfRangeException(index, entries.size());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrNode that)) return false;
        return alwaysEmit == that.alwaysEmit
                && Objects.equals(inlineComment, that.inlineComment)
                && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, inlineComment, alwaysEmit);
    }

    @Override
    public String toString() {
        return "IrNode[entries=" + entries + ", inlineComment=" + inlineComment + "]";
    }
}
