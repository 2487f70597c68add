package io.ini2toml.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A value of the intermediate representation. Variants are known at compile time: plain
 * {@link Scalar}s, {@link Commented} wrappers, line-grouped {@link GroupedList}s and
 * {@link GroupedTable}s, and nested {@link IrNode} containers.
 *
 * <p>
 * Layout-only entries (comment lines, blank lines) are not values; they live in an
 * {@link IrNode} as {@link HiddenMarker}s.
 */
public sealed interface StructuralValue permits Scalar, Commented, GroupedList, GroupedTable, IrNode {

    /**
     * Strips comments and grouping and returns the plain logical value: the wrapped Java
     * object for scalars, an unmodifiable {@link List} for arrays, and an unmodifiable
     * insertion-ordered {@link Map} for tables. Recursive and side-effect free.
     */
    Object flatten();

    /**
     * Projects any value to its plain form. Structural values are flattened; maps and lists
     * produced by a previous flatten are rebuilt element-wise, so
     * {@code flattenValue(flattenValue(x)).equals(flattenValue(x))} always holds.
     *
     * @param value a structural value, a plain value, or {@code null}
     * @return the plain projection
     */
    static Object flattenValue(Object value) {
        if (value instanceof StructuralValue structural) {
            return structural.flatten();
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, flattenValue(v)));
            return Collections.unmodifiableMap(out);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(flattenValue(element));
            }
            return Collections.unmodifiableList(out);
        }
        return value;
    }
}
