package io.ini2toml.core.engine.toml;

import io.ini2toml.core.error.SerializationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes flattened values (see {@link io.ini2toml.core.model.StructuralValue#flatten()}) as
 * TOML without comments. Scalars and arrays come first in each table, then sub-tables as
 * {@code [dotted.header]} blocks, then lists of tables as {@code [[dotted.header]]} blocks.
 * A header is omitted for a table that holds nothing but sub-tables.
 */
final class PlainTomlWriter {

    private final StringBuilder out = new StringBuilder();

    private PlainTomlWriter() {}

    static String write(Object flattened) {
        if (!(flattened instanceof Map<?, ?> document)) {
            throw new SerializationException("A document must flatten to a table", "<document>");
        }
        PlainTomlWriter writer = new PlainTomlWriter();
        writer.table(document, new ArrayList<>(), null);
        return writer.out.toString();
    }

    private void table(Map<?, ?> table, List<String> path, String header) {
        List<Map.Entry<?, ?>> values = new ArrayList<>();
        List<Map.Entry<?, ?>> tables = new ArrayList<>();
        List<Map.Entry<?, ?>> tableArrays = new ArrayList<>();
        for (Map.Entry<?, ?> entry : table.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?>) {
                tables.add(entry);
            } else if (isTableArray(entry.getValue())) {
                tableArrays.add(entry);
            } else {
                values.add(entry);
            }
        }
        boolean arrayElement = header != null && header.startsWith("[[");
        if (header != null && (arrayElement || !values.isEmpty() || (tables.isEmpty() && tableArrays.isEmpty()))) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(header).append('\n');
        }
        for (Map.Entry<?, ?> entry : values) {
            String key = String.valueOf(entry.getKey());
            path.add(key);
            out.append(TomlLiterals.key(key)).append(" = ").append(inline(entry.getValue(), path)).append('\n');
            path.remove(path.size() - 1);
        }
        for (Map.Entry<?, ?> entry : tables) {
            List<String> child = childPath(path, entry.getKey());
            table((Map<?, ?>) entry.getValue(), child, "[" + TomlLiterals.path(child) + "]");
        }
        for (Map.Entry<?, ?> entry : tableArrays) {
            List<String> child = childPath(path, entry.getKey());
            for (Object element : (List<?>) entry.getValue()) {
                table((Map<?, ?>) element, child, "[[" + TomlLiterals.path(child) + "]]");
            }
        }
    }

    private static boolean isTableArray(Object value) {
        return value instanceof List<?> list
                && !list.isEmpty()
                && list.stream().allMatch(element -> element instanceof Map<?, ?>);
    }

    private static List<String> childPath(List<String> path, Object key) {
        List<String> child = new ArrayList<>(path);
        child.add(String.valueOf(key));
        return child;
    }

    private static String inline(Object value, List<String> path) {
        if (value == null) {
            throw new SerializationException("A comment-only value cannot be rendered as a value", String.join(".", path));
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>(list.size());
            for (Object element : list) {
                items.add(inline(element, path));
            }
            return "[" + String.join(", ", items) + "]";
        }
        if (value instanceof Map<?, ?> map) {
            List<String> items = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                path.add(key);
                items.add(TomlLiterals.key(key) + " = " + inline(entry.getValue(), path));
                path.remove(path.size() - 1);
            }
            return items.isEmpty() ? "{}" : "{" + String.join(", ", items) + "}";
        }
        return TomlLiterals.scalar(value);
    }
}
