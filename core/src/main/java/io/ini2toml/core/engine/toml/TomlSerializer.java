package io.ini2toml.core.engine.toml;

import io.ini2toml.core.error.SerializationException;
import io.ini2toml.core.model.Commented;
import io.ini2toml.core.model.GroupedList;
import io.ini2toml.core.model.GroupedTable;
import io.ini2toml.core.model.HiddenMarker;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.KeyValue;
import io.ini2toml.core.model.Scalar;
import io.ini2toml.core.model.StructuralValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders an intermediate representation as TOML text.
 *
 * <p>
 * Shape decisions are made per table: a table is written inline ({@code k = {a = 1}}) only
 * when it is not a multi-group {@link GroupedTable}, none of its members carries a comment,
 * every nested table is inline-able and every nested array fits on one line, and its
 * flattened entry count does not exceed {@link RenderOptions#inlineTableMaxEntries()}.
 * Otherwise it becomes a {@code [dotted.header]} block. Arrays with one group are written on
 * one line; arrays with more groups get one line per group. An array whose elements are all
 * tables, at least one of which cannot be inline, becomes an array of tables
 * ({@code [[dotted.header]]} per element). Group comments of arrays nested in arrays are
 * carried to the enclosing array's line.
 *
 * <p>
 * With {@link RenderOptions#plain()} the pruned tree is flattened and written without any
 * comments or layout markers by {@link PlainTomlWriter}.
 *
 * <p>
 * Empty tables are pruned with {@link EmptyTablePruner} before rendering. Hidden markers are
 * written at their stored position. Because TOML cannot re-open a table, real entries that
 * are stored after a block child are moved in front of the first block child, together with
 * the hidden markers directly preceding them.
 *
 * <p>
 * Output depends only on the tree and the options. Stateless and thread-safe.
 */
public final class TomlSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(TomlSerializer.class);

    private final RenderOptions options;

    public TomlSerializer() {
        this(RenderOptions.DEFAULT);
    }

    public TomlSerializer(RenderOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public RenderOptions options() {
        return options;
    }

    /**
     * Renders {@code document} as a TOML document.
     *
     * @throws SerializationException if a value has no legal TOML rendering
     */
    public String serialize(IrNode document) {
        Objects.requireNonNull(document, "document must not be null");
        IrNode pruned = EmptyTablePruner.prune(document);
        if (options.plain()) {
            String text = PlainTomlWriter.write(pruned.flatten());
            LOG.debug("toml.serialized mode=plain entries={} length={}", pruned.size(), text.length());
            return text;
        }
        Emitter out = new Emitter();
        if (hasText(pruned.inlineComment())) {
            out.line(TomlLiterals.comment(pruned.inlineComment()));
        }
        out.writeBody(view(pruned, null), new ArrayList<>());
        String text = out.toString();
        LOG.debug("toml.serialized entries={} length={}", pruned.size(), text.length());
        return text;
    }

    // --- Table layout ---

    /** One line-level member of a table body. */
    private sealed interface Member permits FieldLine, NoteLine, GapLine {}

    /** A key/value line; {@code comment} is the comment a grouped table attached to it. */
    private record FieldLine(String key, StructuralValue value, String comment) implements Member {}

    private record NoteLine(String text) implements Member {}

    private record GapLine() implements Member {}

    /**
     * Rendering view of a table value.
     *
     * @param members       body in block form, comments attached to their lines
     * @param headerComment comment written after the block header
     * @param inlineComment comment written after the closing brace in inline form
     * @param inlineMembers body in inline form
     * @param multiGroup    true for grouped tables with several groups (block only)
     */
    private record TableView(
            List<Member> members,
            String headerComment,
            String inlineComment,
            List<Member> inlineMembers,
            boolean multiGroup) {}

    /** A value with its (possibly nested) comment wrappers removed. */
    private record Unwrapped(StructuralValue value, String comment) {}

    private static TableView view(StructuralValue table, String outerComment) {
        if (table instanceof IrNode node) {
            List<Member> members = new ArrayList<>(node.size());
            for (IrNode.Entry entry : node.entries()) {
                if (entry instanceof IrNode.Field field) {
                    members.add(new FieldLine(field.key(), field.value(), null));
                } else if (((IrNode.Hidden) entry).marker() instanceof HiddenMarker.Comment c) {
                    members.add(new NoteLine(c.text()));
                } else {
                    members.add(new GapLine());
                }
            }
            String comment = join(outerComment, node.inlineComment());
            return new TableView(members, comment, comment, members, false);
        }
        GroupedTable grouped = (GroupedTable) table;
        List<Member> members = new ArrayList<>();
        for (Commented<List<KeyValue>> group : grouped.groups()) {
            List<KeyValue> pairs = group.valueOr(List.of());
            for (int i = 0; i < pairs.size(); i++) {
                KeyValue pair = pairs.get(i);
                String comment = i == pairs.size() - 1 ? group.comment() : null;
                members.add(new FieldLine(pair.key(), pair.value(), comment));
            }
            if (pairs.isEmpty() && group.hasComment()) {
                members.add(new NoteLine(group.comment()));
            }
        }
        if (grouped.groupCount() == 1) {
            Commented<List<KeyValue>> only = grouped.groups().get(0);
            List<Member> plain = new ArrayList<>();
            for (KeyValue pair : only.valueOr(List.of())) {
                plain.add(new FieldLine(pair.key(), pair.value(), null));
            }
            return new TableView(members, outerComment, join(outerComment, only.comment()), plain, false);
        }
        return new TableView(members, outerComment, outerComment, members, grouped.groupCount() > 1);
    }

    private static Unwrapped unwrap(StructuralValue value, List<String> path) {
        StructuralValue current = value;
        String comment = null;
        while (current instanceof Commented<?> commented) {
            if (!commented.hasValue()) {
                throw new SerializationException("A comment-only value cannot be rendered as a value", dotted(path));
            }
            if (!(commented.value() instanceof StructuralValue inner)) {
                throw new SerializationException(
                        "Unsupported commented value of type "
                                + commented.value().getClass().getName(),
                        dotted(path));
            }
            comment = join(comment, commented.comment());
            current = inner;
        }
        return new Unwrapped(current, comment);
    }

    private static boolean isTable(StructuralValue value) {
        return value instanceof IrNode || value instanceof GroupedTable;
    }

    // --- Inline decisions ---

    /**
     * Flattened entry count of a table in inline form, or -1 if it cannot be inline.
     *
     * @param nested    true when the table sits inside another inline table or an array,
     *                  where it cannot carry a trailing comment
     * @param checkSize whether to apply the entry-count threshold
     */
    private int inlineSize(TableView view, boolean nested, boolean checkSize, List<String> path) {
        if (view.multiGroup() || (nested && hasText(view.inlineComment()))) {
            return -1;
        }
        int count = 0;
        for (Member member : view.inlineMembers()) {
            if (member instanceof NoteLine) {
                return -1;
            }
            if (!(member instanceof FieldLine field)) {
                continue;
            }
            path.add(field.key());
            try {
                Unwrapped u = unwrap(field.value(), path);
                if (hasText(field.comment()) || hasText(u.comment())) {
                    return -1;
                }
                if (isTable(u.value())) {
                    int nestedCount = inlineSize(view(u.value(), null), true, false, path);
                    if (nestedCount < 0) {
                        return -1;
                    }
                    count += nestedCount;
                } else if (u.value() instanceof GroupedList list
                        && (isTableArray(list, path) || !isSingleLine(list, path))) {
                    return -1;
                } else {
                    count++;
                }
            } finally {
                path.remove(path.size() - 1);
            }
        }
        if (checkSize && count > options.inlineTableMaxEntries()) {
            return -1;
        }
        return count;
    }

    private boolean isSingleLine(GroupedList list, List<String> path) {
        if (list.groupCount() > 1 || list.hasComments()) {
            return false;
        }
        return elementComments(list.values(), path) == null;
    }

    /**
     * True if every element of {@code list} is a table and at least one of them cannot be
     * written inline, so the list needs {@code [[header]]} blocks.
     */
    private boolean isTableArray(GroupedList list, List<String> path) {
        List<StructuralValue> values = list.values();
        if (values.isEmpty()) {
            return false;
        }
        boolean needsBlocks = false;
        for (StructuralValue value : values) {
            StructuralValue element = unwrap(value, path).value();
            if (!isTable(element)) {
                return false;
            }
            if (inlineSize(view(element, null), true, false, path) < 0) {
                needsBlocks = true;
            }
        }
        return needsBlocks;
    }

    private boolean isBlock(FieldLine field, List<String> path, boolean topLevel) {
        Unwrapped u = unwrap(field.value(), path);
        if (u.value() instanceof GroupedList list) {
            return isTableArray(list, path);
        }
        if (!isTable(u.value())) {
            return false;
        }
        if (topLevel && options.topLevelTablesAsBlocks() && u.value() instanceof IrNode) {
            return true;
        }
        return inlineSize(view(u.value(), join(field.comment(), u.comment())), false, true, path) < 0;
    }

    /** Comments of the elements, including the group comments of nested arrays. */
    private static String elementComments(List<StructuralValue> values, List<String> path) {
        String comment = null;
        for (StructuralValue value : values) {
            Unwrapped u = unwrap(value, path);
            comment = join(comment, u.comment());
            if (u.value() instanceof GroupedList nested) {
                for (Commented<List<StructuralValue>> group : nested.groups()) {
                    comment = join(comment, group.comment());
                    comment = join(comment, elementComments(group.valueOr(List.of()), path));
                }
            }
        }
        return comment;
    }

    // --- Helpers ---

    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }

    private static String join(String first, String second) {
        if (!hasText(first)) return hasText(second) ? second : null;
        if (!hasText(second)) return first;
        return first + "; " + second;
    }

    private static String dotted(List<String> path) {
        return path.isEmpty() ? "<document>" : String.join(".", path);
    }

    private static String trailing(String comment) {
        return hasText(comment) ? " " + TomlLiterals.comment(comment) : "";
    }

    /** Accumulates output lines for one {@link #serialize} call. */
    private final class Emitter {

        private final StringBuilder out = new StringBuilder();

        void line(String text) {
            out.append(text).append('\n');
        }

        void writeBody(TableView view, List<String> path) {
            List<Member> members = view.members();
            boolean topLevel = path.isEmpty();
            boolean[] block = new boolean[members.size()];
            int firstBlock = -1;
            for (int i = 0; i < members.size(); i++) {
                if (members.get(i) instanceof FieldLine field) {
                    path.add(field.key());
                    block[i] = isBlock(field, path, topLevel);
                    path.remove(path.size() - 1);
                    if (block[i] && firstBlock < 0) {
                        firstBlock = i;
                    }
                }
            }
            if (firstBlock < 0) {
                for (Member member : members) {
                    writeMember(member, path);
                }
                return;
            }
            List<Integer> hoisted = new ArrayList<>();
            List<Integer> rest = new ArrayList<>();
            List<Integer> pendingHidden = new ArrayList<>();
            for (int i = firstBlock; i < members.size(); i++) {
                if (!(members.get(i) instanceof FieldLine)) {
                    pendingHidden.add(i);
                } else if (block[i]) {
                    rest.addAll(pendingHidden);
                    pendingHidden.clear();
                    rest.add(i);
                } else {
                    hoisted.addAll(pendingHidden);
                    pendingHidden.clear();
                    hoisted.add(i);
                }
            }
            rest.addAll(pendingHidden);

            for (int i = 0; i < firstBlock; i++) {
                writeMember(members.get(i), path);
            }
            for (int i : hoisted) {
                writeMember(members.get(i), path);
            }
            for (int i : rest) {
                if (block[i]) {
                    writeBlock((FieldLine) members.get(i), path);
                } else {
                    writeMember(members.get(i), path);
                }
            }
        }

        private void writeMember(Member member, List<String> path) {
            if (member instanceof FieldLine field) {
                path.add(field.key());
                writeInlineField(field, path);
                path.remove(path.size() - 1);
            } else if (member instanceof NoteLine note) {
                if (note.text().isEmpty()) {
                    line("#");
                }
                for (String text : note.text().split("\\r?\\n")) {
                    if (!note.text().isEmpty()) {
                        line(TomlLiterals.comment(text));
                    }
                }
            } else {
                line("");
            }
        }

        private void writeBlock(FieldLine field, List<String> parentPath) {
            List<String> path = new ArrayList<>(parentPath);
            path.add(field.key());
            Unwrapped u = unwrap(field.value(), path);
            if (u.value() instanceof GroupedList list) {
                writeTableArray(list, join(field.comment(), u.comment()), path);
                return;
            }
            TableView view = view(u.value(), join(field.comment(), u.comment()));
            separateBlock();
            line("[" + TomlLiterals.path(path) + "]" + trailing(view.headerComment()));
            writeBody(view, path);
        }

        /**
         * One {@code [[path]]} block per element. The array's own comment and its group
         * comments are written as comment lines above the next element header.
         */
        private void writeTableArray(GroupedList list, String comment, List<String> path) {
            String header = "[[" + TomlLiterals.path(path) + "]]";
            String pending = comment;
            for (Commented<List<StructuralValue>> group : list.groups()) {
                pending = join(pending, group.comment());
                for (StructuralValue element : group.valueOr(List.of())) {
                    Unwrapped u = unwrap(element, path);
                    TableView view = view(u.value(), u.comment());
                    separateBlock();
                    if (hasText(pending)) {
                        line(TomlLiterals.comment(pending));
                        pending = null;
                    }
                    line(header + trailing(view.headerComment()));
                    writeBody(view, path);
                }
            }
            if (hasText(pending)) {
                line(TomlLiterals.comment(pending));
            }
        }

        private void separateBlock() {
            if (out.length() > 0 && !endsWithBlankLine()) {
                out.append('\n');
            }
        }

        private void writeInlineField(FieldLine field, List<String> path) {
            Unwrapped u = unwrap(field.value(), path);
            String comment = join(field.comment(), u.comment());
            String key = TomlLiterals.key(field.key());
            StructuralValue value = u.value();
            if (isTable(value)) {
                TableView view = view(value, null);
                line(key + " = " + inlineTable(view, path) + trailing(join(comment, view.inlineComment())));
            } else if (value instanceof GroupedList list) {
                writeArray(key, list, comment, path);
            } else {
                line(key + " = " + TomlLiterals.scalar(((Scalar) value).value()) + trailing(comment));
            }
        }

        private void writeArray(String key, GroupedList list, String comment, List<String> path) {
            if (list.groupCount() <= 1) {
                String groupComment = list.groupCount() == 1 ? list.groups().get(0).comment() : null;
                String all = join(join(comment, groupComment), elementComments(list.values(), path));
                line(key + " = " + inlineArray(list.values(), path) + trailing(all));
                return;
            }
            line(key + " = [");
            for (Commented<List<StructuralValue>> group : list.groups()) {
                List<StructuralValue> values = group.valueOr(List.of());
                String lineComment = join(group.comment(), elementComments(values, path));
                if (!values.isEmpty()) {
                    String items = values.stream()
                            .map(v -> inlineValue(v, path))
                            .collect(Collectors.joining(", "));
                    line(options.indent() + items + "," + trailing(lineComment));
                } else if (hasText(lineComment)) {
                    line(options.indent() + TomlLiterals.comment(lineComment));
                } else {
                    line("");
                }
            }
            line("]" + trailing(comment));
        }

        private String inlineValue(StructuralValue value, List<String> path) {
            StructuralValue v = unwrap(value, path).value();
            if (v instanceof Scalar scalar) {
                return TomlLiterals.scalar(scalar.value());
            }
            if (v instanceof GroupedList list) {
                return inlineArray(list.values(), path);
            }
            TableView view = view(v, null);
            if (inlineSize(view, true, false, path) < 0) {
                throw new SerializationException(
                        "Table with comments or several groups cannot be rendered inside an array", dotted(path));
            }
            return inlineTable(view, path);
        }

        private String inlineArray(List<StructuralValue> values, List<String> path) {
            return values.stream().map(v -> inlineValue(v, path)).collect(Collectors.joining(", ", "[", "]"));
        }

        private String inlineTable(TableView view, List<String> path) {
            List<String> items = new ArrayList<>();
            for (Member member : view.inlineMembers()) {
                if (member instanceof FieldLine field) {
                    path.add(field.key());
                    items.add(TomlLiterals.key(field.key()) + " = " + inlineValue(field.value(), path));
                    path.remove(path.size() - 1);
                }
            }
            return items.isEmpty() ? "{}" : "{" + String.join(", ", items) + "}";
        }

        private boolean endsWithBlankLine() {
            int n = out.length();
            return n >= 2 && out.charAt(n - 1) == '\n' && out.charAt(n - 2) == '\n';
        }

        @Override
        public String toString() {
            return out.toString();
        }
    }
}
