package io.ini2toml.core.engine.toml;

import io.ini2toml.core.model.Commented;
import io.ini2toml.core.model.GroupedTable;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.KeyValue;
import io.ini2toml.core.model.StructuralValue;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes tables that carry no real data: tables whose entries are, transitively, nothing
 * but hidden markers or other such tables. Tables flagged with {@link IrNode#alwaysEmit()}
 * are kept (their own vacuous children are still removed).
 *
 * <p>
 * Pure: returns a new tree and leaves the input untouched. A single pass reaches the fixed
 * point, so pruning an already pruned tree returns an equal tree.
 */
public final class EmptyTablePruner {

    private static final Logger LOG = LoggerFactory.getLogger(EmptyTablePruner.class);

    private EmptyTablePruner() {
        // utility class
    }

    /**
     * Prunes the children of {@code document}; the document itself is always kept.
     *
     * @param document the root of the tree
     * @return a pruned copy
     */
    public static IrNode prune(IrNode document) {
        return pruneNode(document, new ArrayList<>());
    }

    /**
     * {@code true} if {@code value} is a table (possibly wrapped in a comment) without real
     * data.
     */
    public static boolean isVacuous(StructuralValue value) {
        if (value instanceof IrNode node) {
            if (node.alwaysEmit()) {
                return false;
            }
            return node.fields().stream().allMatch(f -> isVacuous(f.value()));
        }
        if (value instanceof GroupedTable table) {
            return table.pairs().stream().allMatch(p -> isVacuous(p.value()));
        }
        if (value instanceof Commented<?> commented && commented.value() instanceof StructuralValue inner) {
            return isVacuous(inner);
        }
        return false;
    }

    private static IrNode pruneNode(IrNode node, List<String> path) {
        IrNode out = new IrNode().inlineComment(node.inlineComment()).alwaysEmit(node.alwaysEmit());
        for (IrNode.Entry entry : node.entries()) {
            if (entry instanceof IrNode.Hidden hidden) {
                out.addHidden(hidden.marker());
                continue;
            }
            IrNode.Field field = (IrNode.Field) entry;
            path.add(field.key());
            if (isVacuous(field.value())) {
                LOG.debug("Pruning empty table: {}", String.join(".", path));
            } else {
                out.append(field.key(), pruneValue(field.value(), path));
            }
            path.remove(path.size() - 1);
        }
        return out;
    }

    private static StructuralValue pruneValue(StructuralValue value, List<String> path) {
        if (value instanceof IrNode node) {
            return pruneNode(node, path);
        }
        if (value instanceof GroupedTable table) {
            return pruneGroupedTable(table, path);
        }
        if (value instanceof Commented<?> commented && commented.value() instanceof StructuralValue inner) {
            return commented.withValue(pruneValue(inner, path));
        }
        return value;
    }

    private static GroupedTable pruneGroupedTable(GroupedTable table, List<String> path) {
        List<Commented<List<KeyValue>>> groups = new ArrayList<>(table.groupCount());
        for (Commented<List<KeyValue>> group : table.groups()) {
            if (!group.hasValue()) {
                groups.add(group);
                continue;
            }
            List<KeyValue> pairs = new ArrayList<>();
            for (KeyValue pair : group.value()) {
                path.add(pair.key());
                if (isVacuous(pair.value())) {
                    LOG.debug("Pruning empty table: {}", String.join(".", path));
                } else {
                    pairs.add(new KeyValue(pair.key(), pruneValue(pair.value(), path)));
                }
                path.remove(path.size() - 1);
            }
            groups.add(group.withValue(pairs));
        }
        return GroupedTable.of(groups);
    }
}
