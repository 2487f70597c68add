package io.ini2toml.core.engine.toml;

import static org.assertj.core.api.Assertions.assertThat;

import io.ini2toml.core.model.Commented;
import io.ini2toml.core.model.GroupedTable;
import io.ini2toml.core.model.HiddenMarker;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.KeyValue;
import io.ini2toml.core.model.Scalar;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EmptyTablePruner")
class EmptyTablePrunerTest {

    @Test
    @DisplayName("tables with only hidden markers are removed, transitively")
    void removesVacuousTables() {
        IrNode doc = new IrNode()
                .append("d", new IrNode().append("e", new IrNode().addHidden(HiddenMarker.comment("x"))))
                .append("keep", new IrNode().append("k", Scalar.of(1)));

        IrNode pruned = EmptyTablePruner.prune(doc);

        assertThat(pruned.keys()).containsExactly("keep");
    }

    @Test
    @DisplayName("hidden markers of surviving tables are kept in place")
    void keepsHiddenMarkers() {
        IrNode doc = new IrNode()
                .addHidden(HiddenMarker.comment("top"))
                .append("a", Scalar.of(1))
                .addHidden(HiddenMarker.blank());

        IrNode pruned = EmptyTablePruner.prune(doc);

        assertThat(pruned).isEqualTo(doc);
    }

    @Test
    @DisplayName("always-emit tables survive while their empty children go")
    void alwaysEmit() {
        IrNode flagged = new IrNode().alwaysEmit(true).append("empty", new IrNode());
        IrNode doc = new IrNode().append("f", flagged);

        IrNode pruned = EmptyTablePruner.prune(doc);

        assertThat(pruned.keys()).containsExactly("f");
        assertThat(((IrNode) pruned.get("f")).isEmpty()).isTrue();
        assertThat(((IrNode) pruned.get("f")).alwaysEmit()).isTrue();
    }

    @Test
    @DisplayName("empty tables inside grouped tables and comment wrappers are removed")
    void groupedAndCommented() {
        GroupedTable grouped = GroupedTable.of(List.of(GroupedTable.group(
                List.of(KeyValue.of("a", 1), new KeyValue("gone", new IrNode())), "c")));
        IrNode doc = new IrNode()
                .append("g", grouped)
                .append("wrapped", Commented.of(new IrNode(), "note"));

        IrNode pruned = EmptyTablePruner.prune(doc);

        assertThat(pruned.keys()).containsExactly("g");
        assertThat(((GroupedTable) pruned.get("g")).pairs()).containsExactly(KeyValue.of("a", 1));
        assertThat(((GroupedTable) pruned.get("g")).groups().get(0).comment()).isEqualTo("c");
    }

    @Test
    @DisplayName("pruning leaves the input untouched and is idempotent")
    void pureAndIdempotent() {
        IrNode doc = new IrNode()
                .append("a", new IrNode())
                .append("b", new IrNode().append("c", new IrNode()).append("k", Scalar.of("v")));
        IrNode before = doc.copy();

        IrNode once = EmptyTablePruner.prune(doc);
        IrNode twice = EmptyTablePruner.prune(once);

        assertThat(doc).isEqualTo(before);
        assertThat(twice).isEqualTo(once);
        assertThat(once.keys()).containsExactly("b");
        assertThat(((IrNode) once.get("b")).keys()).containsExactly("k");
    }

    @Test
    @DisplayName("scalars and lists are never vacuous")
    void nonTables() {
        assertThat(EmptyTablePruner.isVacuous(Scalar.of(""))).isFalse();
        assertThat(EmptyTablePruner.isVacuous(new IrNode())).isTrue();
        assertThat(EmptyTablePruner.isVacuous(Commented.of(new IrNode(), "x"))).isTrue();
    }
}
