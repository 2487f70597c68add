package io.ini2toml.core.engine.toml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ini2toml.core.error.SerializationException;
import io.ini2toml.core.model.Commented;
import io.ini2toml.core.model.GroupedList;
import io.ini2toml.core.model.GroupedTable;
import io.ini2toml.core.model.HiddenMarker;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.KeyValue;
import io.ini2toml.core.model.Scalar;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TomlSerializer")
class TomlSerializerTest {

    private final TomlSerializer serializer = new TomlSerializer();

    private static IrNode fiveEntries() {
        return new IrNode()
                .append("a", Scalar.of(1))
                .append("b", Scalar.of(2))
                .append("c", Scalar.of(3))
                .append("d", Scalar.of(4))
                .append("e", Scalar.of(5));
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        @DisplayName("a commented scalar keeps its comment on the same line")
        void commentedScalar() {
            IrNode doc = new IrNode().append("a", Commented.of(Scalar.of(1), "keep"));

            assertThat(serializer.serialize(doc)).isEqualTo("a = 1 # keep\n");
        }

        @Test
        @DisplayName("a single commented group renders as a one-line array")
        void singleGroupArray() {
            GroupedList list = GroupedList.of(List.of(GroupedList.group(List.of(Scalar.of(2), Scalar.of(3)), "grp1")));
            IrNode doc = new IrNode().append("b", list);

            assertThat(serializer.serialize(doc)).isEqualTo("b = [2, 3] # grp1\n");
        }

        @Test
        @DisplayName("section fields keep their own comments")
        void sectionFieldComments() {
            IrNode c = new IrNode()
                    .append("x", Commented.of(Scalar.of(1), "c1"))
                    .append("y", Commented.of(Scalar.of(2), "c2"));
            IrNode doc = new IrNode().append("c", c);

            assertThat(serializer.serialize(doc)).isEqualTo("[c]\nx = 1 # c1\ny = 2 # c2\n");
        }

        @Test
        @DisplayName("standalone comments, blank lines and the header comment stay in place")
        void hiddenMarkersAndHeaderComment() {
            IrNode s = new IrNode()
                    .inlineComment("note")
                    .append("x", Scalar.of(1))
                    .addHidden(HiddenMarker.comment("explain y"))
                    .append("y", Scalar.of("two"))
                    .addHidden(HiddenMarker.blank());
            IrNode doc = new IrNode().append("s", s);

            assertThat(serializer.serialize(doc)).isEqualTo("[s] # note\nx = 1\n# explain y\ny = \"two\"\n\n");
        }

        @Test
        @DisplayName("a grouped section whose groups carry comments keeps one comment per line")
        void groupedSectionComments() {
            GroupedTable c = GroupedTable.of(List.of(
                    GroupedTable.group(List.of(KeyValue.of("x", 1)), "c1"),
                    GroupedTable.group(List.of(KeyValue.of("y", 2)), "c2")));
            IrNode doc = new IrNode().append("c", c);

            assertThat(serializer.serialize(doc)).isEqualTo("[c]\nx = 1 # c1\ny = 2 # c2\n");
        }

        @Test
        @DisplayName("control characters in a comment are escaped so the document stays valid")
        void controlCharacterInComment() {
            IrNode doc = new IrNode().append("a", Commented.of(Scalar.of(1), "bell\u0007"));

            assertThat(serializer.serialize(doc)).isEqualTo("a = 1 # bell\\u0007\n");
        }

        @Test
        @DisplayName("the document comment becomes a leading comment line")
        void documentComment() {
            IrNode doc = new IrNode().inlineComment("header").append("a", Scalar.of(1));

            assertThat(serializer.serialize(doc)).isEqualTo("# header\na = 1\n");
        }

        @Test
        @DisplayName("a comment-only value cannot be rendered and reports its key path")
        void commentOnlyValue() {
            IrNode s = new IrNode().append("v", Commented.commentOnly("just a note"));
            IrNode doc = new IrNode().append("s", s);

            assertThatThrownBy(() -> serializer.serialize(doc))
                    .isInstanceOf(SerializationException.class)
                    .satisfies(e -> assertThat(((SerializationException) e).keyPath()).isEqualTo("s.v"));
        }
    }

    @Nested
    @DisplayName("Arrays")
    class Arrays {

        @Test
        @DisplayName("several groups render one line per group")
        void multiLineArray() {
            GroupedList list = GroupedList.of(List.of(
                    GroupedList.group(List.of(Scalar.of(1), Scalar.of(2), Scalar.of(3)), "1st line comment"),
                    GroupedList.commentGroup("2nd line comment")));
            IrNode doc = new IrNode().append("other value", list);

            assertThat(serializer.serialize(doc))
                    .isEqualTo("\"other value\" = [\n    1, 2, 3, # 1st line comment\n    # 2nd line comment\n]\n");
        }

        @Test
        @DisplayName("the configured indent is used for group lines")
        void customIndent() {
            GroupedList list = GroupedList.of(List.of(
                    GroupedList.group(List.of(Scalar.of("a")), null),
                    GroupedList.group(List.of(Scalar.of("b")), "second")));
            IrNode doc = new IrNode().append("deps", list);

            String toml = new TomlSerializer(RenderOptions.DEFAULT.withIndent("\t")).serialize(doc);

            assertThat(toml).isEqualTo("deps = [\n\t\"a\",\n\t\"b\", # second\n]\n");
        }

        @Test
        @DisplayName("a table with comments inside an array makes it an array of tables")
        void commentedTableInArray() {
            IrNode element = new IrNode().append("x", Commented.of(Scalar.of(1), "c"));
            IrNode s = new IrNode().append("list", GroupedList.single(List.of(element)));
            IrNode doc = new IrNode().append("s", s);

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\n\n[[s.list]]\nx = 1 # c\n");
        }

        @Test
        @DisplayName("array of tables elements get one header each, group comments above them")
        void arrayOfTables() {
            IrNode first = new IrNode().append("x", Commented.of(Scalar.of(1), "c"));
            IrNode second = new IrNode().append("x", Scalar.of(2));
            IrNode doc = new IrNode()
                    .append("list", GroupedList.of(List.of(GroupedList.group(List.of(first, second), "pair"))));

            assertThat(serializer.serialize(doc))
                    .isEqualTo("# pair\n[[list]]\nx = 1 # c\n\n[[list]]\nx = 2\n");
        }

        @Test
        @DisplayName("a table with comments mixed with scalars in an array is rejected")
        void commentedTableMixedWithScalars() {
            IrNode element = new IrNode().append("x", Commented.of(Scalar.of(1), "c"));
            IrNode s = new IrNode().append("list", GroupedList.single(List.of(element, Scalar.of(2))));
            IrNode doc = new IrNode().append("s", s);

            assertThatThrownBy(() -> serializer.serialize(doc))
                    .isInstanceOf(SerializationException.class)
                    .satisfies(e -> assertThat(((SerializationException) e).keyPath()).isEqualTo("s.list"));
        }

        @Test
        @DisplayName("group comments of a nested array move to the enclosing line")
        void nestedArrayComments() {
            GroupedList inner = GroupedList.of(List.of(
                    GroupedList.group(List.of(Scalar.of(1)), "one"),
                    GroupedList.group(List.of(Scalar.of(2)), "two")));
            IrNode doc = new IrNode().append("a", GroupedList.single(List.of(inner)));

            assertThat(serializer.serialize(doc)).isEqualTo("a = [[1, 2]] # one; two\n");
        }

        @Test
        @DisplayName("a nested array with comments keeps its table out of inline form")
        void nestedArrayCommentsForceBlock() {
            GroupedList inner = GroupedList.of(List.of(
                    GroupedList.group(List.of(Scalar.of(1)), "one"),
                    GroupedList.group(List.of(Scalar.of(2)), "two")));
            IrNode t = new IrNode().append("a", GroupedList.single(List.of(inner)));
            IrNode doc = new IrNode().append("s", new IrNode().append("t", t));

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\n\n[s.t]\na = [[1, 2]] # one; two\n");
        }

        @Test
        @DisplayName("plain tables inside an array render inline")
        void tableInArray() {
            IrNode element = new IrNode().append("x", Scalar.of(1));
            IrNode doc = new IrNode().append("list", GroupedList.single(List.of(element, Scalar.of(true))));

            assertThat(serializer.serialize(doc)).isEqualTo("list = [{x = 1}, true]\n");
        }
    }

    @Nested
    @DisplayName("Table shapes")
    class TableShapes {

        @Test
        @DisplayName("a small nested table renders inline")
        void smallNestedInline() {
            IrNode s = new IrNode().append("t", new IrNode().append("k", Scalar.of(1)));
            IrNode doc = new IrNode().append("s", s);

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\nt = {k = 1}\n");
        }

        @Test
        @DisplayName("a nested table above the size threshold becomes a block")
        void thresholdDecidesShape() {
            IrNode s = new IrNode()
                    .append("t", fiveEntries())
                    .append("u", new IrNode().append("k", Scalar.of(1)));
            IrNode doc = new IrNode().append("s", s);

            assertThat(serializer.serialize(doc))
                    .isEqualTo("[s]\nu = {k = 1}\n\n[s.t]\na = 1\nb = 2\nc = 3\nd = 4\ne = 5\n");

            TomlSerializer roomy = new TomlSerializer(RenderOptions.DEFAULT.withInlineTableMaxEntries(5));
            assertThat(roomy.serialize(doc))
                    .isEqualTo("[s]\nt = {a = 1, b = 2, c = 3, d = 4, e = 5}\nu = {k = 1}\n");
        }

        @Test
        @DisplayName("a comment anywhere below a table forces block form")
        void nestedCommentForcesBlocks() {
            IrNode n = new IrNode().append("b", Commented.of(Scalar.of(2), "c"));
            IrNode doc = new IrNode().append("s", new IrNode().append("t", new IrNode().append("n", n)));

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\n\n[s.t]\n\n[s.t.n]\nb = 2 # c\n");
        }

        @Test
        @DisplayName("fields stored after a block are written before it")
        void hoistsFieldsAboveBlocks() {
            IrNode t = new IrNode().append("x", Commented.of(Scalar.of(1), "c"));
            IrNode s = new IrNode()
                    .append("a", Scalar.of(1))
                    .append("t", t)
                    .addHidden(HiddenMarker.comment("about b"))
                    .append("b", Scalar.of(2));
            IrNode doc = new IrNode().append("s", s);

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\na = 1\n# about b\nb = 2\n\n[s.t]\nx = 1 # c\n");
        }

        @Test
        @DisplayName("root scalars are written before the first section")
        void rootFieldsBeforeSections() {
            IrNode doc = new IrNode()
                    .append("a", Scalar.of(1))
                    .append("s", new IrNode().append("x", Scalar.of(1)))
                    .append("b", Scalar.of(2));

            assertThat(serializer.serialize(doc)).isEqualTo("a = 1\nb = 2\n\n[s]\nx = 1\n");
        }

        @Test
        @DisplayName("top-level tables may render inline when blocks are not forced")
        void topLevelInline() {
            IrNode doc = new IrNode().append("s", new IrNode().append("x", Scalar.of(1)));

            TomlSerializer compact = new TomlSerializer(RenderOptions.DEFAULT.withTopLevelTablesAsBlocks(false));

            assertThat(compact.serialize(doc)).isEqualTo("s = {x = 1}\n");
        }

        @Test
        @DisplayName("a grouped table with several groups becomes a block")
        void multiGroupTable() {
            GroupedTable t = GroupedTable.of(List.of(
                    GroupedTable.group(List.of(KeyValue.of("a", 1), KeyValue.of("b", 2)), "c1"),
                    GroupedTable.group(List.of(KeyValue.of("c", 3)), null)));
            IrNode doc = new IrNode().append("s", new IrNode().append("t", t));

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\n\n[s.t]\na = 1\nb = 2 # c1\nc = 3\n");
        }

        @Test
        @DisplayName("a single commented group stays inline with a trailing comment")
        void singleGroupTable() {
            GroupedTable t = GroupedTable.of(List.of(GroupedTable.group(List.of(KeyValue.of("a", 1)), "note")));
            IrNode doc = new IrNode().append("s", new IrNode().append("t", t));

            assertThat(serializer.serialize(doc)).isEqualTo("[s]\nt = {a = 1} # note\n");
        }
    }

    @Nested
    @DisplayName("Empty tables")
    class EmptyTables {

        @Test
        @DisplayName("a subtree holding only hidden markers is omitted")
        void vacuousSubtree() {
            IrNode e = new IrNode().addHidden(HiddenMarker.comment("nothing here"));
            IrNode doc = new IrNode().append("d", new IrNode().append("e", e));

            assertThat(serializer.serialize(doc)).isEmpty();
        }

        @Test
        @DisplayName("an always-emit table keeps its header")
        void alwaysEmit() {
            IrNode doc = new IrNode().append("e", new IrNode().alwaysEmit(true));

            assertThat(serializer.serialize(doc)).isEqualTo("[e]\n");
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("strings are escaped and keys quoted when needed")
        void escaping() {
            IrNode doc = new IrNode()
                    .append("my key", Scalar.of("say \"hi\"\n"))
                    .append("ratio", Scalar.of(1.0))
                    .append("flag", Scalar.of(false));

            assertThat(serializer.serialize(doc))
                    .isEqualTo("\"my key\" = \"say \\\"hi\\\"\\n\"\nratio = 1.0\nflag = false\n");
        }
    }

    @Nested
    @DisplayName("Plain output")
    class PlainOutput {

        private final TomlSerializer plain = new TomlSerializer(RenderOptions.DEFAULT.withPlain(true));

        @Test
        @DisplayName("comments, blank lines and grouping are dropped")
        void dropsLayout() {
            IrNode s = new IrNode()
                    .addHidden(HiddenMarker.comment("note"))
                    .append("x", GroupedList.of(List.of(
                            GroupedList.group(List.of(Scalar.of(1), Scalar.of(2)), "g1"),
                            GroupedList.group(List.of(Scalar.of(3)), null))))
                    .addHidden(HiddenMarker.blank())
                    .append("t", new IrNode().append("k", Scalar.of("v")));
            IrNode doc = new IrNode()
                    .inlineComment("header")
                    .append("a", Commented.of(Scalar.of(1), "one"))
                    .append("s", s);

            assertThat(plain.serialize(doc)).isEqualTo("a = 1\n\n[s]\nx = [1, 2, 3]\n\n[s.t]\nk = \"v\"\n");
        }

        @Test
        @DisplayName("a table holding only sub-tables gets no header")
        void skipsEmptyParentHeaders() {
            IrNode doc = new IrNode()
                    .append("tool", new IrNode().append("pytest", new IrNode().append("addopts", Scalar.of("-v"))));

            assertThat(plain.serialize(doc)).isEqualTo("[tool.pytest]\naddopts = \"-v\"\n");
        }

        @Test
        @DisplayName("lists of tables become arrays of tables")
        void arrayOfTables() {
            IrNode first = new IrNode().append("x", Commented.of(Scalar.of(1), "c"));
            IrNode second = new IrNode().append("x", Scalar.of(2));
            IrNode doc = new IrNode()
                    .append("s", new IrNode().append("list", GroupedList.single(List.of(first, second))));

            assertThat(plain.serialize(doc)).isEqualTo("[[s.list]]\nx = 1\n\n[[s.list]]\nx = 2\n");
        }

        @Test
        @DisplayName("a comment-only value still has no rendering")
        void commentOnlyValue() {
            IrNode doc = new IrNode().append("s", new IrNode().append("v", Commented.commentOnly("just a note")));

            assertThatThrownBy(() -> plain.serialize(doc))
                    .isInstanceOf(SerializationException.class)
                    .satisfies(e -> assertThat(((SerializationException) e).keyPath()).isEqualTo("s.v"));
        }
    }

    @Test
    @DisplayName("serializing the same tree twice gives the same text")
    void deterministic() {
        IrNode doc = new IrNode()
                .append("a", Scalar.of(1))
                .append("s", new IrNode().append("t", fiveEntries()).append("k", Scalar.of("v")));

        assertThat(serializer.serialize(doc)).isEqualTo(serializer.serialize(doc.copy()));
    }
}
