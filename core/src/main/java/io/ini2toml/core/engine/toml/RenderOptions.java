package io.ini2toml.core.engine.toml;

/**
 * Rendering thresholds of the {@link TomlSerializer}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param inlineTableMaxEntries  largest flattened entry count a table may have and still be
 *                               rendered inline (default: 4)
 * @param topLevelTablesAsBlocks render the document's own tables (the source sections) as
 *                               {@code [section]} blocks regardless of size (default: true)
 * @param indent                 indentation of the lines of a multi-line array (default:
 *                               four spaces)
 * @param plain                  write the flattened values only, dropping comments and layout
 *                               (default: false)
 */
public record RenderOptions(int inlineTableMaxEntries, boolean topLevelTablesAsBlocks, String indent, boolean plain) {

    /** Default options: 4 entries, top-level blocks, four-space indent, comments kept. */
    public static final RenderOptions DEFAULT = new RenderOptions(4, true, "    ", false);

    public RenderOptions {
        if (inlineTableMaxEntries < 0) {
            throw new IllegalArgumentException(
                    "inlineTableMaxEntries must not be negative, got: " + inlineTableMaxEntries);
        }
        if (indent == null || !indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("indent must consist of spaces and tabs only");
        }
    }

    /** Options that keep comments. */
    public RenderOptions(int inlineTableMaxEntries, boolean topLevelTablesAsBlocks, String indent) {
        this(inlineTableMaxEntries, topLevelTablesAsBlocks, indent, false);
    }

    public RenderOptions withInlineTableMaxEntries(int max) {
        return new RenderOptions(max, topLevelTablesAsBlocks, indent, plain);
    }

    public RenderOptions withTopLevelTablesAsBlocks(boolean blocks) {
        return new RenderOptions(inlineTableMaxEntries, blocks, indent, plain);
    }

    public RenderOptions withIndent(String newIndent) {
        return new RenderOptions(inlineTableMaxEntries, topLevelTablesAsBlocks, newIndent, plain);
    }

    public RenderOptions withPlain(boolean newPlain) {
        return new RenderOptions(inlineTableMaxEntries, topLevelTablesAsBlocks, indent, newPlain);
    }
}
