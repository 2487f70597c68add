package io.ini2toml.core.parser;

import io.ini2toml.core.error.SourceParseException;
import io.ini2toml.core.model.HiddenMarker;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.Scalar;
import io.ini2toml.core.spi.SourceParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Comment-preserving INI parser.
 *
 * <p>
 * Each {@code [section]} becomes an {@link IrNode} under the document root, in source
 * order; a comment after the header becomes the node's inline comment. Options become
 * string {@link Scalar}s holding the raw value: indented continuation lines are joined with
 * {@code \n} (each stripped), and comments inside the value are kept verbatim so later
 * transformations can split them off. Full-line comments become
 * {@link HiddenMarker.Comment} markers with the prefix removed, and every blank line becomes a
 * {@link HiddenMarker.Blank}. Comments and blank lines before the first section belong to the
 * root.
 *
 * <p>
 * Fails fast with {@link SourceParseException} on duplicate sections or options, options
 * outside a section, options without a delimiter, malformed headers and, unless allowed,
 * {@code %(name)s} interpolation references. Stateless and thread-safe.
 */
public final class IniParser implements SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(IniParser.class);
    private static final Pattern HEADER = Pattern.compile("\\[(?<name>[^\\]]*)\\](?<rest>.*)");
    private static final Pattern INTERPOLATION = Pattern.compile("%\\([^)]*\\)s");

    private final ParserOptions options;

    public IniParser() {
        this(ParserOptions.DEFAULT);
    }

    public IniParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public ParserOptions options() {
        return options;
    }

    @Override
    public IrNode parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        State state = new State();
        String[] lines = text.split("\\r?\\n", -1);
        // a terminating newline does not open an extra blank line
        int count = lines.length > 0 && lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;
        for (int i = 0; i < count; i++) {
            state.accept(lines[i], i + 1);
        }
        state.finish();
        LOG.debug("ini.parsed lines={} sections={}", count, state.root.size());
        return state.root;
    }

    /** Strips the first matching comment prefix and surrounding whitespace. */
    String removeCommentPrefix(String line) {
        String stripped = line.strip();
        for (String prefix : options.commentPrefixes()) {
            if (stripped.startsWith(prefix)) {
                return stripped.substring(prefix.length()).strip();
            }
        }
        return stripped;
    }

    private boolean isComment(String stripped) {
        return options.commentPrefixes().stream().anyMatch(stripped::startsWith);
    }

    /** Per-call parse state. */
    private final class State {

        final IrNode root = new IrNode();
        IrNode section;
        String optionKey;
        int optionLine;
        final List<String> optionLines = new ArrayList<>();
        int pendingBlanks;

        void accept(String line, int lineNo) {
            String stripped = line.strip();
            boolean indented = !line.isEmpty() && Character.isWhitespace(line.charAt(0));

            if (stripped.isEmpty()) {
                if (optionKey != null) {
                    pendingBlanks++;
                } else {
                    target().addHidden(HiddenMarker.blank());
                }
                return;
            }
            if (optionKey != null && indented) {
                for (int i = 0; i < pendingBlanks; i++) {
                    optionLines.add("");
                }
                pendingBlanks = 0;
                optionLines.add(stripped);
                return;
            }
            closeOption();

            if (isComment(stripped)) {
                target().addHidden(HiddenMarker.comment(removeCommentPrefix(stripped)));
            } else if (stripped.startsWith("[")) {
                openSection(stripped, lineNo);
            } else {
                openOption(stripped, lineNo);
            }
        }

        void finish() {
            closeOption();
        }

        private IrNode target() {
            return section != null ? section : root;
        }

        private void openSection(String stripped, int lineNo) {
            Matcher m = HEADER.matcher(stripped);
            if (!m.matches() || m.group("name").isBlank()) {
                throw new SourceParseException("Malformed section header: " + stripped, lineNo);
            }
            String name = m.group("name").strip();
            String rest = m.group("rest").strip();
            if (!rest.isEmpty() && !isComment(rest)) {
                throw new SourceParseException("Unexpected text after section header: " + rest, lineNo);
            }
            if (root.containsKey(name)) {
                throw new SourceParseException("Duplicate section '" + name + "'", lineNo);
            }
            section = new IrNode();
            if (!rest.isEmpty()) {
                String comment = removeCommentPrefix(rest);
                if (!comment.isEmpty()) {
                    section.inlineComment(comment);
                }
            }
            root.append(name, section);
        }

        private void openOption(String stripped, int lineNo) {
            if (section == null) {
                throw new SourceParseException("Option outside of a section: " + stripped, lineNo);
            }
            int at = -1;
            String delimiter = null;
            for (String d : options.delimiters()) {
                int idx = stripped.indexOf(d);
                if (idx >= 0 && (at < 0 || idx < at)) {
                    at = idx;
                    delimiter = d;
                }
            }
            if (at < 0) {
                throw new SourceParseException("Option without delimiter: " + stripped, lineNo);
            }
            String key = stripped.substring(0, at).strip();
            if (key.isEmpty()) {
                throw new SourceParseException("Option with an empty name: " + stripped, lineNo);
            }
            if (section.containsKey(key)) {
                throw new SourceParseException("Duplicate option '" + key + "'", lineNo);
            }
            optionKey = key;
            optionLine = lineNo;
            optionLines.clear();
            optionLines.add(stripped.substring(at + delimiter.length()).strip());
        }

        private void closeOption() {
            if (optionKey == null) {
                return;
            }
            String value = String.join("\n", optionLines);
            if (!options.allowInterpolationSyntax() && INTERPOLATION.matcher(value).find()) {
                throw new SourceParseException(
                        "Interpolation syntax is not supported in option '" + optionKey + "'", optionLine);
            }
            section.append(optionKey, Scalar.of(value));
            optionKey = null;
            for (int i = 0; i < pendingBlanks; i++) {
                section.addHidden(HiddenMarker.blank());
            }
            pendingBlanks = 0;
        }
    }
}
