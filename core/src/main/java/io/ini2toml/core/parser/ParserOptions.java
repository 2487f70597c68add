package io.ini2toml.core.parser;

import java.util.List;
import java.util.Objects;

/**
 * Options of the built-in INI parser.
 *
 * @param commentPrefixes          prefixes that start a full-line comment (default {@code #}, {@code ;})
 * @param delimiters               option/value separators; the first occurrence of any of them
 *                                 on a line splits it (default {@code =}, {@code :})
 * @param allowInterpolationSyntax when false, values containing {@code %(name)s} references are
 *                                 rejected, since TOML has no interpolation
 */
public record ParserOptions(List<String> commentPrefixes, List<String> delimiters, boolean allowInterpolationSyntax) {

    /** {@code #}/{@code ;} comments, {@code =}/{@code :} delimiters, no interpolation. */
    public static final ParserOptions DEFAULT = new ParserOptions(List.of("#", ";"), List.of("=", ":"), false);

    public ParserOptions {
        Objects.requireNonNull(commentPrefixes, "commentPrefixes must not be null");
        Objects.requireNonNull(delimiters, "delimiters must not be null");
        commentPrefixes = List.copyOf(commentPrefixes);
        delimiters = List.copyOf(delimiters);
        if (delimiters.isEmpty()) {
            throw new IllegalArgumentException("at least one delimiter is required");
        }
        if (commentPrefixes.stream().anyMatch(String::isEmpty) || delimiters.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("comment prefixes and delimiters must not be empty strings");
        }
    }

    public ParserOptions withCommentPrefixes(List<String> prefixes) {
        return new ParserOptions(prefixes, delimiters, allowInterpolationSyntax);
    }

    public ParserOptions withDelimiters(List<String> newDelimiters) {
        return new ParserOptions(commentPrefixes, newDelimiters, allowInterpolationSyntax);
    }

    public ParserOptions withAllowInterpolationSyntax(boolean allow) {
        return new ParserOptions(commentPrefixes, delimiters, allow);
    }
}
