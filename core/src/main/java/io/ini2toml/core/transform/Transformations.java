package io.ini2toml.core.transform;

import io.ini2toml.core.error.StructuralException;
import io.ini2toml.core.model.Commented;
import io.ini2toml.core.model.GroupedList;
import io.ini2toml.core.model.GroupedTable;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.KeyValue;
import io.ini2toml.core.model.Scalar;
import io.ini2toml.core.model.StructuralValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reusable value conversions for intermediate processors: strings taken verbatim from the
 * INI source are split into comments, grouped lists and grouped tables, and coerced to
 * typed scalars.
 *
 * <p>
 * Comment prefixes are given as a string of single characters, {@code "#;"} by default.
 * Inline comments are only recognised in single-line values; in multi-line values each line
 * is examined on its own by {@link #splitList} and {@link #splitKvPairs}.
 */
public final class Transformations {

    private static final Logger LOG = LoggerFactory.getLogger(Transformations.class);

    /** Default comment prefix characters. */
    public static final String COMMENT_PREFIXES = "#;";

    private static final Pattern INTEGER = Pattern.compile("[+-]?(0|[1-9][0-9]*)");
    private static final Pattern FLOAT =
            Pattern.compile("[+-]?(0|[1-9][0-9]*)(\\.[0-9]+([eE][+-]?[0-9]+)?|[eE][+-]?[0-9]+)");

    private Transformations() {
        // utility class
    }

    /** Strips whitespace and any leading run of {@code prefixes} characters. */
    public static String removePrefixes(String text, String prefixes) {
        String stripped = text.strip();
        int i = 0;
        while (i < stripped.length() && prefixes.indexOf(stripped.charAt(i)) >= 0) {
            i++;
        }
        return stripped.substring(i).strip();
    }

    /** {@link #splitComment(String, Function, String)} keeping the value as a string. */
    public static Commented<String> splitComment(String value) {
        return splitComment(value, Function.identity(), COMMENT_PREFIXES);
    }

    /**
     * Separates a trailing comment from a single-line value. The first prefix character (in
     * {@code prefixes} order) found in the value starts the comment. A value that starts with
     * a prefix is comment-only. Multi-line values are coerced whole, without comment.
     */
    public static <T> Commented<T> splitComment(String value, Function<String, ? extends T> coerce, String prefixes) {
        String stripped = value.strip();
        if (stripped.lines().count() > 1) {
            return Commented.of(coerce.apply(stripped));
        }
        int prefix = -1;
        for (int i = 0; i < prefixes.length() && prefix < 0; i++) {
            prefix = stripped.indexOf(prefixes.charAt(i));
        }
        if (prefix < 0) {
            return Commented.of(coerce.apply(stripped));
        }
        if (prefix == 0 || prefixes.indexOf(stripped.charAt(0)) >= 0) {
            return Commented.commentOnly(removePrefixes(stripped, prefixes));
        }
        String comment = removePrefixes(stripped.substring(prefix + 1), prefixes);
        T coerced = coerce.apply(stripped.substring(0, prefix).strip());
        return Commented.of(coerced, comment.isEmpty() ? null : comment);
    }

    /** Comma-separated list of strings. */
    public static GroupedList splitList(String value) {
        return splitList(value, ",", Scalar::of, COMMENT_PREFIXES);
    }

    /**
     * Splits a (possibly dangling) list: one group per line, each line split again by
     * {@code sep}, empty items dropped, and {@code coerce} applied to every item. A comment
     * on a line becomes the comment of its group; a line holding only a comment becomes a
     * comment-only group.
     */
    public static GroupedList splitList(
            String value, String sep, Function<String, ? extends StructuralValue> coerce, String prefixes) {
        String effectivePrefixes = withoutChars(prefixes, sep);
        Pattern separator = Pattern.compile(Pattern.quote(sep));
        List<Commented<List<StructuralValue>>> groups = new ArrayList<>();
        for (String line : value.strip().lines().toList()) {
            groups.add(splitComment(line, l -> items(l, separator, coerce), effectivePrefixes));
        }
        return GroupedList.of(groups);
    }

    /** {@code key=value} pairs separated by commas or lines, values kept as strings. */
    public static GroupedTable splitKvPairs(String value) {
        return splitKvPairs(value, "=", Scalar::of, ",", COMMENT_PREFIXES);
    }

    /**
     * Splits a (possibly dangling) list of key/value pairs: one group per line, each line
     * split by {@code pairSep}, items without {@code keySep} dropped, keys stripped and
     * {@code coerce} applied to the values.
     *
     * @throws StructuralException if a key appears twice
     */
    public static GroupedTable splitKvPairs(
            String value,
            String keySep,
            Function<String, ? extends StructuralValue> coerce,
            String pairSep,
            String prefixes) {
        String effectivePrefixes = withoutChars(withoutChars(prefixes, keySep), pairSep);
        Pattern separator = Pattern.compile(Pattern.quote(pairSep));
        List<Commented<List<KeyValue>>> groups = new ArrayList<>();
        for (String line : value.strip().lines().toList()) {
            groups.add(splitComment(line, l -> pairs(l, separator, keySep, coerce), effectivePrefixes));
        }
        return GroupedTable.of(groups);
    }

    /**
     * Coerces a single-line value to a scalar, keeping its trailing comment. A comment-only
     * value becomes an empty string carrying the comment.
     */
    public static StructuralValue splitScalar(String value) {
        Commented<Scalar> commented = splitComment(value, Transformations::coerceScalar, COMMENT_PREFIXES);
        if (commented.isCommentOnly()) {
            return Commented.of(Scalar.of(""), commented.comment());
        }
        return commented.hasComment() ? commented : commented.value();
    }

    /**
     * @throws IllegalArgumentException if the value is not one of {@code true/1/yes/on} or
     *                                  {@code false/0/no/off/none/null/nil} (case-insensitive)
     */
    public static boolean coerceBool(String value) {
        String normalised = value.strip().toLowerCase(Locale.ROOT);
        return switch (normalised) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off", "none", "null", "nil" -> false;
            default -> throw new IllegalArgumentException("'" + value + "' cannot be converted to boolean");
        };
    }

    /**
     * Guesses the scalar type of a string: decimal integers and floats become numbers,
     * {@code true/yes/on} and {@code false/no/off} (any case) become booleans, anything else
     * stays a string.
     */
    public static Scalar coerceScalar(String value) {
        String stripped = value.strip();
        if (INTEGER.matcher(stripped).matches()) {
            try {
                return Scalar.of(Long.parseLong(stripped));
            } catch (NumberFormatException e) {
                LOG.debug("Integer out of range, keeping string: {}", stripped);
                return Scalar.of(stripped);
            }
        }
        if (FLOAT.matcher(stripped).matches()) {
            return Scalar.of(Double.parseDouble(stripped));
        }
        return switch (stripped.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> Scalar.of(true);
            case "false", "no", "off" -> Scalar.of(false);
            default -> Scalar.of(stripped);
        };
    }

    /**
     * Replaces the string value stored under {@code key} with {@code fn} applied to it.
     * Values that are not strings are left alone. When {@code fn} rejects the value, a
     * warning is logged and the original value is kept.
     *
     * @throws io.ini2toml.core.error.KeyNotFoundException if {@code key} is absent
     */
    public static IrNode applyTo(IrNode node, String key, Function<String, ? extends StructuralValue> fn) {
        StructuralValue current = node.get(key);
        if (!(current instanceof Scalar scalar) || !scalar.isString()) {
            return node;
        }
        StructuralValue converted;
        try {
            converted = fn.apply(scalar.asString());
        } catch (IllegalArgumentException | StructuralException e) {
            LOG.warn("transform.skipped key={} value={} reason={}", key, scalar.asString(), e.getMessage());
            return node;
        }
        node.set(key, converted);
        return node;
    }

    private static List<StructuralValue> items(
            String line, Pattern separator, Function<String, ? extends StructuralValue> coerce) {
        List<StructuralValue> values = new ArrayList<>();
        for (String item : separator.split(line, -1)) {
            if (!item.isEmpty()) {
                values.add(coerce.apply(item.strip()));
            }
        }
        return values;
    }

    private static List<KeyValue> pairs(
            String line, Pattern separator, String keySep, Function<String, ? extends StructuralValue> coerce) {
        List<KeyValue> pairs = new ArrayList<>();
        for (String item : separator.split(line.strip(), -1)) {
            int at = item.indexOf(keySep);
            if (at >= 0) {
                pairs.add(new KeyValue(
                        item.substring(0, at).strip(),
                        coerce.apply(item.substring(at + keySep.length()).strip())));
            }
        }
        return pairs;
    }

    private static String withoutChars(String prefixes, String chars) {
        StringBuilder sb = new StringBuilder(prefixes.length());
        for (char c : prefixes.toCharArray()) {
            if (chars.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
