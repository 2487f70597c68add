package io.ini2toml.core.engine.toml;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** TOML literal syntax for keys, scalars and comments. */
final class TomlLiterals {

    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_-]+");

    private TomlLiterals() {
        // utility class
    }

    /** A key, bare when possible, quoted otherwise. */
    static String key(String key) {
        return BARE_KEY.matcher(key).matches() ? key : string(key);
    }

    /** A dotted header path such as {@code section."other value"}. */
    static String path(List<String> keys) {
        return keys.stream().map(TomlLiterals::key).collect(Collectors.joining("."));
    }

    /** A basic (double-quoted) string with TOML escapes. */
    static String string(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\t' -> out.append("\\t");
                case '\n' -> out.append("\\n");
                case '\f' -> out.append("\\f");
                case '\r' -> out.append("\\r");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        out.append(String.format("\\u%04X", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    /** The literal for a scalar value; the value type was checked when the scalar was built. */
    static String scalar(Object value) {
        if (value instanceof String s) {
            return string(s);
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof BigInteger big) {
            return big.toString();
        }
        if (value instanceof Double d) {
            return floating(d, Double.toString(d));
        }
        if (value instanceof Float f) {
            return floating(f.doubleValue(), Float.toString(f));
        }
        if (value instanceof BigDecimal dec) {
            return ensureFloat(dec.toString());
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (value instanceof LocalDate ld) {
            return ld.format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (value instanceof LocalTime lt) {
            return lt.format(DateTimeFormatter.ISO_LOCAL_TIME);
        }
        throw new IllegalArgumentException("Not a scalar: " + value.getClass().getName());
    }

    /**
     * A trailing or standalone comment. Line breaks are folded into spaces; other control
     * characters, which TOML forbids in comments, are written as {@code \\uXXXX} text.
     */
    static String comment(String text) {
        String oneLine = text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        if (oneLine.isEmpty()) {
            return "#";
        }
        StringBuilder out = new StringBuilder(oneLine.length() + 2).append("# ");
        for (int i = 0; i < oneLine.length(); i++) {
            char c = oneLine.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7F) {
                out.append(String.format("\\u%04X", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String floating(double value, String text) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return ensureFloat(text);
    }

    private static String ensureFloat(String text) {
        if (text.indexOf('.') >= 0 || text.indexOf('E') >= 0 || text.indexOf('e') >= 0) {
            return text;
        }
        return text + ".0";
    }
}
