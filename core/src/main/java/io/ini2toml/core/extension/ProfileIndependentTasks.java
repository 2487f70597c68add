package io.ini2toml.core.extension;

import io.ini2toml.core.engine.TranslatorBuilder;
import io.ini2toml.core.spi.Extension;
import io.ini2toml.core.spi.TextProcessor;
import java.util.regex.Pattern;

/**
 * Output clean-ups that apply whatever profile is selected. Each task is registered as an
 * augmentation, active by default, that appends one post-processor to the profile copy.
 */
public final class ProfileIndependentTasks implements Extension {

    public static final String NORMALISE_NEWLINES = "normalise-newlines";
    public static final String REMOVE_EMPTY_TABLE_HEADERS = "remove-empty-table-headers";
    public static final String ENSURE_TERMINATING_NEWLINE = "ensure-terminating-newline";

    private static final Pattern DUPLICATED_NEWLINES = Pattern.compile("\n+");
    private static final Pattern TABLE_START = Pattern.compile("^\\[(.*)\\]", Pattern.MULTILINE);
    private static final Pattern EMPTY_TABLES =
            Pattern.compile("^\\[(.*)\\]\n+\\[(\\1\\.(?:.*))\\]", Pattern.MULTILINE);

    @Override
    public void activate(TranslatorBuilder translator) {
        register(
                translator,
                NORMALISE_NEWLINES,
                ProfileIndependentTasks::normaliseNewlines,
                "Precede every table with an empty line and drop empty lines elsewhere");
        register(
                translator,
                REMOVE_EMPTY_TABLE_HEADERS,
                ProfileIndependentTasks::removeEmptyTableHeaders,
                "Remove table headers immediately followed by a header of a sub-table");
        register(
                translator,
                ENSURE_TERMINATING_NEWLINE,
                ProfileIndependentTasks::ensureTerminatingNewline,
                "End the document with exactly one newline");
    }

    private static void register(TranslatorBuilder translator, String name, TextProcessor task, String help) {
        translator.augmentProfiles(profile -> profile.appendPost(name, task), true, name, help);
    }

    /** Collapses runs of newlines, then puts an empty line before every table header. */
    public static String normaliseNewlines(String text) {
        String collapsed = DUPLICATED_NEWLINES.matcher(text).replaceAll("\n");
        String spaced = TABLE_START.matcher(collapsed).replaceAll("\n[$1]");
        return spaced.endsWith("\n") ? spaced : spaced + "\n";
    }

    /** Drops {@code [a]} when the next header is {@code [a.b]}, until nothing changes. */
    public static String removeEmptyTableHeaders(String text) {
        String previous = null;
        String current = text;
        while (!current.equals(previous)) {
            previous = current;
            current = EMPTY_TABLES.matcher(current).replaceAll("[$2]").strip();
        }
        return current;
    }

    public static String ensureTerminatingNewline(String text) {
        return text.strip() + "\n";
    }
}
