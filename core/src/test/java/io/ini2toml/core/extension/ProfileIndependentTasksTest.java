package io.ini2toml.core.extension;

import static org.assertj.core.api.Assertions.assertThat;

import io.ini2toml.core.engine.Translator;
import io.ini2toml.core.model.ProfileAugmentation;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProfileIndependentTasks")
class ProfileIndependentTasksTest {

    @Test
    @DisplayName("every table header is preceded by exactly one empty line")
    void normaliseNewlines() {
        String toml = "a = 1\n\n\nb = 2\n[s]\nk = 1\n\n\n[t]\nk = 2";

        assertThat(ProfileIndependentTasks.normaliseNewlines(toml))
                .isEqualTo("a = 1\nb = 2\n\n[s]\nk = 1\n\n[t]\nk = 2\n");
    }

    @Test
    @DisplayName("headers directly followed by a sub-table header are removed")
    void removeEmptyTableHeaders() {
        String toml = "[tool]\n\n[tool.x]\n\n[tool.x.y]\nk = 1\n";

        assertThat(ProfileIndependentTasks.removeEmptyTableHeaders(toml)).isEqualTo("[tool.x.y]\nk = 1");
    }

    @Test
    @DisplayName("headers with content are kept")
    void keepsHeadersWithContent() {
        String toml = "[tool]\nk = 1\n\n[tool.x]\nk = 2";

        assertThat(ProfileIndependentTasks.removeEmptyTableHeaders(toml)).isEqualTo(toml);
    }

    @Test
    @DisplayName("the document ends with a single newline")
    void ensureTerminatingNewline() {
        assertThat(ProfileIndependentTasks.ensureTerminatingNewline("\n\na = 1\n\n\n")).isEqualTo("a = 1\n");
        assertThat(ProfileIndependentTasks.ensureTerminatingNewline("a = 1")).isEqualTo("a = 1\n");
    }

    @Test
    @DisplayName("the tasks are registered as default-on augmentations and can be switched off")
    void registeredAsAugmentations() {
        Translator translator = BuiltinExtensions.translator();

        assertThat(translator.augmentations())
                .extracting(ProfileAugmentation::name)
                .containsExactly(
                        ProfileIndependentTasks.NORMALISE_NEWLINES,
                        ProfileIndependentTasks.REMOVE_EMPTY_TABLE_HEADERS,
                        ProfileIndependentTasks.ENSURE_TERMINATING_NEWLINE);

        String ini = "[a]\nx = 1\n\n\n[b]\ny = 2\n";
        Map<String, Boolean> off = Map.of(
                ProfileIndependentTasks.NORMALISE_NEWLINES, false,
                ProfileIndependentTasks.REMOVE_EMPTY_TABLE_HEADERS, false,
                ProfileIndependentTasks.ENSURE_TERMINATING_NEWLINE, false);
        assertThat(translator.translate(ini, "best_effort")).isEqualTo("[a]\nx = 1\n\n[b]\ny = 2\n");
        assertThat(translator.translate(ini, "best_effort", off)).isEqualTo("[a]\nx = 1\n\n\n[b]\ny = 2\n");
    }
}
