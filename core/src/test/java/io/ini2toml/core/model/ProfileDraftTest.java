package io.ini2toml.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.ini2toml.core.spi.TextProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProfileDraft")
class ProfileDraftTest {

    private static final TextProcessor IDENTITY = text -> text;

    @Test
    @DisplayName("unnamed functions keep distinct names when others are prepended")
    void unnamedFunctionsStayDistinct() {
        ProfileDraft draft = new ProfileDraft("p")
                .appendPre(IDENTITY)
                .prependPre("first", IDENTITY)
                .appendPre(IDENTITY)
                .prependPre("zeroth", IDENTITY)
                .appendPre(IDENTITY);

        assertThat(draft.functionNames(ChainStage.PRE)).containsExactly("zeroth", "first", "pre#0", "pre#1", "pre#2");
    }

    @Test
    @DisplayName("a copy continues numbering after the profile's functions")
    void copyContinuesNumbering() {
        Profile profile = new ProfileDraft("p")
                .appendPost(IDENTITY)
                .appendPost("named", IDENTITY)
                .toProfile();

        ProfileDraft copy = ProfileDraft.from(profile).prependPost("head", IDENTITY).appendPost(IDENTITY);

        assertThat(copy.functionNames(ChainStage.POST)).containsExactly("head", "post#0", "named", "post#2");
        assertThat(copy.functionNames(ChainStage.PRE)).isEmpty();
    }
}
