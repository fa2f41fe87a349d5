package com.lexhub.gameservice.games.letterfall.domain.lexicon;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BannedWordsTest {

    private final BannedWords banned = BannedWords.of(List.of("Damn", "crap"));

    @Test
    void matchesWholeNormalizedTokens() {
        assertThat(banned.isBanned("damn")).isTrue();
        assertThat(banned.containsBanned("Well, D@MN it")).isTrue();
        assertThat(banned.containsBanned("a c-r-a-p idea")).isFalse();
        assertThat(banned.containsBanned("scrapbook")).isFalse();
    }

    @Test
    void noneBansNothing() {
        assertThat(BannedWords.none().containsBanned("damn")).isFalse();
        assertThat(banned.containsBanned(null)).isFalse();
    }
}
