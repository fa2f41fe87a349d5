package com.lexhub.gameservice.games.letterfall.application;

import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.BannedWords;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.DefinitionProvider;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.domain.model.Quiz;
import com.lexhub.gameservice.games.letterfall.infrastructure.random.JdkRandomSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class QuizServiceTest {

    private static final Map<String, List<String>> DEFS = Map.of(
            "cat", List.of("a damn noisy pet", "a small feline"),
            "dog", List.of("a loyal companion"),
            "house", List.of("a place to live"),
            "tree", List.of("a tall plant"),
            "crap", List.of("rubbish"));

    private final DefinitionProvider definitions = w -> DEFS.getOrDefault(w, List.of());
    private final BannedWords banned = BannedWords.of(List.of("damn", "crap"));

    private QuizService service(Dictionary dict, DefinitionProvider defs) {
        return new QuizService(dict, banned, defs, new JdkRandomSource(new Random(7)));
    }

    @Test
    void correctChoiceIsFirstCleanDefinition() {
        Quiz quiz = service(Dictionary.of(List.of("cat", "dog", "house", "tree", "crap")), definitions).build("cat");

        assertThat(quiz.word()).isEqualTo("CAT");
        assertThat(quiz.correctChoice()).isEqualTo("a small feline");
        assertThat(quiz.choices()).hasSize(4).containsOnlyOnce("a small feline")
                .doesNotContain("rubbish", "a damn noisy pet");
    }

    @Test
    void missingDefinitionsFallBackToPlaceholders() {
        Quiz quiz = service(Dictionary.of(List.of("zzz")), definitions).build("qqq");

        assertThat(quiz.correctChoice()).isEqualTo("No definition");
        assertThat(quiz.choices()).containsExactlyInAnyOrder("No definition", "—", "—", "—");
    }

    @Test
    void failingDefinitionSourceStillProducesAQuiz() {
        DefinitionProvider broken = w -> {
            throw new IllegalStateException("offline");
        };

        Quiz quiz = service(Dictionary.of(List.of("cat", "dog")), broken).build("cat");

        assertThat(quiz.correctChoice()).isEqualTo("No definition");
        assertThat(quiz.choices()).hasSize(4);
    }

    @Test
    void judgesAnswers() {
        QuizService service = service(Dictionary.empty(), definitions);
        Quiz quiz = new Quiz("CAT", List.of("a", "b", "c", "d"), "b");

        assertThat(service.judge(quiz, "b")).isEqualTo(QuizOutcome.CORRECT);
        assertThat(service.judge(quiz, "c")).isEqualTo(QuizOutcome.INCORRECT);
        assertThat(service.judge(quiz, " ")).isEqualTo(QuizOutcome.SKIPPED);
        assertThat(service.judge(quiz, null)).isEqualTo(QuizOutcome.SKIPPED);
    }
}
