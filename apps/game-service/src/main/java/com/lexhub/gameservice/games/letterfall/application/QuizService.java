package com.lexhub.gameservice.games.letterfall.application;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameMessages;
import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.BannedWords;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.DefinitionProvider;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.WordNormalizer;
import com.lexhub.gameservice.games.letterfall.domain.model.Quiz;
import com.lexhub.gameservice.games.letterfall.domain.random.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * QuizService
 * -------------------------------------------------
 * 释义测验的出题与判分。
 * - 正确选项：该词第一条不含屏蔽词的释义，取不到用 "No definition"；
 * - 干扰项：从词典随机抽词（跳过屏蔽词和题目本身）取其释义，最多尝试 12 次，不足 3 个用 "—" 补齐；
 * - 四个选项用 Fisher-Yates 洗牌。
 * 释义来源出错时不影响出题，直接退化为占位选项。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuizService {

    static final int CHOICES = 4;
    static final int DECOY_ATTEMPTS = 12;

    private final Dictionary dictionary;
    private final BannedWords bannedWords;
    private final DefinitionProvider definitions;
    private final RandomSource rng;

    public Quiz build(String word) {
        String normalized = WordNormalizer.normalize(word);
        String correct = safeDefinitions(normalized).stream().findFirst().orElse(GameMessages.NO_DEFINITION);

        List<String> decoys = new ArrayList<>();
        List<String> pool = dictionary.words();
        for (int i = 0; i < DECOY_ATTEMPTS && decoys.size() < CHOICES - 1 && !pool.isEmpty(); i++) {
            String w = rng.choice(pool);
            if (w.equals(normalized) || bannedWords.isBanned(w)) continue;
            List<String> d = safeDefinitions(w);
            if (d.isEmpty()) continue;
            String def = d.get(0);
            if (def.equalsIgnoreCase(correct) || decoys.contains(def)) continue;
            decoys.add(def);
        }
        while (decoys.size() < CHOICES - 1) decoys.add(GameMessages.DECOY_PLACEHOLDER);

        List<String> choices = new ArrayList<>(CHOICES);
        choices.add(correct);
        choices.addAll(decoys);
        for (int i = choices.size() - 1; i > 0; i--) {
            int j = rng.rangeInt(0, i + 1);
            String tmp = choices.get(i);
            choices.set(i, choices.get(j));
            choices.set(j, tmp);
        }
        return new Quiz(word.toUpperCase(Locale.ROOT), choices, correct);
    }

    /** 空选择视为跳过 */
    public QuizOutcome judge(Quiz quiz, String choice) {
        if (choice == null || choice.isBlank()) return QuizOutcome.SKIPPED;
        return choice.equals(quiz.correctChoice()) ? QuizOutcome.CORRECT : QuizOutcome.INCORRECT;
    }

    private List<String> safeDefinitions(String normalizedWord) {
        List<String> raw;
        try {
            raw = definitions.definitionsOf(normalizedWord);
        } catch (RuntimeException e) {
            log.warn("获取释义失败 word={}: {}", normalizedWord, e.getMessage());
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String d : raw) {
            if (d == null || d.isBlank() || bannedWords.containsBanned(d)) continue;
            out.add(d.trim());
        }
        return out;
    }
}
