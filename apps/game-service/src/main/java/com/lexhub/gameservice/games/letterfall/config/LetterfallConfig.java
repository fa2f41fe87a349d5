package com.lexhub.gameservice.games.letterfall.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexhub.gameservice.games.letterfall.domain.engine.EngineSettings;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.BannedWords;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.DefinitionProvider;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.domain.random.RandomSource;
import com.lexhub.gameservice.games.letterfall.domain.session.SessionCodec;
import com.lexhub.gameservice.games.letterfall.infrastructure.lexicon.ClasspathDefinitionProvider;
import com.lexhub.gameservice.games.letterfall.infrastructure.lexicon.ClasspathWordList;
import com.lexhub.gameservice.games.letterfall.infrastructure.random.JdkRandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Letterfall 相关 Bean 装配：引擎参数、时钟、随机源、词典/屏蔽词/释义、存档编解码。
 * 参数全部来自 application.yml 的 letterfall.*，缺省值与内置常量一致。
 */
@Slf4j
@Configuration
public class LetterfallConfig {

    @Bean
    public EngineSettings engineSettings(@Value("${letterfall.board.cols:10}") int cols,
                                         @Value("${letterfall.board.rows:33}") int rows,
                                         @Value("${letterfall.combo.decay-ms:9000}") int comboDecayMs,
                                         @Value("${letterfall.combo.growth:0.5}") double comboGrowth,
                                         @Value("${letterfall.combo.start:1.0}") double comboStart,
                                         @Value("${letterfall.combo.max:4.0}") double comboMax,
                                         @Value("${letterfall.quiz.bonus:50}") int quizBonus,
                                         @Value("${letterfall.soft-drop-factor:5}") int softDropFactor) {
        EngineSettings s = new EngineSettings(cols, rows, comboDecayMs, comboGrowth, comboStart, comboMax,
                quizBonus, softDropFactor);
        log.info("引擎参数: {}", s);
        return s;
    }

    @Bean
    public Clock letterfallClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource randomSource() {
        return new JdkRandomSource();
    }

    @Bean
    public Dictionary dictionary(@Value("${letterfall.lexicon.words:classpath:lexicon/words.txt}") String location) {
        return Dictionary.of(ClasspathWordList.readLines(location));
    }

    @Bean
    public BannedWords bannedWords(@Value("${letterfall.lexicon.banned:classpath:lexicon/banned_words.txt}") String location) {
        return BannedWords.of(ClasspathWordList.readLines(location));
    }

    @Bean
    public DefinitionProvider definitionProvider(
            @Value("${letterfall.lexicon.definitions:classpath:lexicon/definitions.tsv}") String location) {
        return new ClasspathDefinitionProvider(location);
    }

    @Bean
    public SessionCodec sessionCodec(ObjectMapper objectMapper) {
        return new SessionCodec(objectMapper);
    }
}
