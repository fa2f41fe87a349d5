package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.games.letterfall.domain.enums.GameMode;

import java.util.List;

/**
 * 引擎对外通知。引擎只负责追加，调用方每帧取走一次（drainEvents）。
 * 用法示例：
 *   EngineEvent.wordsCleared(List.of("CAT"), cells);
 *   EngineEvent.quizRequested("HOUSE");
 */
public record EngineEvent(Type type, List<String> words, List<Cell> cells, int level, GameMode mode, GameResult result) {

    public enum Type {
        PIECE_LOCKED,
        WORDS_CLEARED,
        BIG_CLEAR,
        LEVEL_UP,
        QUIZ_REQUESTED,
        QUIZ_CORRECT,
        QUIZ_WRONG,
        MODE_CHANGED,
        GAME_OVER
    }

    public static EngineEvent pieceLocked(List<Cell> cells) {
        return new EngineEvent(Type.PIECE_LOCKED, List.of(), List.copyOf(cells), 0, null, null);
    }

    public static EngineEvent wordsCleared(List<String> words, List<Cell> cells) {
        return new EngineEvent(Type.WORDS_CLEARED, List.copyOf(words), List.copyOf(cells), 0, null, null);
    }

    public static EngineEvent bigClear(List<Cell> cells) {
        return new EngineEvent(Type.BIG_CLEAR, List.of(), List.copyOf(cells), 0, null, null);
    }

    public static EngineEvent levelUp(int level) {
        return new EngineEvent(Type.LEVEL_UP, List.of(), List.of(), level, null, null);
    }

    public static EngineEvent quizRequested(String word) {
        return new EngineEvent(Type.QUIZ_REQUESTED, List.of(word), List.of(), 0, null, null);
    }

    public static EngineEvent quizCorrect() {
        return new EngineEvent(Type.QUIZ_CORRECT, List.of(), List.of(), 0, null, null);
    }

    public static EngineEvent quizWrong() {
        return new EngineEvent(Type.QUIZ_WRONG, List.of(), List.of(), 0, null, null);
    }

    public static EngineEvent modeChanged(GameMode mode) {
        return new EngineEvent(Type.MODE_CHANGED, List.of(), List.of(), 0, mode, null);
    }

    public static EngineEvent gameOver(GameResult result) {
        return new EngineEvent(Type.GAME_OVER, List.of(), List.of(), result.level(), GameMode.GAME_OVER, result);
    }
}
