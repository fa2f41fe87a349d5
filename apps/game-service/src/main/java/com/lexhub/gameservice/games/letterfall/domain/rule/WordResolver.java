package com.lexhub.gameservice.games.letterfall.domain.rule;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameConstants;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.Dictionary;
import com.lexhub.gameservice.games.letterfall.domain.lexicon.WordNormalizer;
import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import com.lexhub.gameservice.games.letterfall.domain.model.Grid;
import com.lexhub.gameservice.games.letterfall.domain.model.ResolutionPass;
import com.lexhub.gameservice.games.letterfall.domain.model.RunState;
import com.lexhub.gameservice.games.letterfall.domain.model.WordMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 核心规则判断：单词扫描、取舍、计分、下落与升级。
 * 每次方块锁定后由引擎反复调用 resolvePass，直到某一轮没有任何单词。
 */
public class WordResolver {

    private final Dictionary dictionary;

    public WordResolver(Dictionary dictionary) {
        this.dictionary = dictionary == null ? Dictionary.empty() : dictionary;
    }

    /**
     * 扫描全部候选单词，保持发现顺序：
     * 先横向（行递增、起始列递增、长度递增），再竖向（列递增、起始行递增、长度递增）。
     *
     * @param g          棋盘
     * @param level      当前等级（决定最短长度与不重复规则）
     * @param foundWords 本局已消除的规范化单词
     */
    public List<WordMatch> scan(Grid g, int level, Set<String> foundWords) {
        int minLen = GameConstants.minWordLength(level);
        boolean noRepeats = GameConstants.noRepeats(level);
        List<WordMatch> out = new ArrayList<>();

        // 横向
        for (int y = 0; y < g.rows(); y++) {
            for (int sx = 0; sx < g.cols(); sx++) {
                int run = runLength(g, sx, y, 1, 0);
                for (int len = minLen; len <= run; len++) {
                    List<Cell> cells = new ArrayList<>(len);
                    for (int i = 0; i < len; i++) cells.add(new Cell(sx + i, y));
                    addIfQualified(g, cells, false, noRepeats, foundWords, out);
                }
            }
        }
        // 竖向
        for (int x = 0; x < g.cols(); x++) {
            for (int sy = 0; sy < g.rows(); sy++) {
                int run = runLength(g, x, sy, 0, 1);
                for (int len = minLen; len <= run; len++) {
                    List<Cell> cells = new ArrayList<>(len);
                    for (int i = 0; i < len; i++) cells.add(new Cell(x, sy + i));
                    addIfQualified(g, cells, true, noRepeats, foundWords, out);
                }
            }
        }
        return out;
    }

    /**
     * 取舍：按长度降序稳定排序，依次接受与已接受单词不共享格子的候选。
     * 开启不重复规则时，同一轮内同一个词也只接受一次。
     */
    public static List<WordMatch> select(List<WordMatch> candidates, boolean noRepeats, Set<String> foundWords) {
        List<WordMatch> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(WordMatch::length).reversed());

        Set<Cell> claimed = new HashSet<>();
        Set<String> acceptedWords = new HashSet<>();
        List<WordMatch> accepted = new ArrayList<>();
        for (WordMatch m : sorted) {
            if (m.cells().stream().anyMatch(claimed::contains)) continue;
            if (noRepeats && (foundWords.contains(m.normalized()) || acceptedWords.contains(m.normalized()))) continue;
            claimed.addAll(m.cells());
            acceptedWords.add(m.normalized());
            accepted.add(m);
        }
        return accepted;
    }

    /**
     * 执行一轮：扫描 → 取舍 → 计分并清除 → 按列下落 → 升级判定。
     *
     * @param s                   对局状态（会被修改）
     * @param effectiveMultiplier 当前有效倍率（基础倍率 × 连击倍率）
     * @return 本轮结果；没有单词时返回 {@link ResolutionPass#none()} 且不修改状态
     */
    public ResolutionPass resolvePass(RunState s, double effectiveMultiplier) {
        Grid g = s.getGrid();
        int level = s.getLevel();
        List<WordMatch> accepted = select(scan(g, level, s.getFoundWords()), GameConstants.noRepeats(level), s.getFoundWords());
        if (accepted.isEmpty()) return ResolutionPass.none();

        int gained = 0;
        List<Cell> cleared = new ArrayList<>();
        List<String> quizWords = new ArrayList<>();
        for (WordMatch m : accepted) {
            int points = (int) Math.floor(m.length() * 10 * level * effectiveMultiplier);
            gained += points;
            s.setScore(s.getScore() + points);
            s.getRemovedWords().add(m.word());
            s.getFoundWords().add(m.normalized());
            s.setWordsFoundSinceLevelUp(s.getWordsFoundSinceLevelUp() + 1);

            // 按累计移除数触发测验，不随升级清零
            if (s.getRemovedWords().size() % GameConstants.QUIZ_EVERY_WORDS == 0) {
                quizWords.add(m.word());
            }
            for (Cell c : m.cells()) {
                g.clear(c.x(), c.y());
                cleared.add(c);
            }
        }

        g.collapse();

        boolean leveledUp = false;
        if (s.getWordsFoundSinceLevelUp() >= GameConstants.WORDS_PER_LEVEL) {
            s.setLevel(s.getLevel() + 1);
            s.setWordsFoundSinceLevelUp(0);
            s.setGravityIntervalMs(Math.max(GameConstants.MIN_GRAVITY_MS,
                    (int) (s.getGravityIntervalMs() * GameConstants.GRAVITY_DECAY)));
            leveledUp = true;
        }
        return new ResolutionPass(List.copyOf(accepted), List.copyOf(cleared), gained, leveledUp, List.copyOf(quizWords));
    }

    // ----------- private helpers -----------

    private void addIfQualified(Grid g, List<Cell> cells, boolean vertical, boolean noRepeats,
                                Set<String> foundWords, List<WordMatch> out) {
        StringBuilder sb = new StringBuilder(cells.size());
        for (Cell c : cells) sb.append(g.get(c.x(), c.y()));
        String word = sb.toString();
        String normalized = WordNormalizer.normalize(word);
        if (!dictionary.contains(normalized)) return;
        if (noRepeats && foundWords.contains(normalized)) return;
        out.add(new WordMatch(word, normalized, vertical, List.copyOf(cells)));
    }

    /** 从 (x,y) 起沿 (dx,dy) 连续非空格子的个数（含起点） */
    private static int runLength(Grid g, int x, int y, int dx, int dy) {
        int c = 0;
        while (g.isOccupied(x, y)) {
            c++; x += dx; y += dy;
        }
        return c;
    }
}
