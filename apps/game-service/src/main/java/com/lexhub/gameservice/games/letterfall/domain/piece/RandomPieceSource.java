package com.lexhub.gameservice.games.letterfall.domain.piece;

import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import com.lexhub.gameservice.games.letterfall.domain.model.Piece;
import com.lexhub.gameservice.games.letterfall.domain.random.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * 随机方块生成：
 * - 形状等概率；
 * - 字母按权重抽取，元音权重更高；
 * - 每个方块至少包含一个辅音，全是元音时随机替换一格。
 */
public class RandomPieceSource implements PieceSource {

    private static final String VOWELS = "AEIOU";

    static final List<Character> LETTERS = List.of(
            'A', 'E', 'I', 'O', 'U',
            'B', 'C', 'D', 'F', 'G', 'H', 'J', 'K', 'L', 'M',
            'N', 'P', 'Q', 'R', 'S', 'T', 'V', 'W', 'X', 'Y', 'Z');

    static final List<Integer> WEIGHTS = List.of(
            8, 8, 8, 8, 8,
            2, 2, 3, 1, 2, 2, 1, 1, 3, 2,
            4, 2, 1, 4, 4, 4, 1, 2, 1, 2, 1);

    static final List<Character> CONSONANTS = LETTERS.stream().filter(c -> !isVowel(c)).toList();

    private final RandomSource rng;

    public RandomPieceSource(RandomSource rng) {
        this.rng = rng;
    }

    @Override
    public Piece nextPiece() {
        List<Cell> shape = rng.choice(ShapeCatalog.ALL);
        List<Character> letters = new ArrayList<>(shape.size());
        boolean consonantIncluded = false;
        for (int i = 0; i < shape.size(); i++) {
            char c = nextLetter();
            if (!isVowel(c)) consonantIncluded = true;
            letters.add(c);
        }
        if (!consonantIncluded) {
            letters.set(rng.rangeInt(0, letters.size()), rng.choice(CONSONANTS));
        }
        return new Piece(shape, letters);
    }

    @Override
    public char nextLetter() {
        return rng.weightedChoice(LETTERS, WEIGHTS);
    }

    static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }
}
