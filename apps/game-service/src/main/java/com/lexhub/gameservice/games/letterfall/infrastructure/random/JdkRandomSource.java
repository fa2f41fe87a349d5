package com.lexhub.gameservice.games.letterfall.infrastructure.random;

import com.lexhub.gameservice.games.letterfall.domain.random.RandomSource;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 基于 JDK 随机数的实现。传入固定种子的 Random 可复现出块序列。
 */
public class JdkRandomSource implements RandomSource {

    private final Random random;

    public JdkRandomSource() {
        this(null);
    }

    public JdkRandomSource(Random random) {
        this.random = random;
    }

    @Override
    public <T> T weightedChoice(List<T> items, List<Integer> weights) {
        if (items.isEmpty() || items.size() != weights.size()) {
            throw new IllegalArgumentException("items/weights mismatch");
        }
        int total = 0;
        for (int w : weights) total += Math.max(0, w);
        if (total <= 0) return choice(items);
        int r = rangeInt(0, total);
        for (int i = 0; i < items.size(); i++) {
            r -= Math.max(0, weights.get(i));
            if (r < 0) return items.get(i);
        }
        return items.get(items.size() - 1);
    }

    @Override
    public <T> T choice(List<T> items) {
        if (items.isEmpty()) throw new IllegalArgumentException("no items to choose from");
        return items.get(rangeInt(0, items.size()));
    }

    @Override
    public int rangeInt(int minInclusive, int maxExclusive) {
        if (maxExclusive <= minInclusive) return minInclusive;
        Random r = random != null ? random : ThreadLocalRandom.current();
        return minInclusive + r.nextInt(maxExclusive - minInclusive);
    }
}
