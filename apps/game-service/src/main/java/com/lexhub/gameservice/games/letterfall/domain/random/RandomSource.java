package com.lexhub.gameservice.games.letterfall.domain.random;

import java.util.List;

/**
 * 随机数来源：形状选择、字母生成、测验干扰项与洗牌。
 * 引擎只依赖这个接口，测试中可替换为固定序列。
 */
public interface RandomSource {

    /** 按权重选择；items 与 weights 长度必须一致 */
    <T> T weightedChoice(List<T> items, List<Integer> weights);

    /** 等概率选择 */
    <T> T choice(List<T> items);

    /** [minInclusive, maxExclusive) 内的整数 */
    int rangeInt(int minInclusive, int maxExclusive);
}
