package com.lexhub.gameservice.games.letterfall.domain.dto;

import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 方块的紧凑存档：最小角绝对坐标 + 相对最小角的偏移 + 字母。
 * 不保存棋盘绝对格子，恢复时按最小角重新推导位置。
 */
@Data
public class PieceSnapshot {
    /** 最小角列号 */
    private int minX;
    /** 最小角行号 */
    private int minY;
    /** 相对 (minX, minY) 的偏移，顺序与字母一致，第一个为旋转轴 */
    private List<Cell> offsets = new ArrayList<>();
    /** 每格的字母 */
    private List<Character> letters = new ArrayList<>();
}
