package com.lexhub.gameservice.games.letterfall.domain.model;

/**
 * 棋盘上的一个格子坐标：x 为列，y 为行（第 0 行在最上方）。
 * 不可变 record，平移时返回新对象。
 */
public record Cell(int x, int y) {

    /** 平移 (dx, dy) 后的新坐标 */
    public Cell translate(int dx, int dy) {
        return new Cell(x + dx, y + dy);
    }
}
