package com.lexhub.gameservice.games.letterfall.domain.model;

import java.util.Arrays;

/**
 * 字母棋盘：固定 cols x rows 的网格，每格要么是一个字母，要么为空。
 * 约定：EMPTY='.'，字母统一为大写 'A'..'Z'。
 * 尺寸在构造后不可改变。
 */
public class Grid {
    /** 空位标记：'.' 表示该格没有字母，与任何合法字母都不同。 */
    public static final char EMPTY = '.';

    private final int cols;
    private final int rows;

    /** 按行存储：cells[y][x] */
    private final char[][] cells;

    public Grid(int cols, int rows) {
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("grid size must be positive: " + cols + "x" + rows);
        }
        this.cols = cols;
        this.rows = rows;
        this.cells = new char[rows][cols];
        for (char[] row : cells) Arrays.fill(row, EMPTY);
    }

    public int cols() { return cols; }

    public int rows() { return rows; }

    /** 是否为合法字母（'A'..'Z'） */
    public static boolean isLetter(char c) {
        return c >= 'A' && c <= 'Z';
    }

    /** 是否在棋盘内 */
    public boolean inBounds(int x, int y) {
        return x >= 0 && x < cols && y >= 0 && y < rows;
    }

    /** 读取 (x,y) 的内容，越界由调用方保证 */
    public char get(int x, int y) { return cells[y][x]; }

    /** 该格是否在棋盘内且为空 */
    public boolean isEmpty(int x, int y) {
        return inBounds(x, y) && cells[y][x] == EMPTY;
    }

    /** 该格是否在棋盘内且已有字母 */
    public boolean isOccupied(int x, int y) {
        return inBounds(x, y) && cells[y][x] != EMPTY;
    }

    /** 写入字母（不做合法性校验，由上层规则判定） */
    public void place(int x, int y, char letter) { cells[y][x] = letter; }

    public void clear(int x, int y) { cells[y][x] = EMPTY; }

    /**
     * 按列独立下落：剩余字母保持相对顺序压到列底，上方留空。
     */
    public void collapse() {
        for (int x = 0; x < cols; x++) {
            int write = rows - 1;
            for (int y = rows - 1; y >= 0; y--) {
                char c = cells[y][x];
                if (c != EMPTY) {
                    cells[y][x] = EMPTY;
                    cells[write][x] = c;
                    write--;
                }
            }
        }
    }

    /**
     * 整盘上移一行：最上面一行被丢弃，最下面一行置空。
     */
    public void shiftUp() {
        for (int y = 1; y < rows; y++) {
            System.arraycopy(cells[y], 0, cells[y - 1], 0, cols);
        }
        Arrays.fill(cells[rows - 1], EMPTY);
    }

    /** 第 y 行的紧凑字符串（长度为 cols） */
    public String row(int y) {
        return new String(cells[y]);
    }

    /** 深拷贝 */
    public Grid copy() {
        Grid g = new Grid(cols, rows);
        for (int y = 0; y < rows; y++) g.cells[y] = cells[y].clone();
        return g;
    }
}
