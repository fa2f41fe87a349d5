package com.lexhub.gameservice.games.letterfall.domain.model;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameMessages;
import com.lexhub.gameservice.games.letterfall.domain.rule.PieceJudge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 字母方块：一组格子偏移（第一个偏移为旋转轴）+ 每格一个字母 + 当前绝对位置。
 * 约束：shape.size == letters.size == cells.size。
 * 每次移动都会替换 cells 列表，旧列表不被修改。
 */
public class Piece {

    /** 局部形状偏移 */
    private final List<Cell> shape;
    /** 与 shape 一一对应的字母 */
    private final List<Character> letters;
    /** 当前绝对格子 */
    private List<Cell> cells;

    public Piece(List<Cell> shape, List<Character> letters) {
        if (shape == null || letters == null || shape.isEmpty()) {
            throw new IllegalArgumentException("piece needs at least one cell");
        }
        if (shape.size() != letters.size()) {
            throw new IllegalArgumentException("shape/letters size mismatch: " + shape.size() + " vs " + letters.size());
        }
        this.shape = List.copyOf(shape);
        this.letters = List.copyOf(letters);
        this.cells = new ArrayList<>(shape);
    }

    public List<Cell> shape() { return shape; }

    public List<Character> letters() { return letters; }

    public List<Cell> cells() { return Collections.unmodifiableList(cells); }

    public int size() { return shape.size(); }

    /** 回到出生点：(cols/2, 0) + 偏移 */
    public void resetToSpawn(Grid g) {
        int spawnX = g.cols() / 2;
        this.cells = PieceJudge.translate(shape, spawnX, 0);
    }

    public boolean canMove(Grid g, int dx, int dy) {
        return PieceJudge.isLegal(g, PieceJudge.translate(cells, dx, dy));
    }

    /** 合法才移动；返回是否移动成功 */
    public boolean move(Grid g, int dx, int dy) {
        List<Cell> candidate = PieceJudge.translate(cells, dx, dy);
        if (!PieceJudge.isLegal(g, candidate)) return false;
        cells = candidate;
        return true;
    }

    /**
     * 绕轴旋转并按固定顺序尝试踢墙；全部失败则不变并返回 false。
     */
    public boolean tryRotate(Grid g) {
        List<Cell> rotated = PieceJudge.rotateAboutPivot(cells);
        for (int[] k : PieceJudge.KICKS) {
            List<Cell> candidate = PieceJudge.translate(rotated, k[0], k[1]);
            if (PieceJudge.isLegal(g, candidate)) {
                cells = candidate;
                return true;
            }
        }
        return false;
    }

    /** 一直下落到不能再落，返回下落的格数（0 表示已着地） */
    public int hardDrop(Grid g) {
        int dropped = 0;
        while (move(g, 0, 1)) dropped++;
        return dropped;
    }

    /**
     * 把每个字母写进棋盘。
     * 当前位置不合法属于编程错误，抛出 IllegalStateException 且不修改棋盘。
     */
    public void lockTo(Grid g) {
        if (!PieceJudge.isLegal(g, cells)) {
            throw new IllegalStateException(GameMessages.ILLEGAL_LOCK);
        }
        for (int i = 0; i < cells.size(); i++) {
            Cell c = cells.get(i);
            g.place(c.x(), c.y(), letters.get(i));
        }
    }

    /** 当前绝对位置的最小角（minX, minY） */
    public Cell minCorner() {
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        for (Cell c : cells) {
            minX = Math.min(minX, c.x());
            minY = Math.min(minY, c.y());
        }
        return new Cell(minX, minY);
    }

    public Piece copy() {
        Piece p = new Piece(shape, letters);
        p.cells = new ArrayList<>(cells);
        return p;
    }

    @Override
    public String toString() {
        return "Piece{letters=" + letters + ", cells=" + cells + '}';
    }
}
