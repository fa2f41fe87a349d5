package com.lexhub.gameservice.games.letterfall.domain.rule;

import com.lexhub.gameservice.games.letterfall.domain.model.Cell;
import com.lexhub.gameservice.games.letterfall.domain.model.Grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 方块碰撞与旋转规则。
 * 只包含纯判断/纯计算逻辑，不修改棋盘。
 */
public final class PieceJudge {

    /**
     * 旋转后依次尝试的踢墙偏移，顺序固定：原位、右移、左移、上移。
     * 先命中的合法位置胜出。
     */
    public static final int[][] KICKS = {
            {0, 0},
            {1, 0},
            {-1, 0},
            {0, -1}
    };

    private PieceJudge() {}

    /** 一组格子是否全部在棋盘内且都为空 */
    public static boolean isLegal(Grid g, Collection<Cell> cells) {
        for (Cell c : cells) {
            if (!g.isEmpty(c.x(), c.y())) return false;
        }
        return true;
    }

    /** 整体平移 */
    public static List<Cell> translate(List<Cell> cells, int dx, int dy) {
        List<Cell> out = new ArrayList<>(cells.size());
        for (Cell c : cells) out.add(c.translate(dx, dy));
        return out;
    }

    /**
     * 以第一个格子为轴顺时针旋转 90°：
     * rx = px - (y - py), ry = py + (x - px)
     */
    public static List<Cell> rotateAboutPivot(List<Cell> cells) {
        Cell pivot = cells.get(0);
        int px = pivot.x(), py = pivot.y();
        List<Cell> out = new ArrayList<>(cells.size());
        for (Cell c : cells) {
            out.add(new Cell(px - (c.y() - py), py + (c.x() - px)));
        }
        return out;
    }
}
