package com.lexhub.gameservice.games.letterfall.domain.piece;

import com.lexhub.gameservice.games.letterfall.domain.model.Cell;

import java.util.List;

/**
 * 方块形状表。每个形状的第一个偏移是旋转轴。
 */
public final class ShapeCatalog {

    private ShapeCatalog() {}

    public static final List<Cell> I = List.of(new Cell(0, 0), new Cell(1, 0), new Cell(2, 0), new Cell(3, 0));
    public static final List<Cell> O = List.of(new Cell(0, 0), new Cell(1, 0), new Cell(0, 1), new Cell(1, 1));
    public static final List<Cell> L = List.of(new Cell(0, 0), new Cell(1, 0), new Cell(2, 0), new Cell(2, 1));
    public static final List<Cell> J = List.of(new Cell(0, 1), new Cell(1, 1), new Cell(2, 1), new Cell(2, 0));
    public static final List<Cell> Z = List.of(new Cell(0, 0), new Cell(1, 0), new Cell(1, 1), new Cell(2, 1));
    public static final List<Cell> S = List.of(new Cell(0, 1), new Cell(1, 1), new Cell(1, 0), new Cell(2, 0));

    public static final List<List<Cell>> ALL = List.of(I, O, L, J, Z, S);
}
