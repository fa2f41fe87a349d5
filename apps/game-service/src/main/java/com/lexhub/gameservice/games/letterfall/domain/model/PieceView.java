package com.lexhub.gameservice.games.letterfall.domain.model;

import java.util.List;

/** 方块只读视图：绝对格子与字母一一对应 */
public record PieceView(List<Cell> cells, List<Character> letters) {

    public static PieceView of(Piece p) {
        return p == null ? null : new PieceView(List.copyOf(p.cells()), p.letters());
    }
}
