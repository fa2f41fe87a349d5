package com.lexhub.gameservice.games.letterfall.domain.piece;

import com.lexhub.gameservice.games.letterfall.domain.model.Piece;

/**
 * 方块与随机字母的供给方。
 */
public interface PieceSource {

    /** 生成一个新方块（尚未放到出生点） */
    Piece nextPiece();

    /** 单个随机字母（答错测验时补行用） */
    char nextLetter();
}
