package com.lexhub.gameservice.games.letterfall.interfaces.http.dto;

import lombok.Data;

/**
 * 测验作答：choice 为所选释义原文；skip=true 或 choice 为空表示跳过。
 */
@Data
public class QuizAnswerRequest {
    private String choice;
    private boolean skip;
}
