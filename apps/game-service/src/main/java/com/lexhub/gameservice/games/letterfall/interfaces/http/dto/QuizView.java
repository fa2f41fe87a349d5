package com.lexhub.gameservice.games.letterfall.interfaces.http.dto;

import com.lexhub.gameservice.games.letterfall.domain.model.Quiz;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 测验的 HTTP 视图，不暴露正确答案。
 */
@Data
@AllArgsConstructor
public class QuizView {
    private String word;
    private List<String> choices;

    public static QuizView from(Quiz quiz) {
        return new QuizView(quiz.word(), quiz.choices());
    }
}
