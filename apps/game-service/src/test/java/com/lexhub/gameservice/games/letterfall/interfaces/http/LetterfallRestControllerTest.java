package com.lexhub.gameservice.games.letterfall.interfaces.http;

import com.lexhub.gameservice.common.WebExceptionAdvice;
import com.lexhub.gameservice.games.letterfall.domain.enums.Difficulty;
import com.lexhub.gameservice.games.letterfall.domain.enums.PlayerCommand;
import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.model.Quiz;
import com.lexhub.gameservice.games.letterfall.domain.model.RunView;
import com.lexhub.gameservice.games.letterfall.domain.model.StartOptions;
import com.lexhub.gameservice.games.letterfall.service.LetterfallService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static com.lexhub.gameservice.games.letterfall.support.Fixtures.emptyRun;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.iPiece;
import static com.lexhub.gameservice.games.letterfall.support.Fixtures.oPiece;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LetterfallRestControllerTest {

    @Mock
    private LetterfallService svc;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new LetterfallRestController(svc))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    private static RunView sampleView() {
        return RunView.of("alice", emptyRun(iPiece("WORD"), oPiece("ABCD")), false);
    }

    @Test
    void startsARunWithRequestOptions() throws Exception {
        when(svc.startOrResume(new StartOptions("alice", 5, Difficulty.HARD))).thenReturn(sampleView());

        mvc.perform(post("/api/letterfall/runs")
                        .header("X-Player-Id", " alice ")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startingLevel\":5,\"difficulty\":\"hard\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.identity").value("alice"))
                .andExpect(jsonPath("$.data.mode").value("PLAYING"))
                .andExpect(jsonPath("$.data.board.length()").value(33));
    }

    @Test
    void emptyBodyStartsWithDefaults() throws Exception {
        when(svc.startOrResume(StartOptions.standard("alice"))).thenReturn(sampleView());

        mvc.perform(post("/api/letterfall/runs").header("X-Player-Id", "alice"))
                .andExpect(status().isOk());
    }

    @Test
    void missingPlayerIsABadRequest() throws Exception {
        mvc.perform(get("/api/letterfall/runs/me"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
        verifyNoInteractions(svc);
    }

    @Test
    void unknownDifficultyIsABadRequest() throws Exception {
        mvc.perform(post("/api/letterfall/runs")
                        .header("X-Player-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"difficulty\":\"nightmare\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void commandsAreParsedLeniently() throws Exception {
        when(svc.command("alice", PlayerCommand.HARD_DROP)).thenReturn(true);

        mvc.perform(post("/api/letterfall/runs/me/commands/hard-drop").header("X-Player-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    void unknownCommandIsABadRequest() throws Exception {
        mvc.perform(post("/api/letterfall/runs/me/commands/jump").header("X-Player-Id", "alice"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(svc);
    }

    @Test
    void missingRunIsNotFound() throws Exception {
        when(svc.view("bob")).thenThrow(new NoSuchElementException("没有进行中的对局：bob"));

        mvc.perform(get("/api/letterfall/runs/me").header("X-Player-Id", "bob"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void quizHidesTheAnswer() throws Exception {
        when(svc.quiz("alice")).thenReturn(Optional.of(new Quiz("CAT", List.of("a", "b", "c", "d"), "b")));

        mvc.perform(get("/api/letterfall/runs/me/quiz").header("X-Player-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.word").value("CAT"))
                .andExpect(jsonPath("$.data.choices.length()").value(4))
                .andExpect(jsonPath("$.data.correctChoice").doesNotExist());
    }

    @Test
    void answeringWithoutAQuizIsAConflict() throws Exception {
        when(svc.answerQuiz("alice", "b", false)).thenThrow(new IllegalStateException("当前没有待回答的测验"));

        mvc.perform(post("/api/letterfall/runs/me/quiz/answer")
                        .header("X-Player-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"choice\":\"b\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    void skipIsForwarded() throws Exception {
        when(svc.answerQuiz("alice", null, true)).thenReturn(QuizOutcome.SKIPPED);

        mvc.perform(post("/api/letterfall/runs/me/quiz/answer")
                        .header("X-Player-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"skip\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("SKIPPED"));
    }

    @Test
    void pauseUsesDefaultReason() throws Exception {
        when(svc.pause("alice", "user")).thenReturn(sampleView());

        mvc.perform(post("/api/letterfall/runs/me/pause").header("X-Player-Id", "alice"))
                .andExpect(status().isOk());
        verify(svc).pause("alice", "user");
    }

    @Test
    void abandonDeletesTheRun() throws Exception {
        mvc.perform(delete("/api/letterfall/runs/me").header("X-Player-Id", "alice"))
                .andExpect(status().isOk());
        verify(svc).abandon("alice");
    }

    @Test
    void resultIsNullWhenNothingFinished() throws Exception {
        when(svc.takeResult(any())).thenReturn(Optional.empty());

        mvc.perform(get("/api/letterfall/results/me").header("X-Player-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").doesNotExist());
    }
}
