package com.lexhub.gameservice.games.letterfall.interfaces.http;

import com.lexhub.gameservice.games.letterfall.domain.constants.GameMessages;
import com.lexhub.gameservice.games.letterfall.domain.enums.PlayerCommand;
import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.model.EngineEvent;
import com.lexhub.gameservice.games.letterfall.domain.model.GameResult;
import com.lexhub.gameservice.games.letterfall.domain.model.RunView;
import com.lexhub.gameservice.games.letterfall.interfaces.http.dto.QuizAnswerRequest;
import com.lexhub.gameservice.games.letterfall.interfaces.http.dto.QuizView;
import com.lexhub.gameservice.games.letterfall.interfaces.http.dto.StartRunRequest;
import com.lexhub.gameservice.games.letterfall.service.LetterfallService;
import com.lexhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Letterfall 对局 http 接口。
 * 玩家身份取自请求头 X-Player-Id（由网关在鉴权后写入）。
 */
@Slf4j
@RestController
@RequestMapping("/api/letterfall")
@RequiredArgsConstructor
public class LetterfallRestController {

    static final String PLAYER_HEADER = "X-Player-Id";

    private final LetterfallService svc;

    /**
     * 开局或继续：
     *  - 内存中有未结束的对局直接返回；
     *  - 否则尝试从存档恢复，恢复失败按请求参数开新局。
     */
    @PostMapping("/runs")
    public ResponseEntity<ApiResponse<RunView>> startOrResume(@RequestHeader(name = PLAYER_HEADER, required = false) String player,
                                                              @RequestBody(required = false) StartRunRequest req) {
        StartRunRequest body = req == null ? new StartRunRequest() : req;
        return ResponseEntity.ok(ApiResponse.success(svc.startOrResume(body.toOptions(requirePlayer(player)))));
    }

    /** 丢弃当前对局与存档，重新开局 */
    @PostMapping("/runs/me/restart")
    public ResponseEntity<ApiResponse<RunView>> restart(@RequestHeader(name = PLAYER_HEADER, required = false) String player,
                                                        @RequestBody(required = false) StartRunRequest req) {
        StartRunRequest body = req == null ? new StartRunRequest() : req;
        return ResponseEntity.ok(ApiResponse.success(svc.restart(body.toOptions(requirePlayer(player)))));
    }

    @GetMapping("/runs/me")
    public ResponseEntity<ApiResponse<RunView>> view(@RequestHeader(name = PLAYER_HEADER, required = false) String player) {
        return ResponseEntity.ok(ApiResponse.success(svc.view(requirePlayer(player))));
    }

    /**
     * 输入指令：LEFT / RIGHT / ROTATE / HARD_DROP / HOLD / SOFT_DROP_ON / SOFT_DROP_OFF（忽略大小写）。
     * 返回值表示指令是否生效（暂停、测验中、被挡住时为 false）。
     */
    @PostMapping("/runs/me/commands/{command}")
    public ResponseEntity<ApiResponse<Boolean>> command(@RequestHeader(name = PLAYER_HEADER, required = false) String player,
                                                        @PathVariable("command") String command) {
        boolean applied = svc.command(requirePlayer(player), PlayerCommand.parse(command));
        return ResponseEntity.ok(ApiResponse.success(applied));
    }

    @PostMapping("/runs/me/pause")
    public ResponseEntity<ApiResponse<RunView>> pause(@RequestHeader(name = PLAYER_HEADER, required = false) String player,
                                                      @RequestParam(name = "reason", defaultValue = "user") String reason) {
        return ResponseEntity.ok(ApiResponse.success(svc.pause(requirePlayer(player), reason)));
    }

    @PostMapping("/runs/me/resume")
    public ResponseEntity<ApiResponse<RunView>> resume(@RequestHeader(name = PLAYER_HEADER, required = false) String player,
                                                       @RequestParam(name = "reason", defaultValue = "user") String reason) {
        return ResponseEntity.ok(ApiResponse.success(svc.resume(requirePlayer(player), reason)));
    }

    /** 当前测验；没有待答测验时 data 为 null */
    @GetMapping("/runs/me/quiz")
    public ResponseEntity<ApiResponse<QuizView>> quiz(@RequestHeader(name = PLAYER_HEADER, required = false) String player) {
        QuizView view = svc.quiz(requirePlayer(player)).map(QuizView::from).orElse(null);
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    @PostMapping("/runs/me/quiz/answer")
    public ResponseEntity<ApiResponse<QuizOutcome>> answer(@RequestHeader(name = PLAYER_HEADER, required = false) String player,
                                                           @RequestBody(required = false) QuizAnswerRequest req) {
        QuizAnswerRequest body = req == null ? new QuizAnswerRequest() : req;
        QuizOutcome outcome = svc.answerQuiz(requirePlayer(player), body.getChoice(), body.isSkip());
        return ResponseEntity.ok(ApiResponse.success(outcome));
    }

    /** 取走积压事件（前端每帧或每次渲染前拉取） */
    @GetMapping("/runs/me/events")
    public ResponseEntity<ApiResponse<List<EngineEvent>>> events(@RequestHeader(name = PLAYER_HEADER, required = false) String player) {
        return ResponseEntity.ok(ApiResponse.success(svc.drainEvents(requirePlayer(player))));
    }

    @PostMapping("/runs/me/save")
    public ResponseEntity<ApiResponse<Boolean>> save(@RequestHeader(name = PLAYER_HEADER, required = false) String player) {
        return ResponseEntity.ok(ApiResponse.success(svc.save(requirePlayer(player))));
    }

    @DeleteMapping("/runs/me")
    public ResponseEntity<ApiResponse<Void>> abandon(@RequestHeader(name = PLAYER_HEADER, required = false) String player) {
        svc.abandon(requirePlayer(player));
        return ResponseEntity.ok(ApiResponse.success());
    }

    /** 结算页：取走最近一次结果；没有时 data 为 null */
    @GetMapping("/results/me")
    public ResponseEntity<ApiResponse<GameResult>> result(@RequestHeader(name = PLAYER_HEADER, required = false) String player) {
        return ResponseEntity.ok(ApiResponse.success(svc.takeResult(requirePlayer(player)).orElse(null)));
    }

    private static String requirePlayer(String player) {
        if (player == null || player.isBlank()) throw new IllegalArgumentException(GameMessages.IDENTITY_REQUIRED);
        return player.trim();
    }
}
