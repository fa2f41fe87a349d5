package com.lexhub.gameservice.games.letterfall.service;

import com.lexhub.gameservice.games.letterfall.domain.enums.PlayerCommand;
import com.lexhub.gameservice.games.letterfall.domain.enums.QuizOutcome;
import com.lexhub.gameservice.games.letterfall.domain.model.EngineEvent;
import com.lexhub.gameservice.games.letterfall.domain.model.GameResult;
import com.lexhub.gameservice.games.letterfall.domain.model.Quiz;
import com.lexhub.gameservice.games.letterfall.domain.model.RunView;
import com.lexhub.gameservice.games.letterfall.domain.model.StartOptions;

import java.util.List;
import java.util.Optional;

public interface LetterfallService {

    /** 继续内存中的对局；没有则尝试从存档恢复，恢复失败清掉存档并按 options 开新局 */
    RunView startOrResume(StartOptions options);

    /** 丢弃当前对局与存档，按 options 开新局 */
    RunView restart(StartOptions options);

    RunView view(String identity);

    /** 执行一条输入指令；对局不接受输入时返回 false */
    boolean command(String identity, PlayerCommand command);

    RunView pause(String identity, String reason);

    RunView resume(String identity, String reason);

    /** 当前待答测验（不含正确答案的部分由接口层处理） */
    Optional<Quiz> quiz(String identity);

    /** 回答测验；choice 为空或 skip=true 视为跳过 */
    QuizOutcome answerQuiz(String identity, String choice, boolean skip);

    /** 取走该对局积压的事件 */
    List<EngineEvent> drainEvents(String identity);

    /** 手动保存；返回是否写入 */
    boolean save(String identity);

    /** 放弃对局：移出内存并清除存档 */
    void abandon(String identity);

    /** 取走最近一次结算结果 */
    Optional<GameResult> takeResult(String identity);

    // ---- 帧循环 / 自动保存 ----

    /** 推进所有在线对局 */
    void tickAll(long dtMs);

    /** 对所有在线对局做一次自动保存检查，返回写入次数 */
    int autosaveAll();

    /** 停机前：全部加 lifecycle 暂停并强制保存 */
    void suspendAll();
}
