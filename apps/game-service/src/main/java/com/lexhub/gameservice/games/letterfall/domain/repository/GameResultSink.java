package com.lexhub.gameservice.games.letterfall.domain.repository;

import com.lexhub.gameservice.games.letterfall.domain.model.GameResult;

import java.util.Optional;

/**
 * 结算结果交接：对局结束时发布一次，结算页取走一次。
 */
public interface GameResultSink {

    void publish(GameResult result);

    /** 取走并清除该身份最近一次结果 */
    Optional<GameResult> take(String identity);
}
