package com.lexhub.gameservice.games.letterfall.domain.session;

import com.lexhub.gameservice.games.letterfall.domain.enums.RestoreFailure;
import com.lexhub.gameservice.games.letterfall.domain.model.RunState;

/**
 * 恢复结果：要么得到一份全新的对局状态，要么给出失败原因。
 */
public record RestoreResult(RunState state, RestoreFailure failure) {

    public static RestoreResult restored(RunState state) {
        return new RestoreResult(state, null);
    }

    public static RestoreResult failed(RestoreFailure failure) {
        return new RestoreResult(null, failure);
    }

    public boolean isRestored() {
        return state != null;
    }
}
