package com.lexhub.gameservice.engine.core;

/**
 * 游戏状态接口。
 * - 必须可 copy：便于生成快照、保存/恢复、测试对比。
 * - 具体游戏（如 RunState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝，与原对象不共享任何可变结构。
     */
    GameState copy();
}
