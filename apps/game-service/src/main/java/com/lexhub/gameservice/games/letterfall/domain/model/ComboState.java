package com.lexhub.gameservice.games.letterfall.domain.model;

/**
 * 连击倍率状态机。
 * - 每次有效消除：step+1，倍率 = min(start + growth*(step-1), max)，空闲计时清零；
 * - 每帧累加空闲时间，超过衰减窗口且 step>0 时：step-1，倍率按新 step 重算（同样封顶 max），计时清零。
 * 倍率始终位于 [start, max]。
 */
public class ComboState {

    private final int decayMs;
    private final double growth;
    private final double startMult;
    private final double maxMult;

    private int step;
    private double multiplier;
    private long msSinceLastClear;

    public ComboState() {
        this(9000, 0.5, 1.0, 4.0);
    }

    public ComboState(int decayMs, double growth, double startMult, double maxMult) {
        if (decayMs <= 0 || growth < 0 || startMult <= 0 || maxMult < startMult) {
            throw new IllegalArgumentException("bad combo parameters");
        }
        this.decayMs = decayMs;
        this.growth = growth;
        this.startMult = startMult;
        this.maxMult = maxMult;
        reset();
    }

    public void reset() {
        step = 0;
        multiplier = startMult;
        msSinceLastClear = 0;
    }

    /** 记录一次有效消除 */
    public void onClear() {
        step += 1;
        multiplier = Math.min(startMult + growth * (step - 1), maxMult);
        msSinceLastClear = 0;
    }

    /** 按经过的毫秒推进衰减 */
    public void update(long dtMs) {
        msSinceLastClear += dtMs;
        if (msSinceLastClear > decayMs && step > 0) {
            step -= 1;
            multiplier = Math.min(Math.max(startMult + growth * Math.max(0, step - 1), startMult), maxMult);
            msSinceLastClear = 0;
        }
    }

    public double effectiveMultiplier(double baseMultiplier) {
        return baseMultiplier * multiplier;
    }

    public boolean isActive() { return step > 0; }

    public int step() { return step; }

    public double multiplier() { return multiplier; }

    public long msSinceLastClear() { return msSinceLastClear; }

    public ComboState copy() {
        ComboState c = new ComboState(decayMs, growth, startMult, maxMult);
        c.step = step;
        c.multiplier = multiplier;
        c.msSinceLastClear = msSinceLastClear;
        return c;
    }
}
