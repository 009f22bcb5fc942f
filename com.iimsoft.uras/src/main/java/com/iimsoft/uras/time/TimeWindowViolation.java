package com.iimsoft.uras.time;

public final class TimeWindowViolation {

    private final long earlyMs;
    private final long lateMs;
    private final WindowType type;
    private final double penalty;

    public TimeWindowViolation(long earlyMs, long lateMs, WindowType type, double penalty) {
        this.earlyMs = earlyMs;
        this.lateMs = lateMs;
        this.type = type;
        this.penalty = penalty;
    }

    public long totalViolationMs() {
        return Math.abs(earlyMs) + Math.abs(lateMs);
    }

    public boolean isTardy() {
        return lateMs > 0;
    }

    public boolean isEarly() {
        return earlyMs > 0;
    }

    public boolean isHard() {
        return type == WindowType.HARD;
    }

    public long getEarlyMs() {
        return earlyMs;
    }

    public long getLateMs() {
        return lateMs;
    }

    public WindowType getType() {
        return type;
    }

    public double getPenalty() {
        return penalty;
    }
}
