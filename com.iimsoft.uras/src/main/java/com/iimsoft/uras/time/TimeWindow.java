package com.iimsoft.uras.time;

import com.iimsoft.uras.exception.InvalidSpecException;

import java.util.Objects;

/**
 * 时间窗：四个可选边界（最早开始 / 最晚开始 / 最早结束 / 最晚结束）+ 硬/软标记。
 * <p>
 * 不可变；with* / hard() / soft() 都返回新实例。构造时校验边界一致性，不一致直接抛
 * {@link InvalidSpecException}，不会进入任何求解器。
 */
public final class TimeWindow {

    private final Long earliestStartMs;
    private final Long latestStartMs;
    private final Long earliestEndMs;
    private final Long latestEndMs;
    private final WindowType type;
    private final double penaltyPerMs;

    public TimeWindow(Long earliestStartMs, Long latestStartMs, Long earliestEndMs, Long latestEndMs,
                      WindowType type, double penaltyPerMs) {
        this.earliestStartMs = earliestStartMs;
        this.latestStartMs = latestStartMs;
        this.earliestEndMs = earliestEndMs;
        this.latestEndMs = latestEndMs;
        this.type = Objects.requireNonNull(type, "type");
        this.penaltyPerMs = penaltyPerMs;
        validate();
    }

    /** 无边界的软窗口（默认罚分 1.0/ms） */
    public static TimeWindow unbounded() {
        return new TimeWindow(null, null, null, null, WindowType.SOFT, 1.0);
    }

    /** [start, end] 的软窗口 */
    public static TimeWindow bounded(long startMs, long endMs) {
        return new TimeWindow(startMs, null, null, endMs, WindowType.SOFT, 1.0);
    }

    /** 开始不限、结束不晚于 deadline 的硬窗口 */
    public static TimeWindow deadline(long deadlineMs) {
        return new TimeWindow(null, null, null, deadlineMs, WindowType.HARD, 0.0);
    }

    /** 不早于 releaseMs 开始的硬窗口 */
    public static TimeWindow release(long releaseMs) {
        return new TimeWindow(releaseMs, null, null, null, WindowType.HARD, 0.0);
    }

    public TimeWindow hard() {
        return new TimeWindow(earliestStartMs, latestStartMs, earliestEndMs, latestEndMs, WindowType.HARD, 0.0);
    }

    public TimeWindow soft(double penaltyPerMs) {
        return new TimeWindow(earliestStartMs, latestStartMs, earliestEndMs, latestEndMs, WindowType.SOFT, penaltyPerMs);
    }

    public TimeWindow withEarliestStart(long ms) {
        return new TimeWindow(ms, latestStartMs, earliestEndMs, latestEndMs, type, penaltyPerMs);
    }

    public TimeWindow withLatestStart(long ms) {
        return new TimeWindow(earliestStartMs, ms, earliestEndMs, latestEndMs, type, penaltyPerMs);
    }

    public TimeWindow withEarliestEnd(long ms) {
        return new TimeWindow(earliestStartMs, latestStartMs, ms, latestEndMs, type, penaltyPerMs);
    }

    public TimeWindow withLatestEnd(long ms) {
        return new TimeWindow(earliestStartMs, latestStartMs, earliestEndMs, ms, type, penaltyPerMs);
    }

    private void validate() {
        if (penaltyPerMs < 0 || Double.isNaN(penaltyPerMs)) {
            throw new InvalidSpecException("penaltyPerMs 不能为负数: " + penaltyPerMs);
        }
        if (earliestStartMs != null && latestEndMs != null && latestEndMs < earliestStartMs) {
            throw new InvalidSpecException("时间窗结束早于开始: earliestStart=" + earliestStartMs + ", latestEnd=" + latestEndMs);
        }
        if (earliestStartMs != null && latestStartMs != null && latestStartMs < earliestStartMs) {
            throw new InvalidSpecException("latestStart < earliestStart: " + latestStartMs + " < " + earliestStartMs);
        }
        if (earliestEndMs != null && latestEndMs != null && latestEndMs < earliestEndMs) {
            throw new InvalidSpecException("latestEnd < earliestEnd: " + latestEndMs + " < " + earliestEndMs);
        }
    }

    /**
     * 检查 [startMs, endMs) 是否违反本窗口。
     *
     * @return 无违反时返回 null
     */
    public TimeWindowViolation checkViolation(long startMs, long endMs) {
        long early = 0;
        long late = 0;
        if (earliestStartMs != null && startMs < earliestStartMs) {
            early += earliestStartMs - startMs;
        }
        if (latestStartMs != null && startMs > latestStartMs) {
            late += startMs - latestStartMs;
        }
        if (earliestEndMs != null && endMs < earliestEndMs) {
            early += earliestEndMs - endMs;
        }
        if (latestEndMs != null && endMs > latestEndMs) {
            late += endMs - latestEndMs;
        }
        if (early == 0 && late == 0) {
            return null;
        }
        return new TimeWindowViolation(early, late, type, (early + late) * penaltyPerMs);
    }

    /** 结合持续时间得到的最早合法开始（只看硬下界） */
    public long lowerStartBound(long durationMs) {
        long lb = Long.MIN_VALUE;
        if (earliestStartMs != null) {
            lb = Math.max(lb, earliestStartMs);
        }
        if (earliestEndMs != null) {
            lb = Math.max(lb, earliestEndMs - durationMs);
        }
        return lb;
    }

    /** 结合持续时间得到的最晚合法开始 */
    public long upperStartBound(long durationMs) {
        long ub = Long.MAX_VALUE;
        if (latestStartMs != null) {
            ub = Math.min(ub, latestStartMs);
        }
        if (latestEndMs != null) {
            ub = Math.min(ub, latestEndMs - durationMs);
        }
        return ub;
    }

    public boolean isHard() {
        return type == WindowType.HARD;
    }

    public Long getEarliestStartMs() {
        return earliestStartMs;
    }

    public Long getLatestStartMs() {
        return latestStartMs;
    }

    public Long getEarliestEndMs() {
        return earliestEndMs;
    }

    public Long getLatestEndMs() {
        return latestEndMs;
    }

    public WindowType getType() {
        return type;
    }

    public double getPenaltyPerMs() {
        return penaltyPerMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeWindow)) return false;
        TimeWindow that = (TimeWindow) o;
        return Double.compare(that.penaltyPerMs, penaltyPerMs) == 0
                && Objects.equals(earliestStartMs, that.earliestStartMs)
                && Objects.equals(latestStartMs, that.latestStartMs)
                && Objects.equals(earliestEndMs, that.earliestEndMs)
                && Objects.equals(latestEndMs, that.latestEndMs)
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(earliestStartMs, latestStartMs, earliestEndMs, latestEndMs, type, penaltyPerMs);
    }

    @Override
    public String toString() {
        return "TimeWindow[" + type + " es=" + earliestStartMs + " ls=" + latestStartMs
                + " ee=" + earliestEndMs + " le=" + latestEndMs + " p=" + penaltyPerMs + "]";
    }
}
