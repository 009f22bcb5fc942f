package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.time.DurationDistribution;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 活动时长 = 准备 + 加工 + 收尾。加工时长可以是固定值也可以是分布。
 */
@Getter
@EqualsAndHashCode
public final class ActivityDuration {

    private final long setupMs;
    private final DurationDistribution processing;
    private final long teardownMs;

    public ActivityDuration(long setupMs, DurationDistribution processing, long teardownMs) {
        if (setupMs < 0 || teardownMs < 0) {
            throw new InvalidSpecException("setup/teardown 不能为负数: " + setupMs + "/" + teardownMs);
        }
        this.setupMs = setupMs;
        this.processing = Objects.requireNonNull(processing, "processing");
        this.teardownMs = teardownMs;
    }

    public static ActivityDuration fixed(long processMs) {
        return new ActivityDuration(0, DurationDistribution.fixed(processMs), 0);
    }

    public static ActivityDuration of(long setupMs, long processMs, long teardownMs) {
        return new ActivityDuration(setupMs, DurationDistribution.fixed(processMs), teardownMs);
    }

    public static ActivityDuration of(DurationDistribution processing) {
        return new ActivityDuration(0, processing, 0);
    }

    /**
     * 计划用名义时长。confidence 为 null 时用期望值（四舍五入），否则取对应分位数。
     */
    public long nominalMs(Double confidence) {
        long process = confidence == null
                ? Math.round(processing.expectedMs())
                : processing.quantileMs(confidence);
        return setupMs + process + teardownMs;
    }

    @Override
    public String toString() {
        return "Duration[" + setupMs + " + " + processing + " + " + teardownMs + "]";
    }
}
