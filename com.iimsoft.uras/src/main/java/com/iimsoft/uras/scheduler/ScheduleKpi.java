package com.iimsoft.uras.scheduler;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * 排程质量指标，均由 {@link KpiCalculator} 从排程 + 原始问题派生。
 */
@Data
@AllArgsConstructor
public final class ScheduleKpi {

    private final long makespanMs;
    private final long totalTardinessMs;
    private final double meanTardinessMs;
    private final long maxTardinessMs;
    /** 按时完成的任务比例；没有任务时为 1.0 */
    private final double onTimeRate;
    /** 资源 id -> busy / (日历可用时间 × 容量)，统计区间 [原点, makespan) */
    private final Map<String, Double> utilizationByResource;
    private final double averageUtilization;
    /** 完工 - 释放时间 的平均值 */
    private final double averageFlowTimeMs;

    public boolean meetsThresholds(long maxTardinessMs, double minUtilization) {
        return this.maxTardinessMs <= maxTardinessMs && averageUtilization >= minUtilization;
    }
}
