package com.iimsoft.uras.ga;

import com.iimsoft.uras.scheduler.SolveResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * GA 求解结果：统一的 SolveResult + 逐代统计。
 */
@Getter
@AllArgsConstructor
public final class GaResult {

    /** 单代种群统计；cost 只统计可行个体，没有可行个体时为 -1 */
    @Getter
    @AllArgsConstructor
    public static final class GenerationStats {
        private final int generation;
        /** 截至本代的全局最优（不会变差） */
        private final long bestHardScore;
        private final long bestCost;
        private final long populationBestCost;
        private final double averageCost;
        private final long worstCost;
        private final int feasibleCount;
    }

    private final SolveResult result;
    private final List<GenerationStats> history;
    private final int generationsRun;
    private final boolean stoppedByStagnation;
}
