package com.iimsoft.uras.scheduler;

import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.score.Evaluation;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次求解的返回值。不可行 / 预算耗尽都是普通返回值，不走异常。
 */
@Getter
public final class SolveResult {

    private final String algorithm;
    private final SolveStatus status;
    /** INFEASIBLE 或预算内一个解都没找到时为 null */
    private final Schedule schedule;
    private final Evaluation evaluation;
    private final boolean provenOptimal;
    private final String message;
    private final Map<String, Number> stats;

    public SolveResult(String algorithm, SolveStatus status, Schedule schedule, Evaluation evaluation,
                       boolean provenOptimal, String message, Map<String, Number> stats) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.status = Objects.requireNonNull(status, "status");
        this.schedule = schedule;
        this.evaluation = evaluation;
        this.provenOptimal = provenOptimal;
        this.message = message;
        this.stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public static SolveResult infeasible(String algorithm, String message, Map<String, Number> stats) {
        return new SolveResult(algorithm, SolveStatus.INFEASIBLE, null, null, false, message, stats);
    }

    /** 没找到解，但也没有证明无解（例如只在加粗的时间网格上搜过） */
    public static SolveResult unresolved(String algorithm, String message, Map<String, Number> stats) {
        return new SolveResult(algorithm, SolveStatus.BUDGET_EXCEEDED, null, null, false, message, stats);
    }

    public boolean hasSchedule() {
        return schedule != null;
    }

    @Override
    public String toString() {
        return "SolveResult[" + algorithm + " " + status + (schedule == null ? "" : " makespan=" + schedule.getMakespanMs())
                + (message == null ? "" : " msg=" + message) + "]";
    }
}
