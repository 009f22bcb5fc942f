package com.iimsoft.uras.api.dto;

import java.util.List;
import java.util.Map;

public class ScheduleResponse {

    public boolean success;
    public String algorithm;
    /** OPTIMAL / FEASIBLE / BUDGET_EXCEEDED / INFEASIBLE */
    public String status;
    public boolean provenOptimal;
    public String message;

    /** HardSoftLongScore 文本形式 */
    public String score;
    public Long cost;

    public ScheduleDto schedule;
    public KpiDto kpi;
    /** 硬违规明细（不可行时也给出，便于定位） */
    public List<ViolationDto> violations;
    public Map<String, Number> stats;
    /** 仅 GA */
    public List<GenerationDto> generations;

    public FailureDto failure;

    public static ScheduleResponse failure(String kind, String message) {
        ScheduleResponse r = new ScheduleResponse();
        r.success = false;
        r.failure = new FailureDto();
        r.failure.kind = kind;
        r.failure.message = message;
        r.message = message;
        return r;
    }

    public static class ScheduleDto {
        public List<AssignmentDto> assignments;
        public List<ViolationDto> violations;
        public long makespanMs;
        public double penalty;
    }

    public static class AssignmentDto {
        public String activityId;
        public String taskId;
        public String resourceId;
        public long startMs;
        public long endMs;
    }

    public static class ViolationDto {
        public String type;
        public List<String> relatedIds;
        public boolean hard;
        public String message;
        public double penalty;
    }

    public static class KpiDto {
        public long makespanMs;
        public long totalTardinessMs;
        public double meanTardinessMs;
        public long maxTardinessMs;
        public double onTimeRate;
        public Map<String, Double> utilizationByResource;
        public double averageUtilization;
        public double averageFlowTimeMs;
    }

    public static class GenerationDto {
        public int generation;
        public long bestHardScore;
        public long bestCost;
        public long populationBestCost;
        public double averageCost;
        public long worstCost;
        public int feasibleCount;
    }

    public static class FailureDto {
        /** INVALID_SPEC / INFEASIBLE / BUDGET_EXCEEDED / INCONSISTENT_SCHEDULE / INTERNAL_ERROR */
        public String kind;
        public String message;
    }
}
