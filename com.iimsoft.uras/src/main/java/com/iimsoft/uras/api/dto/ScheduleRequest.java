package com.iimsoft.uras.api.dto;

import com.iimsoft.uras.calendar.ShiftCalendarConfig;

import java.util.List;
import java.util.Map;

/**
 * 排程请求：任务 / 资源 / 约束 + 算法选择及参数。时间单位统一为毫秒。
 */
public class ScheduleRequest {

    /** 时间轴原点，任何活动不得早于此开始 */
    public Long originMs = 0L;
    /** 按此置信度取加工时长分位数；null 表示取期望 */
    public Double durationConfidence;

    public List<TaskDto> tasks;
    public List<ResourceDto> resources;
    public List<ConstraintDto> constraints;

    public AlgorithmDto algorithm;

    public static class TaskDto {
        public String id;
        public String name;
        public String category;
        public Integer priority;
        public Long dueMs;
        public Long releaseMs;
        /** true 时不按 sequence 串联任务内的活动 */
        public Boolean noPrecedence;
        public List<ActivityDto> activities;
    }

    public static class ActivityDto {
        public String id;
        public int sequence;
        public DurationDto duration;
        /** 组名 -> 候选资源 id；空列表表示 "类别 = 组名" 的所有资源 */
        public Map<String, List<String>> resourceGroups;
        public List<String> predecessors;
        public Map<String, String> attributes;
    }

    public static class DurationDto {
        public long setupMs;
        public long teardownMs;
        public DistributionDto processing;
    }

    /**
     * kind: FIXED(ms) / PERT(optimisticMs, mostLikelyMs, pessimisticMs) /
     * UNIFORM(minMs, maxMs) / TRIANGULAR(minMs, modeMs, maxMs) / LOG_NORMAL(mu, sigma)
     */
    public static class DistributionDto {
        public String kind;
        public Long ms;
        public Long optimisticMs;
        public Long mostLikelyMs;
        public Long pessimisticMs;
        public Long minMs;
        public Long modeMs;
        public Long maxMs;
        public Double mu;
        public Double sigma;
    }

    public static class ResourceDto {
        public String id;
        public String name;
        public String kind; // PRIMARY / SECONDARY / HUMAN
        public String category;
        public Integer capacity;
        public Double efficiency;
        /** null 表示全天候可用 */
        public CalendarDto calendar;
    }

    /**
     * 日历两种写法，可同时给出（取并集）：显式区间，或按班次展开。
     */
    public static class CalendarDto {
        public List<IntervalDto> windows;
        public List<IntervalDto> blocked;
        public ShiftCalendarConfig shifts;
        public Long shiftStartMs;
        public Integer shiftDays;
    }

    public static class IntervalDto {
        public long startMs;
        public long endMs;

        public IntervalDto() {
        }

        public IntervalDto(long startMs, long endMs) {
            this.startMs = startMs;
            this.endMs = endMs;
        }
    }

    /** kind: PRECEDENCE / CAPACITY / TIME_WINDOW，按 kind 取对应字段 */
    public static class ConstraintDto {
        public String kind;

        public String beforeActivityId;
        public String afterActivityId;
        public Long minDelayMs;

        public String resourceId;
        public Integer maxConcurrent;

        public String target; // ACTIVITY / TASK
        public String targetId;
        public WindowDto window;
    }

    public static class WindowDto {
        public Long earliestStartMs;
        public Long latestStartMs;
        public Long earliestEndMs;
        public Long latestEndMs;
        public String type; // HARD / SOFT
        public Double penaltyPerMs;
    }

    public static class AlgorithmDto {
        public String type = "GREEDY"; // GREEDY / GA / CP_SAT
        public DispatchingDto dispatching;
        public GaDto ga;
        public CpDto cp;
    }

    public static class DispatchingDto {
        public List<String> rules;
        public String mode;
        public List<Double> weights;
        public Map<String, Double> ruleParameters;
    }

    /** null 字段沿用 EngineConfig 默认值 */
    public static class GaDto {
        public Integer populationSize;
        public Integer generations;
        public Double crossoverRate;
        public Double mutationRate;
        public Double resourceMutationRate;
        public Integer stagnationLimit;
        public Integer tournamentSize;
        public Integer eliteCount;
        public String selection;
        public String crossover;
        public String mutation;
        public Boolean parallelEvaluation;
        public Long randomSeed;
        public Boolean seedWithGreedy;
        public Double makespanWeight;
        public Double penaltyWeight;
    }

    public static class CpDto {
        public Long timeLimitMs;
        public Long nodeLimit;
        public Double makespanWeight;
        public Double penaltyWeight;
        public Long timeStepMs;
        public Integer maxTimeSlots;
        public Integer parallelWorkers;
        public Boolean seedWithGreedy;
        public Boolean stopAfterFirst;
    }
}
