package com.iimsoft.uras.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * 一次排程请求的全部输入。构造后只读。
 */
@Getter
public final class SchedulingProblem {

    private final List<Task> tasks;
    private final List<Resource> resources;
    private final List<Constraint> constraints;
    /** 时间轴原点，活动不得早于此开始 */
    private final long originMs;
    /** 计划时长取分布的哪个分位数；null 表示用期望值 */
    private final Double durationConfidence;

    @Builder
    public SchedulingProblem(@Singular List<Task> tasks,
                             @Singular List<Resource> resources,
                             @Singular List<Constraint> constraints,
                             long originMs,
                             Double durationConfidence) {
        this.tasks = tasks == null ? List.of() : List.copyOf(tasks);
        this.resources = resources == null ? List.of() : List.copyOf(resources);
        this.constraints = constraints == null ? List.of() : List.copyOf(constraints);
        this.originMs = originMs;
        this.durationConfidence = durationConfidence;
    }

    public int activityCount() {
        return tasks.stream().mapToInt(t -> t.getActivities().size()).sum();
    }
}
