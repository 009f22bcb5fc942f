package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Comparator;
import java.util.List;

/**
 * 顶层工作单元。activities 在构造时按 sequence 排序。
 */
@Getter
public final class Task {

    private final String id;
    private final String name;
    private final String category;
    /** 越大越紧急 */
    private final int priority;
    private final Long dueMs;
    private final Long releaseMs;
    private final List<Activity> activities;
    /** true 时不按 sequence 建立隐式先后关系 */
    private final boolean noPrecedence;

    @Builder
    public Task(String id, String name, String category, Integer priority, Long dueMs, Long releaseMs,
                @Singular List<Activity> activities, boolean noPrecedence) {
        if (id == null || id.isBlank()) {
            throw new InvalidSpecException("task.id 不能为空");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.category = category == null ? "" : category;
        this.priority = priority == null ? 1 : priority;
        this.dueMs = dueMs;
        this.releaseMs = releaseMs;
        this.activities = activities == null ? List.of() : activities.stream()
                .sorted(Comparator.comparingInt(Activity::getSequence))
                .toList();
        this.noPrecedence = noPrecedence;
    }

    public long totalNominalMs(Double confidence) {
        return activities.stream().mapToLong(a -> a.getDuration().nominalMs(confidence)).sum();
    }

    @Override
    public String toString() {
        return "Task[" + id + " prio=" + priority + " due=" + dueMs + "]";
    }
}
