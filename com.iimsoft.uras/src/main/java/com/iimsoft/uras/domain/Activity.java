package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 任务中的一个工序，需要占用允许集合中的一个资源。
 * <p>
 * resourceGroups：资源类别名 -> 有序候选资源 id。候选列表为空表示该类别下任意资源都可以。
 */
@Getter
public final class Activity {

    private final String id;
    private final String taskId;
    private final int sequence;
    private final ActivityDuration duration;
    private final Map<String, List<String>> resourceGroups;
    private final List<String> predecessors;
    private final Map<String, String> attributes;

    @Builder
    public Activity(String id,
                    String taskId,
                    int sequence,
                    ActivityDuration duration,
                    @Singular Map<String, List<String>> resourceGroups,
                    @Singular List<String> predecessors,
                    @Singular Map<String, String> attributes) {
        if (id == null || id.isBlank()) {
            throw new InvalidSpecException("activity.id 不能为空");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new InvalidSpecException("activity " + id + " 缺少 taskId");
        }
        this.id = id;
        this.taskId = taskId;
        this.sequence = sequence;
        this.duration = Objects.requireNonNull(duration, "activity " + id + " 缺少 duration");
        Map<String, List<String>> groups = new LinkedHashMap<>();
        if (resourceGroups != null) {
            resourceGroups.forEach((k, v) -> groups.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        this.resourceGroups = Collections.unmodifiableMap(groups);
        this.predecessors = predecessors == null ? List.of() : List.copyOf(predecessors);
        this.attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** 所有类别中显式列出的候选资源（保持顺序、去重） */
    public Set<String> explicitCandidates() {
        Set<String> out = new LinkedHashSet<>();
        resourceGroups.values().forEach(out::addAll);
        return out;
    }

    @Override
    public String toString() {
        return "Activity[" + id + " task=" + taskId + " seq=" + sequence + "]";
    }
}
