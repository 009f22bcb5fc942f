package com.iimsoft.uras.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 排程结果中的一条：活动 -> (资源, [start, end))。
 */
@Data
@AllArgsConstructor
public final class Assignment {

    private final String activityId;
    private final String taskId;
    private final String resourceId;
    private final long startMs;
    private final long endMs;

    public long durationMs() {
        return endMs - startMs;
    }
}
