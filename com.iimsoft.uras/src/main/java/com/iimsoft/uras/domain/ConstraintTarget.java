package com.iimsoft.uras.domain;

public enum ConstraintTarget {
    /** 窗口作用于单个活动的 [start, end) */
    ACTIVITY,
    /** 窗口作用于任务整体：首个活动开始到最后一个活动结束 */
    TASK
}
