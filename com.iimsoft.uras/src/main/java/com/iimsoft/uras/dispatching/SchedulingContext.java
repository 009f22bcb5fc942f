package com.iimsoft.uras.dispatching;

import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 某个决策时刻的只读快照，派工规则只从这里取数。
 * <p>
 * 按 id 索引：活动的加工时长 / 就绪时刻 / 候选资源，任务的剩余工作量 / 剩余工序数，
 * 资源的排队工作量 / 利用率。缺省值见各查询方法。
 */
public final class SchedulingContext {

    private final long currentTimeMs;
    private final Map<String, Task> tasks;
    private final Map<String, Long> processingMs;
    private final Map<String, Long> readyTimes;
    private final Map<String, List<String>> candidates;
    private final Map<String, Long> remainingWork;
    private final Map<String, Integer> remainingOps;
    private final Map<String, Long> queuedWork;
    private final Map<String, Double> utilization;
    private final Double averageProcessingMs;

    private SchedulingContext(Builder b) {
        this.currentTimeMs = b.currentTimeMs;
        this.tasks = Collections.unmodifiableMap(new HashMap<>(b.tasks));
        this.processingMs = Collections.unmodifiableMap(new HashMap<>(b.processingMs));
        this.readyTimes = Collections.unmodifiableMap(new HashMap<>(b.readyTimes));
        this.candidates = Collections.unmodifiableMap(new HashMap<>(b.candidates));
        this.remainingWork = Collections.unmodifiableMap(new HashMap<>(b.remainingWork));
        this.remainingOps = Collections.unmodifiableMap(new HashMap<>(b.remainingOps));
        this.queuedWork = Collections.unmodifiableMap(new HashMap<>(b.queuedWork));
        this.utilization = Collections.unmodifiableMap(new HashMap<>(b.utilization));
        this.averageProcessingMs = b.averageProcessingMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SchedulingContext at(long currentTimeMs) {
        return builder().currentTimeMs(currentTimeMs).build();
    }

    public long getCurrentTimeMs() {
        return currentTimeMs;
    }

    /** 活动所属任务；未登记返回 null */
    public Task taskOf(Activity activity) {
        return tasks.get(activity.getTaskId());
    }

    /** 未登记时退回名义时长（期望值） */
    public long processingMs(Activity activity) {
        Long p = processingMs.get(activity.getId());
        return p != null ? p : activity.getDuration().nominalMs(null);
    }

    /** 任务剩余（含当前活动）工作量；未登记时为 0 */
    public long remainingWorkMs(String taskId) {
        return remainingWork.getOrDefault(taskId, 0L);
    }

    public int remainingOps(String taskId) {
        return remainingOps.getOrDefault(taskId, 0);
    }

    public Long readyTime(Activity activity) {
        return readyTimes.get(activity.getId());
    }

    public List<String> candidatesOf(Activity activity) {
        List<String> c = candidates.get(activity.getId());
        return c != null ? c : List.copyOf(activity.explicitCandidates());
    }

    public long queuedWorkMs(String resourceId) {
        return queuedWork.getOrDefault(resourceId, 0L);
    }

    public double utilizationOf(String resourceId) {
        return utilization.getOrDefault(resourceId, 0.0);
    }

    /** 平均加工时长：显式给出优先，否则取已登记活动的平均值，都没有则为 1 */
    public double averageProcessingMs() {
        if (averageProcessingMs != null && averageProcessingMs > 0) {
            return averageProcessingMs;
        }
        double avg = processingMs.values().stream().mapToLong(Long::longValue).average().orElse(1.0);
        return avg > 0 ? avg : 1.0;
    }

    public static final class Builder {
        private long currentTimeMs;
        private final Map<String, Task> tasks = new HashMap<>();
        private final Map<String, Long> processingMs = new HashMap<>();
        private final Map<String, Long> readyTimes = new HashMap<>();
        private final Map<String, List<String>> candidates = new HashMap<>();
        private final Map<String, Long> remainingWork = new HashMap<>();
        private final Map<String, Integer> remainingOps = new HashMap<>();
        private final Map<String, Long> queuedWork = new HashMap<>();
        private final Map<String, Double> utilization = new HashMap<>();
        private Double averageProcessingMs;

        private Builder() {
        }

        public Builder currentTimeMs(long t) {
            this.currentTimeMs = t;
            return this;
        }

        public Builder task(Task task) {
            tasks.put(task.getId(), task);
            return this;
        }

        public Builder processingMs(String activityId, long ms) {
            processingMs.put(activityId, ms);
            return this;
        }

        public Builder readyTime(String activityId, long t) {
            readyTimes.put(activityId, t);
            return this;
        }

        public Builder candidates(String activityId, List<String> resourceIds) {
            candidates.put(activityId, List.copyOf(resourceIds));
            return this;
        }

        public Builder remainingWork(String taskId, long ms) {
            remainingWork.put(taskId, ms);
            return this;
        }

        public Builder remainingOps(String taskId, int ops) {
            remainingOps.put(taskId, ops);
            return this;
        }

        public Builder queuedWork(String resourceId, long ms) {
            queuedWork.put(resourceId, ms);
            return this;
        }

        public Builder utilization(String resourceId, double load) {
            utilization.put(resourceId, load);
            return this;
        }

        public Builder averageProcessingMs(double ms) {
            this.averageProcessingMs = ms;
            return this;
        }

        public SchedulingContext build() {
            return new SchedulingContext(this);
        }
    }
}
