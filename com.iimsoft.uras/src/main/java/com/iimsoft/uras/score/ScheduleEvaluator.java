package com.iimsoft.uras.score;

import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.domain.Violation;
import com.iimsoft.uras.domain.ViolationType;
import com.iimsoft.uras.exception.InconsistentScheduleException;
import com.iimsoft.uras.time.TimeWindow;
import com.iimsoft.uras.time.TimeWindowViolation;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 对完整排程做一次全量评分，所有算法共用同一口径。
 * <p>
 * 硬约束（任一违反即不可行）：
 * <ul>
 *   <li>每个活动都被排程，且资源属于其允许集合</li>
 *   <li>不早于时间原点 / 任务释放时间</li>
 *   <li>资源日历覆盖 [start, end)</li>
 *   <li>先后关系（含最小间隔）</li>
 *   <li>资源并发不超过容量</li>
 *   <li>硬时间窗</li>
 * </ul>
 * hardScore = -Σ max(1, 违反量)；softScore = -(makespanWeight × makespan + penaltyWeight × 软罚分)。
 */
public class ScheduleEvaluator {

    private final ProblemIndex index;
    private final ObjectiveWeights weights;

    public ScheduleEvaluator(ProblemIndex index, ObjectiveWeights weights) {
        this.index = Objects.requireNonNull(index, "index");
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public ScheduleEvaluator(ProblemIndex index) {
        this(index, ObjectiveWeights.DEFAULT);
    }

    public ObjectiveWeights getWeights() {
        return weights;
    }

    public Evaluation evaluate(Schedule schedule) {
        int n = index.activityCount();
        Assignment[] byActivity = new Assignment[n];
        int[] resourceOf = new int[n];
        for (Assignment as : schedule.getAssignments()) {
            int a = index.activityIndexOf(as.getActivityId());
            int r = index.resourceIndexOf(as.getResourceId());
            if (as.getEndMs() < as.getStartMs()) {
                throw new InconsistentScheduleException("assignment 结束早于开始: " + as);
            }
            byActivity[a] = as;
            resourceOf[a] = r;
        }

        List<Violation> violations = new ArrayList<>();
        long hard = 0;

        ResourceLoadTracker[] trackers = new ResourceLoadTracker[index.resourceCount()];
        for (int r = 0; r < trackers.length; r++) {
            trackers[r] = new ResourceLoadTracker(index.capacity(r));
        }

        for (int a = 0; a < n; a++) {
            Assignment as = byActivity[a];
            String aid = index.activity(a).getId();
            if (as == null) {
                violations.add(new Violation(ViolationType.RESOURCE_UNAVAILABLE, List.of(aid), true,
                        "activity " + aid + " 未被排程", 0));
                hard += 1;
                continue;
            }
            int r = resourceOf[a];
            Resource res = index.resource(r);
            if (!index.isAllowed(a, r)) {
                violations.add(new Violation(ViolationType.RESOURCE_NOT_ALLOWED, List.of(aid, res.getId()), true,
                        "activity " + aid + " 不允许使用资源 " + res.getId(), 0));
                hard += 1;
            }
            long floor = index.originMs();
            Long release = index.task(index.taskOf(a)).getReleaseMs();
            if (release != null) {
                floor = Math.max(floor, release);
            }
            if (as.getStartMs() < floor) {
                violations.add(new Violation(ViolationType.TIME_WINDOW, List.of(aid), true,
                        "activity " + aid + " 早于释放时间 " + floor, 0));
                hard += floor - as.getStartMs();
            }
            if (!res.getCalendar().isAvailable(as.getStartMs(), as.getEndMs())) {
                violations.add(new Violation(ViolationType.RESOURCE_UNAVAILABLE, List.of(aid, res.getId()), true,
                        "资源 " + res.getId() + " 在 [" + as.getStartMs() + ", " + as.getEndMs() + ") 不可用", 0));
                hard += 1;
            }
            trackers[r].add(as.getStartMs(), as.getEndMs());

            int[] preds = index.predecessors(a);
            long[] delays = index.predecessorDelays(a);
            for (int k = 0; k < preds.length; k++) {
                Assignment before = byActivity[preds[k]];
                if (before == null) {
                    continue;
                }
                long gap = before.getEndMs() + delays[k] - as.getStartMs();
                if (gap > 0) {
                    violations.add(new Violation(ViolationType.PRECEDENCE_VIOLATED, List.of(before.getActivityId(), aid),
                            true, "activity " + before.getActivityId() + " 必须先于 " + aid + " 完成 (overlap " + gap + " ms)", 0));
                    hard += gap;
                }
            }

            for (TimeWindow w : index.activityWindows(a)) {
                hard += checkWindow(w, as.getStartMs(), as.getEndMs(), List.of(aid), violations);
            }
        }

        for (int r = 0; r < trackers.length; r++) {
            int over = trackers[r].overCapacity();
            if (over > 0) {
                String rid = index.resource(r).getId();
                violations.add(new Violation(ViolationType.CAPACITY_EXCEEDED, List.of(rid), true,
                        "资源 " + rid + " 容量超出 " + over, over * 1000.0));
                hard += over;
            }
        }

        for (int t = 0; t < index.taskCount(); t++) {
            if (index.taskWindows(t).isEmpty()) {
                continue;
            }
            long start = Long.MAX_VALUE;
            long end = Long.MIN_VALUE;
            for (int a : index.activitiesOfTask(t)) {
                if (byActivity[a] != null) {
                    start = Math.min(start, byActivity[a].getStartMs());
                    end = Math.max(end, byActivity[a].getEndMs());
                }
            }
            if (start == Long.MAX_VALUE) {
                continue;
            }
            Task task = index.task(t);
            for (TimeWindow w : index.taskWindows(t)) {
                hard += checkWindow(w, start, end, List.of(task.getId()), violations);
            }
        }

        double penalty = 0;
        for (Violation v : violations) {
            if (!v.isHard()) {
                penalty += v.getPenalty();
            }
        }
        long makespan = schedule.getMakespanMs();
        long cost = weights.cost(makespan, penalty);
        HardSoftLongScore score = HardSoftLongScore.of(-hard, -cost);
        return new Evaluation(score, violations, makespan, penalty, cost);
    }

    /** @return 硬违反量（软违反返回 0，只记罚分） */
    private static long checkWindow(TimeWindow w, long start, long end, List<String> ids, List<Violation> out) {
        TimeWindowViolation v = w.checkViolation(start, end);
        if (v == null) {
            return 0;
        }
        String msg = ids.get(0) + " 违反时间窗 (early " + v.getEarlyMs() + " ms, late " + v.getLateMs() + " ms)";
        out.add(new Violation(ViolationType.TIME_WINDOW, ids, v.isHard(), msg, v.getPenalty()));
        return v.isHard() ? Math.max(1, v.totalViolationMs()) : 0;
    }

    /** 把评估出的违反记录附到排程上，返回新排程 */
    public Schedule annotate(Schedule schedule, Evaluation evaluation) {
        Schedule.Builder b = Schedule.builder();
        schedule.getAssignments().forEach(b::assign);
        b.violations(evaluation.getViolations());
        return b.build();
    }
}
