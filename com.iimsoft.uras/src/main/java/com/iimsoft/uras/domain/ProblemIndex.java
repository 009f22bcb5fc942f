package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InconsistentScheduleException;
import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.time.TimeWindow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * 问题的整数句柄视图：活动 / 任务 / 资源各自映射为稳定下标，所有求解器共享这一份只读表。
 * <p>
 * 构造时完成引用校验（重复 id、未知资源、未知前驱、先后环），失败抛 {@link InvalidSpecException}。
 * 活动下标顺序 = 任务输入顺序 + 任务内 sequence 顺序。
 */
public final class ProblemIndex {

    private final SchedulingProblem problem;

    private final Activity[] activities;
    private final Task[] tasks;
    private final Resource[] resources;
    private final int[] taskOf;
    private final int[][] activitiesOfTask;
    private final long[] nominalMs;

    private final int[][] allowed;
    private final int[] capacity;

    private final int[][] predIdx;
    private final long[][] predDelay;
    private final int[][] succIdx;
    private final long[][] succDelay;
    private final int[] topoOrder;

    private final List<List<TimeWindow>> activityWindows;
    private final List<List<TimeWindow>> taskWindows;
    /** 只用于剪枝的硬边界：活动自身的硬窗口 + 任务硬窗口的 earliestStart / latestEnd */
    private final List<List<TimeWindow>> hardBounds;

    private final Map<String, Integer> activityIndex = new HashMap<>();
    private final Map<String, Integer> taskIndex = new HashMap<>();
    private final Map<String, Integer> resourceIndex = new HashMap<>();

    public ProblemIndex(SchedulingProblem problem) {
        this.problem = Objects.requireNonNull(problem, "problem");

        this.tasks = problem.getTasks().toArray(new Task[0]);
        this.resources = problem.getResources().toArray(new Resource[0]);
        for (int r = 0; r < resources.length; r++) {
            if (resourceIndex.put(resources[r].getId(), r) != null) {
                throw new InvalidSpecException("资源 id 重复: " + resources[r].getId());
            }
        }

        List<Activity> acts = new ArrayList<>();
        List<Integer> owner = new ArrayList<>();
        this.activitiesOfTask = new int[tasks.length][];
        for (int t = 0; t < tasks.length; t++) {
            Task task = tasks[t];
            if (taskIndex.put(task.getId(), t) != null) {
                throw new InvalidSpecException("任务 id 重复: " + task.getId());
            }
            Set<Integer> seqs = new HashSet<>();
            int[] own = new int[task.getActivities().size()];
            int k = 0;
            for (Activity a : task.getActivities()) {
                if (!task.getId().equals(a.getTaskId())) {
                    throw new InvalidSpecException("activity " + a.getId() + " 的 taskId=" + a.getTaskId()
                            + " 与所属任务 " + task.getId() + " 不一致");
                }
                if (!seqs.add(a.getSequence())) {
                    throw new InvalidSpecException("任务 " + task.getId() + " 内 sequence 重复: " + a.getSequence());
                }
                if (activityIndex.put(a.getId(), acts.size()) != null) {
                    throw new InvalidSpecException("activity id 重复: " + a.getId());
                }
                own[k++] = acts.size();
                acts.add(a);
                owner.add(t);
            }
            activitiesOfTask[t] = own;
        }
        this.activities = acts.toArray(new Activity[0]);
        int n = activities.length;
        this.taskOf = owner.stream().mapToInt(Integer::intValue).toArray();

        this.nominalMs = new long[n];
        for (int a = 0; a < n; a++) {
            nominalMs[a] = activities[a].getDuration().nominalMs(problem.getDurationConfidence());
        }

        this.allowed = new int[n][];
        for (int a = 0; a < n; a++) {
            allowed[a] = resolveAllowed(activities[a]);
        }

        this.capacity = new int[resources.length];
        for (int r = 0; r < resources.length; r++) {
            capacity[r] = resources[r].getCapacity();
        }

        // 先后关系
        List<List<long[]>> preds = new ArrayList<>(n);
        for (int a = 0; a < n; a++) {
            preds.add(new ArrayList<>());
        }
        for (int t = 0; t < tasks.length; t++) {
            if (!tasks[t].isNoPrecedence()) {
                int[] own = activitiesOfTask[t];
                for (int k = 1; k < own.length; k++) {
                    preds.get(own[k]).add(new long[]{own[k - 1], 0});
                }
            }
        }
        for (int a = 0; a < n; a++) {
            for (String p : activities[a].getPredecessors()) {
                preds.get(a).add(new long[]{requireActivity(p, "activity " + activities[a].getId() + " 的前驱"), 0});
            }
        }

        this.activityWindows = emptyLists(n);
        this.taskWindows = emptyLists(tasks.length);
        this.hardBounds = emptyLists(n);

        for (Constraint c : problem.getConstraints()) {
            if (c instanceof PrecedenceConstraint) {
                PrecedenceConstraint pc = (PrecedenceConstraint) c;
                int before = requireActivity(pc.getBeforeActivityId(), "precedence.before");
                int after = requireActivity(pc.getAfterActivityId(), "precedence.after");
                preds.get(after).add(new long[]{before, pc.getMinDelayMs()});
            } else if (c instanceof CapacityConstraint) {
                CapacityConstraint cc = (CapacityConstraint) c;
                Integer r = resourceIndex.get(cc.getResourceId());
                if (r == null) {
                    throw new InvalidSpecException("capacity 约束引用了未知资源: " + cc.getResourceId());
                }
                capacity[r] = Math.min(capacity[r], cc.getMaxConcurrent());
            } else if (c instanceof TimeWindowConstraint) {
                TimeWindowConstraint tw = (TimeWindowConstraint) c;
                TimeWindow w = tw.getWindow();
                if (tw.getTarget() == ConstraintTarget.ACTIVITY) {
                    int a = requireActivity(tw.getTargetId(), "time window");
                    activityWindows.get(a).add(w);
                    if (w.isHard()) {
                        hardBounds.get(a).add(w);
                    }
                } else {
                    Integer t = taskIndex.get(tw.getTargetId());
                    if (t == null) {
                        throw new InvalidSpecException("time window 约束引用了未知任务: " + tw.getTargetId());
                    }
                    taskWindows.get(t).add(w);
                    if (w.isHard() && (w.getEarliestStartMs() != null || w.getLatestEndMs() != null)) {
                        TimeWindow bound = new TimeWindow(w.getEarliestStartMs(), null, null, w.getLatestEndMs(),
                                w.getType(), 0.0);
                        for (int a : activitiesOfTask[t]) {
                            hardBounds.get(a).add(bound);
                        }
                    }
                }
            }
        }

        this.predIdx = new int[n][];
        this.predDelay = new long[n][];
        int[] succCount = new int[n];
        for (int a = 0; a < n; a++) {
            // 同一对活动的多条边只保留最大 delay
            Map<Integer, Long> merged = new HashMap<>();
            List<Integer> order = new ArrayList<>();
            for (long[] e : preds.get(a)) {
                int p = (int) e[0];
                if (p == a) {
                    throw new InvalidSpecException("activity " + activities[a].getId() + " 不能以自身为前驱");
                }
                if (!merged.containsKey(p)) {
                    order.add(p);
                }
                merged.merge(p, e[1], Math::max);
            }
            predIdx[a] = order.stream().mapToInt(Integer::intValue).toArray();
            predDelay[a] = order.stream().mapToLong(merged::get).toArray();
            for (int p : predIdx[a]) {
                succCount[p]++;
            }
        }
        this.succIdx = new int[n][];
        this.succDelay = new long[n][];
        for (int a = 0; a < n; a++) {
            succIdx[a] = new int[succCount[a]];
            succDelay[a] = new long[succCount[a]];
        }
        int[] fill = new int[n];
        for (int a = 0; a < n; a++) {
            for (int k = 0; k < predIdx[a].length; k++) {
                int p = predIdx[a][k];
                succIdx[p][fill[p]] = a;
                succDelay[p][fill[p]] = predDelay[a][k];
                fill[p]++;
            }
        }

        this.topoOrder = computeTopologicalOrder();
    }

    private static List<List<TimeWindow>> emptyLists(int n) {
        List<List<TimeWindow>> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new ArrayList<>());
        }
        return out;
    }

    private int requireActivity(String id, String what) {
        Integer a = activityIndex.get(id);
        if (a == null) {
            throw new InvalidSpecException(what + " 引用了未知 activity: " + id);
        }
        return a;
    }

    private int[] resolveAllowed(Activity act) {
        if (act.getResourceGroups().isEmpty()) {
            throw new InvalidSpecException("activity " + act.getId() + " 没有任何资源需求");
        }
        Set<Integer> out = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> group : act.getResourceGroups().entrySet()) {
            if (group.getValue().isEmpty()) {
                for (int r = 0; r < resources.length; r++) {
                    if (resources[r].getCategory().equals(group.getKey())) {
                        out.add(r);
                    }
                }
            } else {
                for (String rid : group.getValue()) {
                    Integer r = resourceIndex.get(rid);
                    if (r == null) {
                        throw new InvalidSpecException("activity " + act.getId() + " 引用了未知资源: " + rid);
                    }
                    out.add(r);
                }
            }
        }
        return out.stream().mapToInt(Integer::intValue).toArray();
    }

    /** Kahn 拓扑序，同层按下标升序；存在环则抛 InvalidSpec */
    private int[] computeTopologicalOrder() {
        int n = activities.length;
        int[] indeg = new int[n];
        for (int a = 0; a < n; a++) {
            indeg[a] = predIdx[a].length;
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int a = 0; a < n; a++) {
            if (indeg[a] == 0) {
                ready.add(a);
            }
        }
        int[] order = new int[n];
        int k = 0;
        while (!ready.isEmpty()) {
            int a = ready.poll();
            order[k++] = a;
            for (int s : succIdx[a]) {
                if (--indeg[s] == 0) {
                    ready.add(s);
                }
            }
        }
        if (k != n) {
            List<String> stuck = new ArrayList<>();
            for (int a = 0; a < n; a++) {
                if (indeg[a] > 0) {
                    stuck.add(activities[a].getId());
                }
            }
            throw new InvalidSpecException("先后关系存在环，涉及: " + stuck);
        }
        return order;
    }

    // ============ 查询 ============

    public SchedulingProblem getProblem() {
        return problem;
    }

    public int activityCount() {
        return activities.length;
    }

    public int taskCount() {
        return tasks.length;
    }

    public int resourceCount() {
        return resources.length;
    }

    public Activity activity(int a) {
        return activities[a];
    }

    public Task task(int t) {
        return tasks[t];
    }

    public Resource resource(int r) {
        return resources[r];
    }

    public int taskOf(int a) {
        return taskOf[a];
    }

    public int[] activitiesOfTask(int t) {
        return activitiesOfTask[t];
    }

    public long nominalMs(int a) {
        return nominalMs[a];
    }

    public long effectiveMs(int a, int r) {
        return resources[r].effectiveDurationMs(nominalMs[a]);
    }

    /** 在允许资源上的最短有效时长 */
    public long minEffectiveMs(int a) {
        long min = Long.MAX_VALUE;
        for (int r : allowed[a]) {
            min = Math.min(min, effectiveMs(a, r));
        }
        return min == Long.MAX_VALUE ? nominalMs[a] : min;
    }

    public int[] allowed(int a) {
        return allowed[a];
    }

    public boolean isAllowed(int a, int r) {
        for (int x : allowed[a]) {
            if (x == r) {
                return true;
            }
        }
        return false;
    }

    public int capacity(int r) {
        return capacity[r];
    }

    public int[] predecessors(int a) {
        return predIdx[a];
    }

    public long[] predecessorDelays(int a) {
        return predDelay[a];
    }

    public int[] successors(int a) {
        return succIdx[a];
    }

    public long[] successorDelays(int a) {
        return succDelay[a];
    }

    /** 满足所有先后关系的拓扑序（副本） */
    public int[] topologicalOrder() {
        return Arrays.copyOf(topoOrder, topoOrder.length);
    }

    public List<TimeWindow> activityWindows(int a) {
        return activityWindows.get(a);
    }

    public List<TimeWindow> taskWindows(int t) {
        return taskWindows.get(t);
    }

    public long originMs() {
        return problem.getOriginMs();
    }

    /** 活动在时长 durationMs 下的最早合法开始：原点、任务释放时间、硬窗口下界 */
    public long lowerStart(int a, long durationMs) {
        long lb = problem.getOriginMs();
        Long release = tasks[taskOf[a]].getReleaseMs();
        if (release != null) {
            lb = Math.max(lb, release);
        }
        for (TimeWindow w : hardBounds.get(a)) {
            lb = Math.max(lb, w.lowerStartBound(durationMs));
        }
        return lb;
    }

    /** 活动在时长 durationMs 下的最晚合法开始（硬窗口），无上界为 Long.MAX_VALUE */
    public long upperStart(int a, long durationMs) {
        long ub = Long.MAX_VALUE;
        for (TimeWindow w : hardBounds.get(a)) {
            ub = Math.min(ub, w.upperStartBound(durationMs));
        }
        return ub;
    }

    public int activityIndexOf(String activityId) {
        Integer a = activityIndex.get(activityId);
        if (a == null) {
            throw new InconsistentScheduleException("排程引用了未知 activity: " + activityId);
        }
        return a;
    }

    public int resourceIndexOf(String resourceId) {
        Integer r = resourceIndex.get(resourceId);
        if (r == null) {
            throw new InconsistentScheduleException("排程引用了未知资源: " + resourceId);
        }
        return r;
    }

    public int taskIndexOf(String taskId) {
        Integer t = taskIndex.get(taskId);
        if (t == null) {
            throw new InconsistentScheduleException("排程引用了未知任务: " + taskId);
        }
        return t;
    }

    /** 各活动的前驱链下界：不早于此时刻开始 */
    public long[] headStarts() {
        int n = activities.length;
        long[] head = new long[n];
        for (int a : topoOrder) {
            long lb = lowerStart(a, minEffectiveMs(a));
            for (int i = 0; i < predIdx[a].length; i++) {
                int p = predIdx[a][i];
                lb = Math.max(lb, head[p] + minEffectiveMs(p) + predDelay[a][i]);
            }
            head[a] = lb;
        }
        return head;
    }
}
