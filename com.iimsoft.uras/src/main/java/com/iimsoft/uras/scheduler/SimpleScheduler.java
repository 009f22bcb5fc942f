package com.iimsoft.uras.scheduler;

import com.iimsoft.uras.dispatching.DispatchingRules;
import com.iimsoft.uras.dispatching.RuleEngine;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.score.Evaluation;
import com.iimsoft.uras.score.ObjectiveWeights;
import com.iimsoft.uras.score.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * 事件驱动的贪心排程：
 * <ol>
 *   <li>可调度集合 = 所有前驱都已排程的活动</li>
 *   <li>对每个可调度活动，在允许资源上找最早可开始的位置（日历 + 容量 + 效率 + 硬时间窗）</li>
 *   <li>时钟推进到最早可开始时刻，在该时刻就绪的活动中由派工引擎选一个落位</li>
 *   <li>重复直到全部排完；某个活动在硬时间窗内永远拿不到资源时返回 INFEASIBLE</li>
 * </ol>
 * 资源选择：最早开始，其次最早结束，再其次按允许集合顺序。
 */
public class SimpleScheduler {

    public static final String ALGORITHM = "GREEDY";

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleScheduler.class);

    private final RuleEngine engine;
    private final ObjectiveWeights weights;

    public SimpleScheduler(RuleEngine engine, ObjectiveWeights weights) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public SimpleScheduler() {
        this(DispatchingRules.defaultEngine(), ObjectiveWeights.DEFAULT);
    }

    /** 某个活动的候选落位 */
    static final class Placement {
        final int activity;
        final int resource;
        final long readyMs;
        final long startMs;
        final long endMs;

        Placement(int activity, int resource, long readyMs, long startMs, long endMs) {
            this.activity = activity;
            this.resource = resource;
            this.readyMs = readyMs;
            this.startMs = startMs;
            this.endMs = endMs;
        }
    }

    public SolveResult solve(ProblemIndex index) {
        long t0 = System.currentTimeMillis();
        int n = index.activityCount();
        LOGGER.info("Greedy scheduling started: activities={}, resources={}", n, index.resourceCount());

        ResourceTimeline[] timelines = new ResourceTimeline[index.resourceCount()];
        for (int r = 0; r < timelines.length; r++) {
            timelines[r] = new ResourceTimeline(index.resource(r), index.capacity(r));
        }
        boolean[] placed = new boolean[n];
        long[] end = new long[n];
        int[] unplacedPreds = new int[n];
        for (int a = 0; a < n; a++) {
            unplacedPreds[a] = index.predecessors(a).length;
        }
        double avgProcessing = 0;
        for (int a = 0; a < n; a++) {
            avgProcessing += index.nominalMs(a);
        }
        avgProcessing = n == 0 ? 1.0 : Math.max(1.0, avgProcessing / n);

        Schedule.Builder builder = Schedule.builder();
        int decisions = 0;

        for (int step = 0; step < n; step++) {
            List<Placement> options = new ArrayList<>();
            for (int a = 0; a < n; a++) {
                if (placed[a] || unplacedPreds[a] > 0) {
                    continue;
                }
                Placement p = bestPlacement(index, timelines, end, a);
                if (p == null) {
                    String id = index.activity(a).getId();
                    LOGGER.info("Greedy scheduling infeasible: activity {} cannot obtain a resource", id);
                    return SolveResult.infeasible(ALGORITHM,
                            "activity " + id + " 无法在硬时间窗 / 日历内获得所需资源", stats(decisions, t0));
                }
                options.add(p);
            }

            long clock = Long.MAX_VALUE;
            for (Placement p : options) {
                clock = Math.min(clock, p.startMs);
            }
            Map<String, Placement> readyNow = new LinkedHashMap<>();
            List<Activity> ready = new ArrayList<>();
            for (Placement p : options) {
                if (p.startMs == clock) {
                    Activity act = index.activity(p.activity);
                    readyNow.put(act.getId(), p);
                    ready.add(act);
                }
            }

            Placement chosen;
            if (ready.size() == 1) {
                chosen = readyNow.get(ready.get(0).getId());
            } else {
                SchedulingContext ctx = context(index, timelines, placed, readyNow, clock, avgProcessing);
                Activity best = engine.selectBest(ready, ctx).orElseThrow();
                chosen = readyNow.get(best.getId());
                decisions++;
                LOGGER.debug("t={} dispatch {} among {}", clock, best.getId(), readyNow.keySet());
            }

            timelines[chosen.resource].occupy(chosen.startMs, chosen.endMs);
            placed[chosen.activity] = true;
            end[chosen.activity] = chosen.endMs;
            for (int s : index.successors(chosen.activity)) {
                unplacedPreds[s]--;
            }
            Activity act = index.activity(chosen.activity);
            builder.assign(new Assignment(act.getId(), act.getTaskId(), index.resource(chosen.resource).getId(),
                    chosen.startMs, chosen.endMs));
        }

        ScheduleEvaluator evaluator = new ScheduleEvaluator(index, weights);
        Schedule raw = builder.build();
        Evaluation eval = evaluator.evaluate(raw);
        Schedule schedule = evaluator.annotate(raw, eval);
        if (!eval.isFeasible()) {
            LOGGER.info("Greedy schedule violates hard constraints: {}", eval.hardViolations().size());
            return new SolveResult(ALGORITHM, SolveStatus.INFEASIBLE, null, eval, false,
                    eval.hardViolations().get(0).getMessage(), stats(decisions, t0));
        }
        LOGGER.info("Greedy scheduling finished: makespan={}, penalty={}, elapsed={}ms",
                schedule.getMakespanMs(), eval.getPenalty(), System.currentTimeMillis() - t0);
        return new SolveResult(ALGORITHM, SolveStatus.FEASIBLE, schedule, eval, false, null, stats(decisions, t0));
    }

    private static Map<String, Number> stats(int decisions, long t0) {
        Map<String, Number> m = new LinkedHashMap<>();
        m.put("dispatchDecisions", decisions);
        m.put("elapsedMs", System.currentTimeMillis() - t0);
        return m;
    }

    /**
     * 活动 a 在所有允许资源上的最佳落位，拿不到任何资源返回 null。
     */
    static Placement bestPlacement(ProblemIndex index, ResourceTimeline[] timelines, long[] end, int a) {
        long ready = readyTime(index, end, a);
        Placement best = null;
        for (int r : index.allowed(a)) {
            long dur = index.effectiveMs(a, r);
            long from = Math.max(ready, index.lowerStart(a, dur));
            long latest = index.upperStart(a, dur);
            if (from > latest) {
                continue;
            }
            OptionalLong s = timelines[r].earliestStart(from, dur, latest);
            if (s.isEmpty()) {
                continue;
            }
            long start = s.getAsLong();
            Placement p = new Placement(a, r, ready, start, start + dur);
            if (best == null || p.startMs < best.startMs || (p.startMs == best.startMs && p.endMs < best.endMs)) {
                best = p;
            }
        }
        return best;
    }

    /** 前驱全部结束（含最小间隔）的时刻 */
    static long readyTime(ProblemIndex index, long[] end, int a) {
        long ready = index.originMs();
        int[] preds = index.predecessors(a);
        long[] delays = index.predecessorDelays(a);
        for (int k = 0; k < preds.length; k++) {
            ready = Math.max(ready, end[preds[k]] + delays[k]);
        }
        return ready;
    }

    private static SchedulingContext context(ProblemIndex index, ResourceTimeline[] timelines, boolean[] placed,
                                             Map<String, Placement> readyNow, long clock, double avgProcessing) {
        SchedulingContext.Builder b = SchedulingContext.builder().currentTimeMs(clock).averageProcessingMs(avgProcessing);
        Map<Integer, long[]> remaining = new HashMap<>();
        for (int a = 0; a < index.activityCount(); a++) {
            if (!placed[a]) {
                long[] acc = remaining.computeIfAbsent(index.taskOf(a), k -> new long[2]);
                acc[0] += index.nominalMs(a);
                acc[1]++;
            }
        }
        for (Map.Entry<Integer, long[]> e : remaining.entrySet()) {
            String tid = index.task(e.getKey()).getId();
            b.remainingWork(tid, e.getValue()[0]).remainingOps(tid, (int) e.getValue()[1]);
        }
        for (int t = 0; t < index.taskCount(); t++) {
            b.task(index.task(t));
        }
        long horizon = 1;
        for (ResourceTimeline tl : timelines) {
            if (tl.isOccupied()) {
                horizon = Math.max(horizon, tl.getLastEndMs() - index.originMs());
            }
        }
        for (ResourceTimeline tl : timelines) {
            String rid = tl.getResource().getId();
            b.queuedWork(rid, tl.isOccupied() ? Math.max(0, tl.getLastEndMs() - clock) : 0);
            b.utilization(rid, (double) tl.getBusyMs() / horizon);
        }
        for (Placement p : readyNow.values()) {
            Activity act = index.activity(p.activity);
            b.processingMs(act.getId(), p.endMs - p.startMs);
            b.readyTime(act.getId(), p.readyMs);
            List<String> cands = new ArrayList<>();
            for (int r : index.allowed(p.activity)) {
                cands.add(index.resource(r).getId());
            }
            b.candidates(act.getId(), cands);
        }
        return b.build();
    }
}
