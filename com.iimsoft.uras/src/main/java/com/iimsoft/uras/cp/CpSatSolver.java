package com.iimsoft.uras.cp;

import com.iimsoft.uras.dispatching.DispatchingRules;
import com.iimsoft.uras.dispatching.RuleEngine;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.exception.SchedulingException;
import com.iimsoft.uras.exception.ErrorKind;
import com.iimsoft.uras.scheduler.SimpleScheduler;
import com.iimsoft.uras.scheduler.SolveResult;
import com.iimsoft.uras.scheduler.SolveStatus;
import com.iimsoft.uras.score.Evaluation;
import com.iimsoft.uras.score.ObjectiveWeights;
import com.iimsoft.uras.score.ResourceLoadTracker;
import com.iimsoft.uras.score.ScheduleEvaluator;
import com.iimsoft.uras.time.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 约束传播 + 回溯搜索：
 * <ol>
 *   <li>离散化时间轴，一元过滤得到每个活动的 (资源, 开始) 初始域</li>
 *   <li>弧一致性传播到不动点；任一域被清空直接返回 INFEASIBLE，不进入搜索</li>
 *   <li>显式栈深度优先：变量按最小剩余域（平局看派工顺序），取值按最早结束、再按资源顺序</li>
 *   <li>找到可行解后继续分支定界，直到穷尽（OPTIMAL）或预算耗尽（BUDGET_EXCEEDED）</li>
 * </ol>
 */
public class CpSatSolver {

    public static final String ALGORITHM = "CP_SAT";

    private static final Logger LOGGER = LoggerFactory.getLogger(CpSatSolver.class);

    private final CpConfig config;
    private final RuleEngine engine;

    public CpSatSolver(CpConfig config, RuleEngine engine) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public CpSatSolver(CpConfig config) {
        this(config, DispatchingRules.defaultEngine());
    }

    public SolveResult solve(ProblemIndex index) {
        long t0 = System.currentTimeMillis();
        long deadline = config.timeLimitMs <= 0 ? Long.MAX_VALUE : t0 + config.timeLimitMs;
        ObjectiveWeights weights = new ObjectiveWeights(config.makespanWeight, config.penaltyWeight);
        ScheduleEvaluator evaluator = new ScheduleEvaluator(index, weights);
        int n = index.activityCount();
        Map<String, Number> stats = new LinkedHashMap<>();
        LOGGER.info("CP solving started: activities={}, resources={}, timeLimitMs={}, nodeLimit={}",
                n, index.resourceCount(), config.timeLimitMs, config.nodeLimit);

        for (int a = 0; a < n; a++) {
            if (index.allowed(a).length == 0) {
                stats.put("nodes", 0);
                return SolveResult.infeasible(ALGORITHM,
                        "activity " + index.activity(a).getId() + " 没有任何可用资源", stats);
            }
        }

        Incumbent incumbent = new Incumbent();
        Schedule greedy = null;
        if (config.seedWithGreedy) {
            SolveResult seed = new SimpleScheduler(engine, weights).solve(index);
            if (seed.getStatus() == SolveStatus.FEASIBLE) {
                greedy = seed.getSchedule();
                incumbent.offer(greedy, seed.getEvaluation());
            }
        }

        long horizon = horizon(index, greedy);
        CpModel model = new CpModel(index, horizon, config.timeStepMs, config.maxTimeSlots);
        DomainStore root = model.initialDomains();
        long initialSize = root.totalSize();
        ArcConsistency ac = new ArcConsistency(model);
        int wiped = ac.propagate(root);
        stats.put("timeStepMs", model.step);
        stats.put("timeSlots", model.slots);
        stats.put("initialDomainSize", initialSize);
        stats.put("rootDomainSize", wiped == ArcConsistency.CONSISTENT ? root.totalSize() : 0);
        stats.put("rootRevisions", ac.getRevisions());
        LOGGER.debug("CP model: step={}ms, slots={}, exact={}, domain {} -> {}",
                model.step, model.slots, model.exact, initialSize, stats.get("rootDomainSize"));

        if (wiped != ArcConsistency.CONSISTENT) {
            stats.put("nodes", 0);
            stats.put("elapsedMs", System.currentTimeMillis() - t0);
            Incumbent.Best seeded = incumbent.get();
            if (seeded != null) {
                // 粗网格上放不下，但贪心解本身可行
                return new SolveResult(ALGORITHM, SolveStatus.FEASIBLE, evaluator.annotate(seeded.schedule, seeded.evaluation),
                        seeded.evaluation, false, "时间网格过粗，返回贪心初始解", stats);
            }
            String msg = "弧一致性清空了 activity " + index.activity(wiped).getId() + " 的取值域";
            if (!model.exact) {
                // 只说明加粗后的网格上放不下
                LOGGER.info("CP solving finished: no solution on coarse grid ({})", msg);
                return SolveResult.unresolved(ALGORITHM, coarseGridMessage(model, msg), stats);
            }
            LOGGER.info("CP solving finished: INFEASIBLE before search ({})", msg);
            return SolveResult.infeasible(ALGORITHM, msg, stats);
        }

        int[] rank = dispatchRank(index);
        AtomicLong nodes = new AtomicLong();
        AtomicBoolean stop = new AtomicBoolean(false);
        AtomicBoolean budgetHit = new AtomicBoolean(false);
        AtomicBoolean firstFound = new AtomicBoolean(false);
        SearchShared shared = new SearchShared(model, rank, evaluator, incumbent, deadline, nodes, stop, budgetHit, firstFound);

        int[] emptyK = new int[n];
        int[] emptySlot = new int[n];
        Arrays.fill(emptyK, -1);
        Arrays.fill(emptySlot, -1);
        Frame rootFrame = shared.frame(root, emptyK, emptySlot);

        if (rootFrame.isComplete()) {
            shared.acceptSolution(rootFrame);
        } else {
            int workers = Math.max(1, config.parallelWorkers);
            if (workers == 1 || rootFrame.valueK.length < 2) {
                new Worker(shared).run(rootFrame);
            } else {
                runParallel(shared, rootFrame, workers);
            }
        }

        stats.put("nodes", nodes.get());
        stats.put("elapsedMs", System.currentTimeMillis() - t0);
        Incumbent.Best best = incumbent.get();
        Schedule schedule = best == null ? null : evaluator.annotate(best.schedule, best.evaluation);
        Evaluation eval = best == null ? null : best.evaluation;

        SolveResult result;
        if (budgetHit.get()) {
            result = new SolveResult(ALGORITHM, SolveStatus.BUDGET_EXCEEDED, schedule, eval, false,
                    "搜索预算耗尽，返回目前最优解", stats);
            LOGGER.warn("CP search budget exhausted after {} nodes, best cost={}", nodes.get(),
                    best == null ? "none" : best.cost());
        } else if (firstFound.get()) {
            result = new SolveResult(ALGORITHM, SolveStatus.FEASIBLE, schedule, eval, false, "找到首个可行解即停止", stats);
        } else if (best == null && model.exact) {
            result = SolveResult.infeasible(ALGORITHM, "搜索穷尽，不存在满足全部硬约束的排程", stats);
        } else if (best == null) {
            result = SolveResult.unresolved(ALGORITHM, coarseGridMessage(model, "搜索穷尽"), stats);
        } else if (model.exact) {
            result = new SolveResult(ALGORITHM, SolveStatus.OPTIMAL, schedule, eval, true, null, stats);
        } else {
            result = new SolveResult(ALGORITHM, SolveStatus.FEASIBLE, schedule, eval, false,
                    "时间网格已加粗，结果未证明最优", stats);
        }
        LOGGER.info("CP solving finished: status={}, nodes={}, elapsed={}ms", result.getStatus(), nodes.get(),
                stats.get("elapsedMs"));
        return result;
    }

    private static String coarseGridMessage(CpModel model, String detail) {
        return detail + "；时间网格已加粗到步长 " + model.step + "ms，未证明无解，可调大 maxTimeSlots 或指定 timeStepMs 重试";
    }

    private void runParallel(SearchShared shared, Frame rootFrame, int workers) {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                Frame part = rootFrame.share(w, workers);
                if (part.valueK.length == 0) {
                    continue;
                }
                futures.add(pool.submit(() -> new Worker(shared).run(part)));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulingException(ErrorKind.BUDGET_EXCEEDED, "CP 并行搜索被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("CP 并行搜索失败", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 地平线：串行执行所有活动所需的时间（最长时长 + 最小间隔），从最晚的下界算起；
     * 受日历限制的资源按日历累计；不短于贪心解的 makespan。
     */
    static long horizon(ProblemIndex index, Schedule greedy) {
        long lbMax = index.originMs();
        long work = 0;
        for (int a = 0; a < index.activityCount(); a++) {
            long maxDur = 0;
            for (int r : index.allowed(a)) {
                maxDur = Math.max(maxDur, index.effectiveMs(a, r));
            }
            work += maxDur;
            for (long d : index.predecessorDelays(a)) {
                work += d;
            }
            lbMax = Math.max(lbMax, index.lowerStart(a, index.minEffectiveMs(a)));
            for (TimeWindow w : index.activityWindows(a)) {
                lbMax = Math.max(lbMax, softLowerBound(w));
            }
        }
        for (int t = 0; t < index.taskCount(); t++) {
            for (TimeWindow w : index.taskWindows(t)) {
                lbMax = Math.max(lbMax, softLowerBound(w));
            }
        }
        long h = lbMax + work;
        for (int r = 0; r < index.resourceCount(); r++) {
            if (!index.resource(r).getCalendar().isAlways()) {
                h = Math.max(h, index.resource(r).getCalendar().endAfterWorking(lbMax, work));
            }
        }
        if (greedy != null) {
            h = Math.max(h, greedy.getMakespanMs());
        }
        return h;
    }

    private static long softLowerBound(TimeWindow w) {
        long lb = Long.MIN_VALUE;
        if (w.getEarliestStartMs() != null) {
            lb = Math.max(lb, w.getEarliestStartMs());
        }
        if (w.getEarliestEndMs() != null) {
            lb = Math.max(lb, w.getEarliestEndMs());
        }
        return lb;
    }

    /** 在原点时刻用派工引擎给所有活动排个静态名次，用于 MRV 平局 */
    private int[] dispatchRank(ProblemIndex index) {
        int n = index.activityCount();
        SchedulingContext.Builder b = SchedulingContext.builder().currentTimeMs(index.originMs());
        long[] head = index.headStarts();
        double avg = 0;
        for (int t = 0; t < index.taskCount(); t++) {
            b.task(index.task(t));
            long work = 0;
            for (int a : index.activitiesOfTask(t)) {
                work += index.nominalMs(a);
            }
            b.remainingWork(index.task(t).getId(), work).remainingOps(index.task(t).getId(), index.activitiesOfTask(t).length);
        }
        List<Activity> all = new ArrayList<>(n);
        for (int a = 0; a < n; a++) {
            Activity act = index.activity(a);
            b.processingMs(act.getId(), index.minEffectiveMs(a)).readyTime(act.getId(), head[a]);
            List<String> cands = new ArrayList<>();
            for (int r : index.allowed(a)) {
                cands.add(index.resource(r).getId());
            }
            b.candidates(act.getId(), cands);
            avg += index.minEffectiveMs(a);
            all.add(act);
        }
        if (n > 0) {
            b.averageProcessingMs(Math.max(1.0, avg / n));
        }
        List<Activity> sorted = engine.sort(all, b.build());
        int[] rank = new int[n];
        for (int i = 0; i < sorted.size(); i++) {
            rank[index.activityIndexOf(sorted.get(i).getId())] = i;
        }
        return rank;
    }

    // ============ 搜索 ============

    /** 搜索栈上的一帧：当前域 + 已赋值变量 + 正在分支的变量及其有序取值 */
    static final class Frame {
        final DomainStore domains;
        final int[] assignedK;
        final int[] assignedSlot;
        final int var;
        final int[] valueK;
        final int[] valueSlot;
        int next;

        Frame(DomainStore domains, int[] assignedK, int[] assignedSlot, int var, int[] valueK, int[] valueSlot) {
            this.domains = domains;
            this.assignedK = assignedK;
            this.assignedSlot = assignedSlot;
            this.var = var;
            this.valueK = valueK;
            this.valueSlot = valueSlot;
        }

        boolean isComplete() {
            return var < 0;
        }

        /** 第 w 个线程负责的取值子集（轮转划分，保持原有顺序） */
        Frame share(int w, int workers) {
            int count = 0;
            for (int i = w; i < valueK.length; i += workers) {
                count++;
            }
            int[] ks = new int[count];
            int[] ss = new int[count];
            int j = 0;
            for (int i = w; i < valueK.length; i += workers) {
                ks[j] = valueK[i];
                ss[j] = valueSlot[i];
                j++;
            }
            return new Frame(domains, assignedK, assignedSlot, var, ks, ss);
        }
    }

    /** 所有 worker 共享的只读模型和原子状态 */
    final class SearchShared {
        final CpModel model;
        final int[] rank;
        final ScheduleEvaluator evaluator;
        final Incumbent incumbent;
        final long deadline;
        final AtomicLong nodes;
        final AtomicBoolean stop;
        final AtomicBoolean budgetHit;
        final AtomicBoolean firstFound;

        SearchShared(CpModel model, int[] rank, ScheduleEvaluator evaluator, Incumbent incumbent, long deadline,
                     AtomicLong nodes, AtomicBoolean stop, AtomicBoolean budgetHit, AtomicBoolean firstFound) {
            this.model = model;
            this.rank = rank;
            this.evaluator = evaluator;
            this.incumbent = incumbent;
            this.deadline = deadline;
            this.nodes = nodes;
            this.stop = stop;
            this.budgetHit = budgetHit;
            this.firstFound = firstFound;
        }

        /** 选下一个变量（MRV，平局看派工名次再看下标）并排好取值顺序 */
        Frame frame(DomainStore d, int[] assignedK, int[] assignedSlot) {
            int var = -1;
            int bestSize = Integer.MAX_VALUE;
            for (int a = 0; a < assignedSlot.length; a++) {
                if (assignedSlot[a] >= 0) {
                    continue;
                }
                int size = d.size(a);
                if (size < bestSize || (size == bestSize && rank[a] < rank[var])) {
                    var = a;
                    bestSize = size;
                }
            }
            if (var < 0) {
                return new Frame(d, assignedK, assignedSlot, -1, new int[0], new int[0]);
            }
            int size = bestSize;
            long[] endTime = new long[size];
            int[] ks = new int[size];
            int[] ss = new int[size];
            int i = 0;
            for (int k = 0; k < d.resourceOptions(var); k++) {
                for (int s = d.slots(var, k).nextSetBit(0); s >= 0; s = d.slots(var, k).nextSetBit(s + 1)) {
                    ks[i] = k;
                    ss[i] = s;
                    endTime[i] = model.time(s) + model.duration[var][k];
                    i++;
                }
            }
            Integer[] order = new Integer[size];
            for (int j = 0; j < size; j++) {
                order[j] = j;
            }
            Arrays.sort(order, (x, y) -> {
                int c = Long.compare(endTime[x], endTime[y]);
                if (c != 0) {
                    return c;
                }
                c = Integer.compare(ks[x], ks[y]);
                return c != 0 ? c : Integer.compare(ss[x], ss[y]);
            });
            int[] vk = new int[size];
            int[] vs = new int[size];
            for (int j = 0; j < size; j++) {
                vk[j] = ks[order[j]];
                vs[j] = ss[order[j]];
            }
            return new Frame(d, assignedK, assignedSlot, var, vk, vs);
        }

        /** 下界：makespan 不小于各活动最小结束时间的最大值 */
        long lowerBound(DomainStore d, ArcConsistency ac) {
            long maxMinEnd = 0;
            for (int a = 0; a < d.activityCount(); a++) {
                maxMinEnd = Math.max(maxMinEnd, ac.minEnd(d, a));
            }
            return evaluator.getWeights().cost(maxMinEnd, 0);
        }

        boolean budgetExceeded() {
            return (config.nodeLimit > 0 && nodes.get() >= config.nodeLimit)
                    || System.currentTimeMillis() > deadline;
        }

        void acceptSolution(Frame complete) {
            Schedule.Builder b = Schedule.builder();
            ProblemIndex index = model.index;
            for (int a = 0; a < complete.assignedSlot.length; a++) {
                int k = complete.assignedK[a];
                long start = model.time(complete.assignedSlot[a]);
                Activity act = index.activity(a);
                b.assign(new Assignment(act.getId(), act.getTaskId(), index.resource(model.resourceOf(a, k)).getId(),
                        start, start + model.duration[a][k]));
            }
            Schedule schedule = b.build();
            Evaluation eval = evaluator.evaluate(schedule);
            if (!eval.isFeasible()) {
                return;
            }
            if (incumbent.offer(schedule, eval)) {
                LOGGER.debug("CP new incumbent: cost={}, makespan={}, nodes={}", eval.getCost(),
                        schedule.getMakespanMs(), nodes.get());
            }
            if (config.stopAfterFirst) {
                firstFound.set(true);
                stop.set(true);
            }
        }
    }

    /** 单线程深度优先，显式栈 */
    final class Worker {
        private final SearchShared shared;
        private final ArcConsistency ac;

        Worker(SearchShared shared) {
            this.shared = shared;
            this.ac = new ArcConsistency(shared.model);
        }

        void run(Frame start) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                if (shared.stop.get()) {
                    return;
                }
                if (shared.budgetExceeded()) {
                    shared.budgetHit.set(true);
                    shared.stop.set(true);
                    return;
                }
                Frame f = stack.peek();
                if (f.next >= f.valueK.length) {
                    stack.pop();
                    continue;
                }
                int i = f.next++;
                shared.nodes.incrementAndGet();
                Frame child = branch(f, f.valueK[i], f.valueSlot[i]);
                if (child == null) {
                    continue;
                }
                if (child.isComplete()) {
                    shared.acceptSolution(child);
                    continue;
                }
                if (shared.incumbent.get() != null
                        && shared.lowerBound(child.domains, ac) >= shared.incumbent.cost()) {
                    continue;
                }
                stack.push(child);
            }
        }

        private Frame branch(Frame parent, int k, int slot) {
            CpModel model = shared.model;
            int a = parent.var;
            int r = model.resourceOf(a, k);
            long start = model.time(slot);
            long end = start + model.duration[a][k];
            if (!fitsCapacity(parent, a, r, start, end)) {
                return null;
            }
            DomainStore d = parent.domains.copy();
            d.fix(a, k, slot);
            if (ac.propagate(d, a) != ArcConsistency.CONSISTENT) {
                return null;
            }
            int[] ks = parent.assignedK.clone();
            int[] ss = parent.assignedSlot.clone();
            ks[a] = k;
            ss[a] = slot;
            return shared.frame(d, ks, ss);
        }

        /** 前向检查：与已赋值且同资源的活动一起不超容量 */
        private boolean fitsCapacity(Frame parent, int a, int r, long start, long end) {
            CpModel model = shared.model;
            ResourceLoadTracker tracker = new ResourceLoadTracker(model.index.capacity(r));
            for (int b = 0; b < parent.assignedSlot.length; b++) {
                if (b == a || parent.assignedSlot[b] < 0) {
                    continue;
                }
                int kb = parent.assignedK[b];
                if (model.resourceOf(b, kb) != r) {
                    continue;
                }
                long sb = model.time(parent.assignedSlot[b]);
                tracker.add(sb, sb + model.duration[b][kb]);
            }
            return tracker.fits(start, end);
        }
    }
}
