package com.iimsoft.uras.ga;

import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.scheduler.ResourceTimeline;
import com.iimsoft.uras.score.Evaluation;
import com.iimsoft.uras.score.ScheduleEvaluator;

import java.util.OptionalLong;
import java.util.PriorityQueue;

/**
 * 染色体 → 排程。纯函数：每次解码新建资源时间线，不修改染色体，可并行调用。
 * <ol>
 *   <li>修复序列：按序列位置做拓扑排序，保证每个活动排在所有前驱之后</li>
 *   <li>从左到右逐个落位：前驱结束 + 最小间隔、释放时间、硬时间窗下界、日历、容量、效率</li>
 *   <li>基因指定的资源在硬时间窗内放不下时，改用能放下的其他允许资源</li>
 *   <li>都放不下时仍然落位（忽略硬上界），由评估器记为硬违规，不会被当作可行解</li>
 * </ol>
 */
public class ScheduleDecoder {

    private final ProblemIndex index;
    private final ScheduleEvaluator evaluator;

    public ScheduleDecoder(ProblemIndex index, ScheduleEvaluator evaluator) {
        this.index = index;
        this.evaluator = evaluator;
    }

    public Schedule decode(Chromosome c) {
        int n = index.activityCount();
        ResourceTimeline[] timelines = new ResourceTimeline[index.resourceCount()];
        for (int r = 0; r < timelines.length; r++) {
            timelines[r] = new ResourceTimeline(index.resource(r), index.capacity(r));
        }
        long[] end = new long[n];
        Schedule.Builder builder = Schedule.builder();
        for (int a : repairedOrder(c.sequence)) {
            long ready = readyTime(end, a);
            int[] allowed = index.allowed(a);
            int preferred = allowed[Math.floorMod(c.resource[a], allowed.length)];

            int chosen = -1;
            long start = 0;
            OptionalLong s = place(timelines, a, preferred, ready, true);
            if (s.isPresent()) {
                chosen = preferred;
                start = s.getAsLong();
            } else {
                for (int r : allowed) {
                    if (r == preferred) {
                        continue;
                    }
                    OptionalLong alt = place(timelines, a, r, ready, true);
                    if (alt.isPresent() && (chosen < 0 || alt.getAsLong() < start)) {
                        chosen = r;
                        start = alt.getAsLong();
                    }
                }
            }
            if (chosen < 0) {
                chosen = preferred;
                OptionalLong late = place(timelines, a, preferred, ready, false);
                start = late.isPresent() ? late.getAsLong()
                        : Math.max(ready, index.lowerStart(a, index.effectiveMs(a, preferred)));
            }
            long dur = index.effectiveMs(a, chosen);
            timelines[chosen].occupy(start, start + dur);
            end[a] = start + dur;
            Activity act = index.activity(a);
            builder.assign(new Assignment(act.getId(), act.getTaskId(), index.resource(chosen).getId(), start, start + dur));
        }
        return builder.build();
    }

    /** 解码并评估，结果写回染色体 */
    public Evaluation evaluate(Chromosome c) {
        Evaluation e = evaluator.evaluate(decode(c));
        c.evaluation = e;
        return e;
    }

    public ScheduleEvaluator getEvaluator() {
        return evaluator;
    }

    private OptionalLong place(ResourceTimeline[] timelines, int a, int r, long ready, boolean respectUpperBound) {
        long dur = index.effectiveMs(a, r);
        long from = Math.max(ready, index.lowerStart(a, dur));
        long latest = respectUpperBound ? index.upperStart(a, dur) : Long.MAX_VALUE;
        if (from > latest) {
            return OptionalLong.empty();
        }
        return timelines[r].earliestStart(from, dur, latest);
    }

    private long readyTime(long[] end, int a) {
        long ready = index.originMs();
        int[] preds = index.predecessors(a);
        long[] delays = index.predecessorDelays(a);
        for (int k = 0; k < preds.length; k++) {
            ready = Math.max(ready, end[preds[k]] + delays[k]);
        }
        return ready;
    }

    /**
     * 就绪活动中总是取序列里最靠前的，序列本身是拓扑序时结果不变。
     */
    int[] repairedOrder(int[] sequence) {
        int n = sequence.length;
        int[] position = new int[n];
        for (int i = 0; i < n; i++) {
            position[sequence[i]] = i;
        }
        int[] indegree = new int[n];
        for (int a = 0; a < n; a++) {
            indegree[a] = index.predecessors(a).length;
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>((x, y) -> Integer.compare(position[x], position[y]));
        for (int a = 0; a < n; a++) {
            if (indegree[a] == 0) {
                ready.add(a);
            }
        }
        int[] order = new int[n];
        int i = 0;
        while (!ready.isEmpty()) {
            int a = ready.poll();
            order[i++] = a;
            for (int s : index.successors(a)) {
                if (--indegree[s] == 0) {
                    ready.add(s);
                }
            }
        }
        return order;
    }
}
