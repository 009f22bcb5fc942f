package com.iimsoft.uras.ga;

import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Schedule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 初始种群的三种构造方式 + 从已有排程反推染色体。序列一律是随机拓扑序。
 */
class ChromosomeFactory {

    private final ProblemIndex index;
    private final RandomSource random;

    ChromosomeFactory(ProblemIndex index, RandomSource random) {
        this.index = index;
        this.random = random;
    }

    /** 资源随机 */
    Chromosome random() {
        Chromosome c = new Chromosome(randomTopologicalOrder(), new int[index.activityCount()]);
        for (int a = 0; a < c.size(); a++) {
            c.resource[a] = random.randomInt(0, index.allowed(a).length);
        }
        return c;
    }

    /** 按序列顺序把活动分给累计负载（有效时长 / 容量）最小的资源 */
    Chromosome loadBalanced() {
        Chromosome c = new Chromosome(randomTopologicalOrder(), new int[index.activityCount()]);
        double[] load = new double[index.resourceCount()];
        for (int a : c.sequence) {
            int[] allowed = index.allowed(a);
            int best = 0;
            double bestLoad = Double.MAX_VALUE;
            for (int k = 0; k < allowed.length; k++) {
                int r = allowed[k];
                double l = load[r] + (double) index.effectiveMs(a, r) / index.capacity(r);
                if (l < bestLoad) {
                    best = k;
                    bestLoad = l;
                }
            }
            c.resource[a] = best;
            load[allowed[best]] = bestLoad;
        }
        return c;
    }

    /** 每个活动选有效时长最短的资源，并列时随机 */
    Chromosome shortestTime() {
        Chromosome c = new Chromosome(randomTopologicalOrder(), new int[index.activityCount()]);
        for (int a = 0; a < c.size(); a++) {
            int[] allowed = index.allowed(a);
            long min = Long.MAX_VALUE;
            List<Integer> ties = new ArrayList<>();
            for (int k = 0; k < allowed.length; k++) {
                long d = index.effectiveMs(a, allowed[k]);
                if (d < min) {
                    min = d;
                    ties.clear();
                }
                if (d == min) {
                    ties.add(k);
                }
            }
            c.resource[a] = ties.get(random.randomInt(0, ties.size()));
        }
        return c;
    }

    /** 序列按开始时间（同时开始按活动下标），资源取排程里实际使用的那个 */
    Chromosome fromSchedule(Schedule schedule) {
        int n = index.activityCount();
        Integer[] order = new Integer[n];
        long[] start = new long[n];
        int[] res = new int[n];
        for (Assignment as : schedule.getAssignments()) {
            int a = index.activityIndexOf(as.getActivityId());
            int r = index.resourceIndexOf(as.getResourceId());
            start[a] = as.getStartMs();
            int[] allowed = index.allowed(a);
            for (int k = 0; k < allowed.length; k++) {
                if (allowed[k] == r) {
                    res[a] = k;
                }
            }
        }
        for (int a = 0; a < n; a++) {
            order[a] = a;
        }
        Arrays.sort(order, Comparator.comparingLong((Integer a) -> start[a]).thenComparingInt(a -> a));
        int[] seq = new int[n];
        for (int i = 0; i < n; i++) {
            seq[i] = order[i];
        }
        return new Chromosome(seq, res);
    }

    /** Kahn 算法，每步在就绪集合里随机取一个 */
    int[] randomTopologicalOrder() {
        int n = index.activityCount();
        int[] indegree = new int[n];
        List<Integer> ready = new ArrayList<>();
        for (int a = 0; a < n; a++) {
            indegree[a] = index.predecessors(a).length;
            if (indegree[a] == 0) {
                ready.add(a);
            }
        }
        int[] order = new int[n];
        int i = 0;
        while (!ready.isEmpty()) {
            int pick = random.randomInt(0, ready.size());
            int a = ready.get(pick);
            ready.set(pick, ready.get(ready.size() - 1));
            ready.remove(ready.size() - 1);
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
