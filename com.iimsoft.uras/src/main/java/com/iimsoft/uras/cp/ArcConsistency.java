package com.iimsoft.uras.cp;

import java.util.ArrayDeque;

/**
 * AC-3 风格的传播器，作用于两类二元约束：
 * <ul>
 *   <li>先后：pred 结束 + delay <= succ 开始。只依赖对方域的最小结束 / 最大开始，修剪是精确的。</li>
 *   <li>单容量资源上的互斥：对方已被限制在该资源上时，删去与其必占区间重叠的开始时刻。</li>
 * </ul>
 * 容量 > 1 的资源没有二元支撑意义上的剪枝，交给搜索阶段的前向检查。
 */
final class ArcConsistency {

    static final int CONSISTENT = -1;

    private final CpModel model;
    private long revisions;

    ArcConsistency(CpModel model) {
        this.model = model;
    }

    long getRevisions() {
        return revisions;
    }

    /**
     * 传播到不动点。
     *
     * @param changed 已变化的活动；null 表示全部入队
     * @return CONSISTENT，或第一个被清空域的活动下标
     */
    int propagate(DomainStore d, int... changed) {
        int n = d.activityCount();
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        boolean[] queued = new boolean[n];
        if (changed == null || changed.length == 0) {
            for (int a = 0; a < n; a++) {
                if (d.isEmpty(a)) {
                    return a;
                }
                queue.add(a);
                queued[a] = true;
            }
        } else {
            for (int a : changed) {
                if (!queued[a]) {
                    queue.add(a);
                    queued[a] = true;
                }
            }
        }

        while (!queue.isEmpty()) {
            int y = queue.poll();
            queued[y] = false;
            if (d.isEmpty(y)) {
                return y;
            }

            int[] preds = model.index.predecessors(y);
            long[] predDelays = model.index.predecessorDelays(y);
            for (int i = 0; i < preds.length; i++) {
                int x = preds[i];
                if (reviseAsPredecessor(d, x, y, predDelays[i])) {
                    if (d.isEmpty(x)) {
                        return x;
                    }
                    if (!queued[x]) {
                        queue.add(x);
                        queued[x] = true;
                    }
                }
            }
            int[] succs = model.index.successors(y);
            long[] succDelays = model.index.successorDelays(y);
            for (int i = 0; i < succs.length; i++) {
                int x = succs[i];
                if (reviseAsSuccessor(d, x, y, succDelays[i])) {
                    if (d.isEmpty(x)) {
                        return x;
                    }
                    if (!queued[x]) {
                        queue.add(x);
                        queued[x] = true;
                    }
                }
            }
            for (int x : model.unaryNeighbors[y]) {
                if (reviseUnary(d, x, y)) {
                    if (d.isEmpty(x)) {
                        return x;
                    }
                    if (!queued[x]) {
                        queue.add(x);
                        queued[x] = true;
                    }
                }
            }
        }
        return CONSISTENT;
    }

    /** x 是 y 的前驱：x 的结束 + delay 不能晚于 y 的最大开始 */
    private boolean reviseAsPredecessor(DomainStore d, int x, int y, long delay) {
        revisions++;
        long maxStartY = maxStart(d, y);
        boolean changed = false;
        for (int k = 0; k < d.resourceOptions(x); k++) {
            long latest = maxStartY - model.duration[x][k] - delay;
            changed |= d.clearRange(x, k, model.floorSlot(latest) + 1, model.slots - 1L, model.slots);
        }
        return changed;
    }

    /** x 是 y 的后继：x 的开始不能早于 y 的最小结束 + delay */
    private boolean reviseAsSuccessor(DomainStore d, int x, int y, long delay) {
        revisions++;
        long earliest = minEnd(d, y) + delay;
        long cut = model.ceilSlot(earliest) - 1;
        boolean changed = false;
        for (int k = 0; k < d.resourceOptions(x); k++) {
            changed |= d.clearRange(x, k, 0, cut, model.slots);
        }
        return changed;
    }

    /**
     * y 的全部取值都在单容量资源 r 上时，x 在 r 上不能与 y 的必占区间
     * [maxStart(y), minStart(y) + dur(y)) 重叠。
     */
    private boolean reviseUnary(DomainStore d, int x, int y) {
        int ky = d.onlyOption(y);
        if (ky < 0) {
            return false;
        }
        int r = model.resourceOf(y, ky);
        if (model.index.capacity(r) != 1) {
            return false;
        }
        int kx = -1;
        int[] allowedX = model.index.allowed(x);
        for (int k = 0; k < allowedX.length; k++) {
            if (allowedX[k] == r) {
                kx = k;
                break;
            }
        }
        if (kx < 0) {
            return false;
        }
        long dx = model.duration[x][kx];
        long dy = model.duration[y][ky];
        if (dx == 0 || dy == 0) {
            return false;
        }
        revisions++;
        long lo = model.time(d.maxSlot(y, ky)) - dx;
        long hi = model.time(d.minSlot(y, ky)) + dy;
        if (lo >= hi) {
            return false;
        }
        return d.clearRange(x, kx, model.floorSlot(lo) + 1, model.ceilSlot(hi) - 1, model.slots);
    }

    long minEnd(DomainStore d, int a) {
        long best = Long.MAX_VALUE;
        for (int k = 0; k < d.resourceOptions(a); k++) {
            int s = d.minSlot(a, k);
            if (s >= 0) {
                best = Math.min(best, model.time(s) + model.duration[a][k]);
            }
        }
        return best;
    }

    long maxStart(DomainStore d, int a) {
        long best = Long.MIN_VALUE;
        for (int k = 0; k < d.resourceOptions(a); k++) {
            int s = d.maxSlot(a, k);
            if (s >= 0) {
                best = Math.max(best, model.time(s));
            }
        }
        return best;
    }
}
