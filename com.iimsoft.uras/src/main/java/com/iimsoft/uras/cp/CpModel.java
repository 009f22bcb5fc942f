package com.iimsoft.uras.cp;

import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.time.TimeWindow;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 离散化后的 CP 模型：每个活动一个变量，取值 = (允许资源下标 k, 开始网格点 slot)。
 * <p>
 * 时间网格 time(slot) = origin + slot × step，slot ∈ [0, slots)。
 * 网格步长取所有时长、边界、日历端点、最小间隔（相对原点）的最大公约数，
 * 这时任何半主动排程的开始时间都落在网格上，穷举即可证明最优（exact = true）。
 * 网格点数超过上限时加粗步长，exact = false。
 */
final class CpModel {

    final ProblemIndex index;
    final long origin;
    final long horizonEnd;
    final long step;
    final int slots;
    final boolean exact;
    /** duration[a][k]：活动 a 在第 k 个允许资源上的有效时长 */
    final long[][] duration;
    /** 容量为 1 的资源上，共享该资源的活动对 -> 邻接表 */
    final int[][] unaryNeighbors;

    CpModel(ProblemIndex index, long horizonEnd, Long requestedStep, int maxSlots) {
        this.index = index;
        this.origin = index.originMs();
        this.horizonEnd = Math.max(horizonEnd, origin);
        int n = index.activityCount();

        this.duration = new long[n][];
        for (int a = 0; a < n; a++) {
            int[] allowed = index.allowed(a);
            duration[a] = new long[allowed.length];
            for (int k = 0; k < allowed.length; k++) {
                duration[a][k] = index.effectiveMs(a, allowed[k]);
            }
        }

        long span = this.horizonEnd - origin;
        long g = requestedStep != null && requestedStep > 0 ? requestedStep : gridGcd(span);
        boolean aligned = requestedStep == null || requestedStep <= 0 || isAligned(requestedStep, span);
        long needed = span / g + 1;
        if (needed > maxSlots) {
            g = Math.max(1, (span + maxSlots - 2) / Math.max(1, maxSlots - 1));
            aligned = false;
            needed = span / g + 1;
        }
        this.step = g;
        this.slots = (int) needed;
        this.exact = aligned;

        this.unaryNeighbors = buildUnaryNeighbors();
    }

    private long gridGcd(long span) {
        BigInteger g = BigInteger.ZERO;
        for (long v : relevantOffsets(span)) {
            if (v != 0) {
                g = g.gcd(BigInteger.valueOf(Math.abs(v)));
            }
        }
        return g.signum() == 0 ? Math.max(1, span) : g.longValue();
    }

    private boolean isAligned(long step, long span) {
        for (long v : relevantOffsets(span)) {
            if (v % step != 0) {
                return false;
            }
        }
        return true;
    }

    /** 所有会影响最优开始时间的量（相对原点） */
    private long[] relevantOffsets(long span) {
        List<Long> out = new ArrayList<>();
        for (long[] ds : duration) {
            for (long d : ds) {
                out.add(d);
            }
        }
        for (int a = 0; a < index.activityCount(); a++) {
            for (long d : index.predecessorDelays(a)) {
                out.add(d);
            }
            for (TimeWindow w : index.activityWindows(a)) {
                addWindow(out, w);
            }
        }
        for (int t = 0; t < index.taskCount(); t++) {
            Long release = index.task(t).getReleaseMs();
            if (release != null && release > origin) {
                out.add(release - origin);
            }
            for (TimeWindow w : index.taskWindows(t)) {
                addWindow(out, w);
            }
        }
        for (int r = 0; r < index.resourceCount(); r++) {
            Resource res = index.resource(r);
            if (res.getCalendar().isAlways()) {
                continue;
            }
            for (Interval iv : res.getCalendar().availableIntervals()) {
                if (iv.getStartMs() > origin && iv.getStartMs() < origin + span) {
                    out.add(iv.getStartMs() - origin);
                }
                if (iv.getEndMs() > origin && iv.getEndMs() < origin + span) {
                    out.add(iv.getEndMs() - origin);
                }
            }
        }
        return out.stream().mapToLong(Long::longValue).toArray();
    }

    private void addWindow(List<Long> out, TimeWindow w) {
        Long[] bounds = {w.getEarliestStartMs(), w.getLatestStartMs(), w.getEarliestEndMs(), w.getLatestEndMs()};
        for (Long b : bounds) {
            if (b != null && b > origin && b <= horizonEnd) {
                out.add(b - origin);
            }
        }
    }

    private int[][] buildUnaryNeighbors() {
        int n = index.activityCount();
        List<Set<Integer>> adj = new ArrayList<>(n);
        for (int a = 0; a < n; a++) {
            adj.add(new TreeSet<>());
        }
        for (int r = 0; r < index.resourceCount(); r++) {
            if (index.capacity(r) != 1) {
                continue;
            }
            List<Integer> users = new ArrayList<>();
            for (int a = 0; a < n; a++) {
                if (index.isAllowed(a, r)) {
                    users.add(a);
                }
            }
            for (int x : users) {
                for (int y : users) {
                    if (x != y) {
                        adj.get(x).add(y);
                    }
                }
            }
        }
        int[][] out = new int[n][];
        for (int a = 0; a < n; a++) {
            out[a] = adj.get(a).stream().mapToInt(Integer::intValue).toArray();
        }
        return out;
    }

    long time(int slot) {
        return origin + slot * step;
    }

    /** 最小的 slot 使 time(slot) >= t，可能为负或超出范围 */
    long ceilSlot(long t) {
        return Math.floorDiv(t - origin + step - 1, step);
    }

    /** 最大的 slot 使 time(slot) <= t */
    long floorSlot(long t) {
        return Math.floorDiv(t - origin, step);
    }

    int resourceOf(int a, int k) {
        return index.allowed(a)[k];
    }

    /**
     * 一元过滤后的初始域：资源日历、释放时间、硬时间窗、地平线。
     */
    DomainStore initialDomains() {
        int n = index.activityCount();
        BitSet[][] bits = new BitSet[n][];
        for (int a = 0; a < n; a++) {
            int[] allowed = index.allowed(a);
            bits[a] = new BitSet[allowed.length];
            for (int k = 0; k < allowed.length; k++) {
                BitSet b = new BitSet(slots);
                long dur = duration[a][k];
                long lo = Math.max(index.lowerStart(a, dur), origin);
                long hi = Math.min(index.upperStart(a, dur), horizonEnd - dur);
                Resource res = index.resource(allowed[k]);
                long from = Math.max(0, ceilSlot(lo));
                long to = Math.min(slots - 1L, floorSlot(hi));
                for (long s = from; s <= to; s++) {
                    long t = time((int) s);
                    if (res.getCalendar().isAvailable(t, t + dur)) {
                        b.set((int) s);
                    }
                }
                bits[a][k] = b;
            }
        }
        return new DomainStore(bits);
    }
}
