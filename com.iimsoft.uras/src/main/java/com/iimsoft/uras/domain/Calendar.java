package com.iimsoft.uras.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * 资源可用日历：有序、互不重叠的可用区间列表。
 * <p>
 * 构造时把 windows 合并、再扣掉 blocked，之后只读；所有查询都是二分查找。
 * 原始 windows / blocked 也保留下来，方便序列化时无损回写。
 */
public final class Calendar {

    private static final Calendar ALWAYS = new Calendar(
            List.of(new Interval(Long.MIN_VALUE / 4, Long.MAX_VALUE / 4)), List.of());

    private final List<Interval> windows;
    private final List<Interval> blocked;
    /** 合并 + 扣除后的可用区间，按开始时间排序且互不重叠 */
    private final long[] starts;
    private final long[] ends;

    public Calendar(List<Interval> windows, List<Interval> blocked) {
        this.windows = List.copyOf(Objects.requireNonNull(windows, "windows"));
        this.blocked = blocked == null ? List.of() : List.copyOf(blocked);
        List<Interval> merged = subtract(merge(this.windows), merge(this.blocked));
        this.starts = new long[merged.size()];
        this.ends = new long[merged.size()];
        for (int i = 0; i < merged.size(); i++) {
            starts[i] = merged.get(i).getStartMs();
            ends[i] = merged.get(i).getEndMs();
        }
    }

    public static Calendar always() {
        return ALWAYS;
    }

    public static Calendar of(Interval... windows) {
        return new Calendar(List.of(windows), List.of());
    }

    static List<Interval> merge(List<Interval> raw) {
        List<Interval> sorted = new ArrayList<>(raw);
        Collections.sort(sorted);
        List<Interval> out = new ArrayList<>();
        for (Interval iv : sorted) {
            if (iv.durationMs() == 0) {
                continue;
            }
            if (!out.isEmpty() && out.get(out.size() - 1).getEndMs() >= iv.getStartMs()) {
                Interval last = out.remove(out.size() - 1);
                out.add(new Interval(last.getStartMs(), Math.max(last.getEndMs(), iv.getEndMs())));
            } else {
                out.add(iv);
            }
        }
        return out;
    }

    private static List<Interval> subtract(List<Interval> base, List<Interval> cuts) {
        if (cuts.isEmpty()) {
            return base;
        }
        List<Interval> out = new ArrayList<>();
        for (Interval iv : base) {
            long cursor = iv.getStartMs();
            for (Interval cut : cuts) {
                if (cut.getEndMs() <= cursor || cut.getStartMs() >= iv.getEndMs()) {
                    continue;
                }
                if (cut.getStartMs() > cursor) {
                    out.add(new Interval(cursor, cut.getStartMs()));
                }
                cursor = Math.max(cursor, cut.getEndMs());
            }
            if (cursor < iv.getEndMs()) {
                out.add(new Interval(cursor, iv.getEndMs()));
            }
        }
        return out;
    }

    /** 最后一个 start <= t 的区间下标，没有返回 -1 */
    private int floorIndex(long t) {
        int lo = 0, hi = starts.length - 1, ans = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid] <= t) {
                ans = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return ans;
    }

    public boolean isWorkingTime(long t) {
        int i = floorIndex(t);
        return i >= 0 && t < ends[i];
    }

    /** [fromMs, toMs) 是否完整落在某个可用区间内 */
    public boolean isAvailable(long fromMs, long toMs) {
        if (toMs <= fromMs) {
            int i = floorIndex(fromMs);
            return i >= 0 && fromMs <= ends[i];
        }
        int i = floorIndex(fromMs);
        return i >= 0 && toMs <= ends[i];
    }

    /**
     * 在 fromMs 及之后，第一个能放下 durationMs 的开始时刻。
     */
    public OptionalLong nextAvailableSlot(long fromMs, long durationMs) {
        int i = floorIndex(fromMs);
        if (i < 0) {
            i = 0;
        }
        for (; i < starts.length; i++) {
            long s = Math.max(fromMs, starts[i]);
            if (s + durationMs <= ends[i] && (s < ends[i] || durationMs == 0)) {
                return OptionalLong.of(s);
            }
        }
        return OptionalLong.empty();
    }

    /** 下一个可工作时刻（当前可工作则返回自身） */
    public OptionalLong nextAvailableTime(long fromMs) {
        return nextAvailableSlot(fromMs, 0);
    }

    /** [fromMs, toMs) 内的可用总时长 */
    public long availableTimeBetween(long fromMs, long toMs) {
        if (toMs <= fromMs) {
            return 0;
        }
        long sum = 0;
        int i = Math.max(0, floorIndex(fromMs));
        for (; i < starts.length && starts[i] < toMs; i++) {
            long a = Math.max(fromMs, starts[i]);
            long b = Math.min(toMs, ends[i]);
            if (b > a) {
                sum += b - a;
            }
        }
        return sum;
    }

    /**
     * 从 fromMs 起累计可用 workMs 毫秒后的时刻；日历不够用时返回最后一个区间的结束。
     */
    public long endAfterWorking(long fromMs, long workMs) {
        long left = workMs;
        int i = Math.max(0, floorIndex(fromMs));
        long last = fromMs;
        for (; i < starts.length; i++) {
            long a = Math.max(fromMs, starts[i]);
            if (ends[i] <= a) {
                continue;
            }
            long len = ends[i] - a;
            if (len >= left) {
                return a + left;
            }
            left -= len;
            last = ends[i];
        }
        return last;
    }

    /** 合并后的可用区间（只读视图） */
    public List<Interval> availableIntervals() {
        List<Interval> out = new ArrayList<>(starts.length);
        for (int i = 0; i < starts.length; i++) {
            out.add(new Interval(starts[i], ends[i]));
        }
        return out;
    }

    public boolean isAlways() {
        return this == ALWAYS;
    }

    public List<Interval> getWindows() {
        return windows;
    }

    public List<Interval> getBlocked() {
        return blocked;
    }

    @Override
    public String toString() {
        return isAlways() ? "Calendar[always]" : "Calendar" + availableIntervals();
    }
}
