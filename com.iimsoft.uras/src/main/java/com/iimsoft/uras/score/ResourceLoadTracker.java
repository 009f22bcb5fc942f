package com.iimsoft.uras.score;

import java.util.Map;
import java.util.TreeMap;

/**
 * 单个资源的并发占用跟踪器（离散时间轴）。
 * <p>
 * 用 "时间点 -> 占用增量" 维护占用，按时间前缀求和得到任意时刻的并发数：
 * <pre>
 * load(t) = Σ(delta(time) where time <= t)
 * </pre>
 * 区间 [start, end) 在 start 处 +1，在 end 处 -1。零长度区间不占用。
 */
public class ResourceLoadTracker {

    private final int capacity;

    /** time -> delta（正数=开始占用，负数=释放） */
    private final TreeMap<Long, Integer> deltaPerTime = new TreeMap<>();

    public ResourceLoadTracker(int capacity) {
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    public void add(long startMs, long endMs) {
        if (endMs <= startMs) {
            return;
        }
        addDelta(startMs, 1);
        addDelta(endMs, -1);
    }

    public void remove(long startMs, long endMs) {
        if (endMs <= startMs) {
            return;
        }
        // 移除区间等价于加上相反的增量
        addDelta(startMs, -1);
        addDelta(endMs, 1);
    }

    private void addDelta(long time, int delta) {
        Integer v = deltaPerTime.merge(time, delta, Integer::sum);
        if (v != null && v == 0) {
            deltaPerTime.remove(time);
        }
    }

    public int loadAt(long t) {
        int running = 0;
        for (int d : deltaPerTime.headMap(t, true).values()) {
            running += d;
        }
        return running;
    }

    /** [fromMs, toMs) 内的最大并发数 */
    public int maxLoadIn(long fromMs, long toMs) {
        if (toMs <= fromMs) {
            return 0;
        }
        int running = loadAt(fromMs);
        int max = running;
        for (int d : deltaPerTime.subMap(fromMs, false, toMs, false).values()) {
            running += d;
            if (running > max) {
                max = running;
            }
        }
        return max;
    }

    /** 全时间轴的最大并发数 */
    public int maxLoad() {
        int running = 0;
        int max = 0;
        for (int d : deltaPerTime.values()) {
            running += d;
            if (running > max) {
                max = running;
            }
        }
        return max;
    }

    /** 超出容量的最大量，未超出为 0 */
    public int overCapacity() {
        return Math.max(0, maxLoad() - capacity);
    }

    /** 放入 [fromMs, toMs) 后是否仍不超容量 */
    public boolean fits(long fromMs, long toMs) {
        return toMs <= fromMs || maxLoadIn(fromMs, toMs) < capacity;
    }

    /** 严格晚于 t 的下一个占用变化时刻，没有返回 null */
    public Long nextEventAfter(long t) {
        return deltaPerTime.higherKey(t);
    }

    /** 有占用的时间总长（并发按一次计） */
    public long busyTime() {
        long busy = 0;
        int running = 0;
        Long prev = null;
        for (Map.Entry<Long, Integer> e : deltaPerTime.entrySet()) {
            if (prev != null && running > 0) {
                busy += e.getKey() - prev;
            }
            running += e.getValue();
            prev = e.getKey();
        }
        return busy;
    }
}
