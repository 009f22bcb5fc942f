package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 半开区间 [startMs, endMs)。
 */
@Getter
@EqualsAndHashCode
public final class Interval implements Comparable<Interval> {

    private final long startMs;
    private final long endMs;

    public Interval(long startMs, long endMs) {
        if (endMs < startMs) {
            throw new InvalidSpecException("区间结束早于开始: [" + startMs + ", " + endMs + ")");
        }
        this.startMs = startMs;
        this.endMs = endMs;
    }

    public long durationMs() {
        return endMs - startMs;
    }

    public boolean contains(long t) {
        return t >= startMs && t < endMs;
    }

    public boolean covers(long fromMs, long toMs) {
        return fromMs >= startMs && toMs <= endMs;
    }

    public boolean overlaps(long fromMs, long toMs) {
        return startMs < toMs && endMs > fromMs;
    }

    @Override
    public int compareTo(Interval o) {
        int c = Long.compare(startMs, o.startMs);
        return c != 0 ? c : Long.compare(endMs, o.endMs);
    }

    @Override
    public String toString() {
        return "[" + startMs + ", " + endMs + ")";
    }
}
