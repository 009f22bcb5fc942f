package com.iimsoft.uras.scheduler;

import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.score.ResourceLoadTracker;

import java.util.OptionalLong;

/**
 * 单个资源的已排程占用 + 日历，回答 "最早什么时候能放下一个时长为 d 的活动"。
 * <p>
 * 候选开始时刻只可能是：请求时刻、日历区间起点、已有占用的变化点，按升序逐个尝试。
 */
public class ResourceTimeline {

    private final Resource resource;
    private final ResourceLoadTracker tracker;
    private long busyMs;
    private long lastEndMs = Long.MIN_VALUE;

    public ResourceTimeline(Resource resource, int capacity) {
        this.resource = resource;
        this.tracker = new ResourceLoadTracker(capacity);
    }

    public Resource getResource() {
        return resource;
    }

    /**
     * @param fromMs          不早于此时刻
     * @param durationMs      有效时长
     * @param latestStartMs   最晚开始（含），无上界传 Long.MAX_VALUE
     */
    public OptionalLong earliestStart(long fromMs, long durationMs, long latestStartMs) {
        long t = fromMs;
        while (t <= latestStartMs) {
            OptionalLong slot = resource.getCalendar().nextAvailableSlot(t, durationMs);
            if (slot.isEmpty() || slot.getAsLong() > latestStartMs) {
                return OptionalLong.empty();
            }
            long s = slot.getAsLong();
            if (tracker.fits(s, s + durationMs)) {
                return OptionalLong.of(s);
            }
            Long next = tracker.nextEventAfter(s);
            if (next == null) {
                return OptionalLong.empty();
            }
            t = next;
        }
        return OptionalLong.empty();
    }

    public void occupy(long startMs, long endMs) {
        tracker.add(startMs, endMs);
        busyMs += endMs - startMs;
        lastEndMs = Math.max(lastEndMs, endMs);
    }

    /** 累计占用时长（多个并发活动分别计） */
    public long getBusyMs() {
        return busyMs;
    }

    /** 最后一个占用的结束时刻，没有占用为 Long.MIN_VALUE */
    public long getLastEndMs() {
        return lastEndMs;
    }

    public boolean isOccupied() {
        return lastEndMs != Long.MIN_VALUE;
    }

    public int loadAt(long t) {
        return tracker.loadAt(t);
    }
}
