package com.iimsoft.uras.calendar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.uras.domain.Calendar;
import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.exception.InvalidSpecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 把班次配置展开成一段时间范围内的 {@link Calendar}。
 *
 * 配置来源（优先级从高到低）：
 * 1) 显式传入的 ShiftCalendarConfig / JSON
 * 2) JVM 参数：-Duras.calendar=JSON
 * 3) 默认：白班 + 夜班（见 ShiftCalendarConfig.defaultDayAndNightShift()）
 */
public final class ShiftCalendarFactory {

    /** JVM 参数 key */
    public static final String CALENDAR_JSON_PROPERTY = "uras.calendar";

    public static final long HOUR_MS = 3_600_000L;
    public static final long DAY_MS = 24 * HOUR_MS;

    private static final Logger LOGGER = LoggerFactory.getLogger(ShiftCalendarFactory.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ShiftCalendarFactory() {
    }

    /**
     * @param dayStartMs 第 0 天的 0 点
     * @param days       展开天数
     */
    public static Calendar build(ShiftCalendarConfig cfg, long dayStartMs, int days) {
        if (days < 0) {
            throw new InvalidSpecException("calendar days 不能为负: " + days);
        }
        Set<Integer> blocked = cfg.getBlockedDays() == null ? Set.of() : new HashSet<>(cfg.getBlockedDays());
        List<Interval> windows = new ArrayList<>();
        List<Interval> breaks = new ArrayList<>();
        if (cfg.getShifts() != null) {
            for (ShiftCalendarConfig.Shift s : cfg.getShifts()) {
                for (int d = 0; d < days; d++) {
                    if (blocked.contains(d)) {
                        continue;
                    }
                    long day = dayStartMs + d * DAY_MS;
                    Interval w = range(day, s.getStartHour(), s.getEndHour());
                    if (w == null) {
                        continue;
                    }
                    windows.add(w);
                    if (s.getBreaks() != null) {
                        for (ShiftCalendarConfig.Break b : s.getBreaks()) {
                            // 休息在班次开始之前的，算次日
                            long base = b.getStartHour() < s.getStartHour() && s.getEndHour() <= s.getStartHour()
                                    ? day + DAY_MS : day;
                            Interval br = range(base, b.getStartHour(), b.getEndHour());
                            if (br != null) {
                                breaks.add(br);
                            }
                        }
                    }
                }
            }
        }
        return new Calendar(windows, breaks);
    }

    public static Calendar build(String json, long dayStartMs, int days) {
        return build(parse(json), dayStartMs, days);
    }

    /** 使用 -Duras.calendar 或默认班次 */
    public static Calendar buildDefault(long dayStartMs, int days) {
        return build(loadConfig(), dayStartMs, days);
    }

    public static ShiftCalendarConfig parse(String json) {
        try {
            return MAPPER.readValue(json, ShiftCalendarConfig.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSpecException("班次日历 JSON 无法解析: " + e.getOriginalMessage(), e);
        }
    }

    static ShiftCalendarConfig loadConfig() {
        String json = System.getProperty(CALENDAR_JSON_PROPERTY);
        if (json == null || json.isBlank()) {
            return ShiftCalendarConfig.defaultDayAndNightShift();
        }
        try {
            return MAPPER.readValue(json, ShiftCalendarConfig.class);
        } catch (JsonProcessingException e) {
            LOGGER.warn("-D{} 配置无法解析，回退默认班次: {}", CALENDAR_JSON_PROPERTY, e.getOriginalMessage());
            return ShiftCalendarConfig.defaultDayAndNightShift();
        }
    }

    /**
     * end > start：同一天；end <= start：跨到次日；两者相等视为空。
     */
    private static Interval range(long day, int startHour, int endHour) {
        int start = clampHour(startHour);
        int end = clampHour(endHour);
        if (start == end) {
            return null;
        }
        long s = day + start * HOUR_MS;
        long e = end > start ? day + end * HOUR_MS : day + DAY_MS + end * HOUR_MS;
        return new Interval(s, e);
    }

    private static int clampHour(int h) {
        if (h < 0) return 0;
        if (h > 24) return 24;
        return h;
    }
}
