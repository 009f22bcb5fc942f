package com.iimsoft.uras.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 班次日历配置：每天重复的班次（可跨午夜）+ 班内休息 + 整天停工的日期。
 * 小时以 0..24 表示，按 dayStartMs 起算的自然日展开。
 */
public class ShiftCalendarConfig {

    @JsonProperty("shifts")
    private List<Shift> shifts;

    /** 从展开起点算起的第几天整天不可用（0 为第一天） */
    @JsonProperty("blockedDays")
    private List<Integer> blockedDays;

    public ShiftCalendarConfig() {
        this.shifts = new ArrayList<>();
        this.blockedDays = new ArrayList<>();
    }

    /** 白班 8-20（12-13 午休）+ 夜班 20-8 */
    public static ShiftCalendarConfig defaultDayAndNightShift() {
        ShiftCalendarConfig cfg = new ShiftCalendarConfig();
        Shift day = new Shift("DAY", 8, 20);
        day.getBreaks().add(new Break(12, 13));
        cfg.getShifts().add(day);
        cfg.getShifts().add(new Shift("NIGHT", 20, 8));
        return cfg;
    }

    public List<Shift> getShifts() {
        return shifts;
    }

    public void setShifts(List<Shift> shifts) {
        this.shifts = shifts;
    }

    public List<Integer> getBlockedDays() {
        return blockedDays;
    }

    public void setBlockedDays(List<Integer> blockedDays) {
        this.blockedDays = blockedDays;
    }

    /**
     * 班次，endHour <= startHour 表示跨到次日。
     */
    public static class Shift {
        @JsonProperty("name")
        private String name;

        @JsonProperty("startHour")
        private int startHour;

        @JsonProperty("endHour")
        private int endHour;

        @JsonProperty("breaks")
        private List<Break> breaks;

        public Shift() {
            this.breaks = new ArrayList<>();
        }

        public Shift(String name, int startHour, int endHour) {
            this.name = name;
            this.startHour = startHour;
            this.endHour = endHour;
            this.breaks = new ArrayList<>();
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getStartHour() {
            return startHour;
        }

        public void setStartHour(int startHour) {
            this.startHour = startHour;
        }

        public int getEndHour() {
            return endHour;
        }

        public void setEndHour(int endHour) {
            this.endHour = endHour;
        }

        public List<Break> getBreaks() {
            return breaks;
        }

        public void setBreaks(List<Break> breaks) {
            this.breaks = breaks;
        }
    }

    /**
     * 班内休息，同样允许跨午夜（少见）。
     */
    public static class Break {
        @JsonProperty("startHour")
        private int startHour;

        @JsonProperty("endHour")
        private int endHour;

        public Break() {
        }

        public Break(int startHour, int endHour) {
            this.startHour = startHour;
            this.endHour = endHour;
        }

        public int getStartHour() {
            return startHour;
        }

        public void setStartHour(int startHour) {
            this.startHour = startHour;
        }

        public int getEndHour() {
            return endHour;
        }

        public void setEndHour(int endHour) {
            this.endHour = endHour;
        }
    }
}
