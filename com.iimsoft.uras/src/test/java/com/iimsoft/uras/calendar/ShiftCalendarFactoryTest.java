package com.iimsoft.uras.calendar;

import com.iimsoft.uras.domain.Calendar;
import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.exception.InvalidSpecException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.iimsoft.uras.calendar.ShiftCalendarFactory.DAY_MS;
import static com.iimsoft.uras.calendar.ShiftCalendarFactory.HOUR_MS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShiftCalendarFactoryTest {

    private static Interval hours(long from, long to) {
        return new Interval(from * HOUR_MS, to * HOUR_MS);
    }

    @Test
    void defaultShiftsShouldCoverDayAndNightMinusLunchBreak() {
        Calendar calendar = ShiftCalendarFactory.build(ShiftCalendarConfig.defaultDayAndNightShift(), 0, 1);

        assertThat(calendar.availableIntervals()).containsExactly(hours(8, 12), hours(13, 32));
        assertThat(calendar.availableTimeBetween(0, 2 * DAY_MS)).isEqualTo(23 * HOUR_MS);
    }

    @Test
    void breakInsideOvernightShiftShouldLandOnNextDay() {
        String json = "{\"shifts\":[{\"name\":\"NIGHT\",\"startHour\":20,\"endHour\":8,"
                + "\"breaks\":[{\"startHour\":2,\"endHour\":3}]}]}";

        Calendar calendar = ShiftCalendarFactory.build(json, 0, 1);

        assertThat(calendar.availableIntervals()).containsExactly(hours(20, 26), hours(27, 32));
        assertThat(calendar.isWorkingTime(26 * HOUR_MS)).isFalse();
    }

    @Test
    void blockedDaysShouldBeSkipped() {
        ShiftCalendarConfig cfg = new ShiftCalendarConfig();
        cfg.getShifts().add(new ShiftCalendarConfig.Shift("DAY", 8, 20));
        cfg.setBlockedDays(List.of(1));

        Calendar calendar = ShiftCalendarFactory.build(cfg, 0, 3);

        assertThat(calendar.availableIntervals()).containsExactly(hours(8, 20), hours(56, 68));
    }

    @Test
    void malformedJsonShouldBeRejected() {
        assertThatThrownBy(() -> ShiftCalendarFactory.parse("{\"shifts\":"))
                .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> ShiftCalendarFactory.build(new ShiftCalendarConfig(), 0, -1))
                .isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void unreadableSystemPropertyShouldFallBackToDefaultShifts() {
        System.setProperty(ShiftCalendarFactory.CALENDAR_JSON_PROPERTY, "not json");
        try {
            ShiftCalendarConfig cfg = ShiftCalendarFactory.loadConfig();

            assertThat(cfg.getShifts()).extracting(ShiftCalendarConfig.Shift::getName)
                    .containsExactly("DAY", "NIGHT");
        } finally {
            System.clearProperty(ShiftCalendarFactory.CALENDAR_JSON_PROPERTY);
        }
    }

    @Test
    void systemPropertyShouldOverrideDefaultShifts() {
        System.setProperty(ShiftCalendarFactory.CALENDAR_JSON_PROPERTY,
                "{\"shifts\":[{\"name\":\"EARLY\",\"startHour\":6,\"endHour\":14}]}");
        try {
            Calendar calendar = ShiftCalendarFactory.buildDefault(DAY_MS, 1);

            assertThat(calendar.availableIntervals()).containsExactly(hours(30, 38));
        } finally {
            System.clearProperty(ShiftCalendarFactory.CALENDAR_JSON_PROPERTY);
        }
    }
}
