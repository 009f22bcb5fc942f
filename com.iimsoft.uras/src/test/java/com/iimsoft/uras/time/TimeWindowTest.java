package com.iimsoft.uras.time;

import com.iimsoft.uras.exception.InvalidSpecException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeWindowTest {

    @Test
    void deadlineShouldBeHardWithOpenStart() {
        TimeWindow w = TimeWindow.deadline(10_000);

        assertThat(w.isHard()).isTrue();
        assertThat(w.getEarliestStartMs()).isNull();
        assertThat(w.getLatestEndMs()).isEqualTo(10_000);
        assertThat(w.checkViolation(0, 10_000)).isNull();
    }

    @Test
    void softShouldCarryPenaltyWeight() {
        TimeWindow w = TimeWindow.deadline(10_000).soft(2.5);

        TimeWindowViolation v = w.checkViolation(5_000, 12_000);

        assertThat(v.isHard()).isFalse();
        assertThat(v.getLateMs()).isEqualTo(2_000);
        assertThat(v.isTardy()).isTrue();
        assertThat(v.getPenalty()).isEqualTo(5_000.0);
    }

    @Test
    void violationShouldSumEarlinessAndLateness() {
        TimeWindow w = new TimeWindow(1_000L, 2_000L, 4_000L, 6_000L, WindowType.SOFT, 1.0);

        TimeWindowViolation early = w.checkViolation(500, 3_000);
        assertThat(early.getEarlyMs()).isEqualTo(500 + 1_000);
        assertThat(early.isEarly()).isTrue();
        assertThat(early.totalViolationMs()).isEqualTo(1_500);

        TimeWindowViolation late = w.checkViolation(2_500, 7_000);
        assertThat(late.getLateMs()).isEqualTo(500 + 1_000);
        assertThat(late.getPenalty()).isEqualTo(1_500.0);
    }

    @Test
    void startBoundsShouldAccountForDuration() {
        TimeWindow w = new TimeWindow(1_000L, 8_000L, 5_000L, 10_000L, WindowType.HARD, 0.0);

        assertThat(w.lowerStartBound(3_000)).isEqualTo(2_000);
        assertThat(w.upperStartBound(3_000)).isEqualTo(7_000);
        assertThat(TimeWindow.unbounded().lowerStartBound(100)).isEqualTo(Long.MIN_VALUE);
        assertThat(TimeWindow.unbounded().upperStartBound(100)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void finishBeforeStartShouldBeRejected() {
        assertThatThrownBy(() -> TimeWindow.bounded(5_000, 4_000)).isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> TimeWindow.release(5_000).withLatestStart(4_000)).isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> TimeWindow.unbounded().soft(-1)).isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void modifiersShouldReturnNewWindows() {
        TimeWindow base = TimeWindow.bounded(0, 100);
        TimeWindow hard = base.hard();

        assertThat(base.isHard()).isFalse();
        assertThat(hard.isHard()).isTrue();
        assertThat(hard.withEarliestEnd(50).getEarliestEndMs()).isEqualTo(50);
        assertThat(base).isEqualTo(TimeWindow.bounded(0, 100));
    }
}
