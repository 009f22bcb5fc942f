package com.iimsoft.uras.score;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceLoadTrackerTest {

    @Test
    void loadShouldCountHalfOpenIntervals() {
        ResourceLoadTracker t = new ResourceLoadTracker(1);
        t.add(0, 100);
        t.add(100, 200);

        assertThat(t.loadAt(99)).isEqualTo(1);
        assertThat(t.loadAt(100)).isEqualTo(1);
        assertThat(t.maxLoad()).isEqualTo(1);
        assertThat(t.overCapacity()).isZero();
        assertThat(t.busyTime()).isEqualTo(200);
    }

    @Test
    void overlapShouldExceedCapacity() {
        ResourceLoadTracker t = new ResourceLoadTracker(1);
        t.add(0, 100);
        t.add(50, 150);

        assertThat(t.maxLoadIn(0, 50)).isEqualTo(1);
        assertThat(t.maxLoadIn(40, 60)).isEqualTo(2);
        assertThat(t.overCapacity()).isEqualTo(1);
        assertThat(t.fits(150, 200)).isTrue();
        assertThat(t.fits(120, 200)).isFalse();
        assertThat(t.busyTime()).isEqualTo(150);
    }

    @Test
    void removeShouldRestorePreviousState() {
        ResourceLoadTracker t = new ResourceLoadTracker(1);
        t.add(0, 100);
        t.add(50, 150);
        t.remove(50, 150);

        assertThat(t.maxLoad()).isEqualTo(1);
        assertThat(t.nextEventAfter(0)).isEqualTo(100L);
        assertThat(t.nextEventAfter(100)).isNull();
    }

    @Test
    void zeroLengthIntervalShouldNotOccupy() {
        ResourceLoadTracker t = new ResourceLoadTracker(1);
        t.add(10, 10);

        assertThat(t.maxLoad()).isZero();
        assertThat(t.fits(10, 10)).isTrue();
    }
}
