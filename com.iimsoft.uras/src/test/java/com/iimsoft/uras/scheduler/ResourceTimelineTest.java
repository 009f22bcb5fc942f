package com.iimsoft.uras.scheduler;

import com.iimsoft.uras.domain.Calendar;
import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.domain.Resource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceTimelineTest {

    @Test
    void earliestStartShouldSkipOccupiedIntervals() {
        ResourceTimeline tl = new ResourceTimeline(Resource.builder().id("M1").build(), 1);
        tl.occupy(100, 200);
        tl.occupy(250, 300);

        assertThat(tl.earliestStart(0, 100, Long.MAX_VALUE)).hasValue(0);
        assertThat(tl.earliestStart(50, 100, Long.MAX_VALUE)).hasValue(300);
        assertThat(tl.earliestStart(150, 50, Long.MAX_VALUE)).hasValue(200);
        assertThat(tl.earliestStart(50, 100, 250)).isEmpty();
        assertThat(tl.loadAt(150)).isEqualTo(1);
        assertThat(tl.getBusyMs()).isEqualTo(150);
        assertThat(tl.getLastEndMs()).isEqualTo(300);
    }

    @Test
    void earliestStartShouldRespectCalendar() {
        Resource r = Resource.builder().id("W1")
                .calendar(Calendar.of(new Interval(0, 100), new Interval(200, 400)))
                .build();
        ResourceTimeline tl = new ResourceTimeline(r, 1);
        tl.occupy(200, 250);

        assertThat(tl.earliestStart(50, 80, Long.MAX_VALUE)).hasValue(250);
        assertThat(tl.earliestStart(0, 500, Long.MAX_VALUE)).isEmpty();
    }

    @Test
    void capacityShouldAllowConcurrentActivities() {
        ResourceTimeline tl = new ResourceTimeline(Resource.builder().id("P").capacity(2).build(), 2);
        tl.occupy(0, 100);

        assertThat(tl.earliestStart(0, 100, Long.MAX_VALUE)).hasValue(0);
        tl.occupy(0, 100);
        assertThat(tl.earliestStart(0, 100, Long.MAX_VALUE)).hasValue(100);
        assertThat(tl.loadAt(50)).isEqualTo(2);
    }
}
