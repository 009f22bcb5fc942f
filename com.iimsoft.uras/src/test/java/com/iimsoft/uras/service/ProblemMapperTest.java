package com.iimsoft.uras.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.uras.api.dto.ScheduleRequest;
import com.iimsoft.uras.api.dto.ScheduleResponse;
import com.iimsoft.uras.calendar.ShiftCalendarConfig;
import com.iimsoft.uras.calendar.ShiftCalendarFactory;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.ActivityDuration;
import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.Calendar;
import com.iimsoft.uras.domain.CapacityConstraint;
import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.domain.PrecedenceConstraint;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.domain.ResourceKind;
import com.iimsoft.uras.domain.Schedule;
import com.iimsoft.uras.domain.SchedulingProblem;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.domain.TimeWindowConstraint;
import com.iimsoft.uras.domain.Violation;
import com.iimsoft.uras.domain.ViolationType;
import com.iimsoft.uras.exception.InvalidSpecException;
import com.iimsoft.uras.time.DurationDistribution;
import com.iimsoft.uras.time.TimeWindow;
import com.iimsoft.uras.time.WindowType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.iimsoft.uras.calendar.ShiftCalendarFactory.HOUR_MS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProblemMapperTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static SchedulingProblem richProblem() {
        Resource oven = Resource.builder()
                .id("OVEN")
                .name("curing oven")
                .kind(ResourceKind.SECONDARY)
                .category("oven")
                .capacity(2)
                .calendar(new Calendar(List.of(new Interval(0, 50_000)), List.of(new Interval(20_000, 21_000))))
                .build();
        Resource operator = Resource.builder().id("OP1").kind(ResourceKind.HUMAN).category("operator")
                .efficiency(1.25).build();
        Task job = Task.builder()
                .id("J1")
                .name("housing")
                .priority(3)
                .dueMs(40_000L)
                .releaseMs(1_000L)
                .activity(Activity.builder().id("J1-mold").taskId("J1").sequence(1)
                        .duration(new ActivityDuration(200, DurationDistribution.pert(1000, 2000, 6000), 100))
                        .resourceGroup("operator", List.of("OP1"))
                        .attribute("color", "red")
                        .build())
                .activity(Activity.builder().id("J1-cure").taskId("J1").sequence(2)
                        .duration(ActivityDuration.of(DurationDistribution.triangular(3000, 4000, 8000)))
                        .resourceGroup("oven", List.of())
                        .build())
                .build();
        Task side = Task.builder()
                .id("J2")
                .noPrecedence(true)
                .activity(Activity.builder().id("J2-a").taskId("J2").sequence(1)
                        .duration(ActivityDuration.of(DurationDistribution.uniform(1000, 3000)))
                        .resourceGroup("oven", List.of("OVEN"))
                        .build())
                .activity(Activity.builder().id("J2-b").taskId("J2").sequence(2)
                        .duration(ActivityDuration.of(DurationDistribution.logNormal(7.5, 0.2)))
                        .resourceGroup("operator", List.of("OP1"))
                        .predecessor("J1-mold")
                        .build())
                .build();
        return SchedulingProblem.builder()
                .originMs(500)
                .durationConfidence(0.8)
                .resource(oven)
                .resource(operator)
                .task(job)
                .task(side)
                .constraint(new PrecedenceConstraint("J1-cure", "J2-b", 250))
                .constraint(new CapacityConstraint("OVEN", 1))
                .constraint(TimeWindowConstraint.forActivity("J1-cure", TimeWindow.bounded(5_000, 30_000).soft(0.5)))
                .constraint(TimeWindowConstraint.forTask("J2", TimeWindow.deadline(45_000)))
                .build();
    }

    @Test
    void problemShouldSurviveJsonRoundTrip() throws Exception {
        SchedulingProblem original = richProblem();

        String json = mapper.writeValueAsString(ProblemMapper.toRequest(original));
        SchedulingProblem copy = ProblemMapper.toProblem(mapper.readValue(json, ScheduleRequest.class));

        assertThat(copy.getOriginMs()).isEqualTo(500);
        assertThat(copy.getDurationConfidence()).isEqualTo(0.8);
        assertThat(copy.getConstraints()).containsExactlyElementsOf(original.getConstraints());

        Resource oven = copy.getResources().get(0);
        assertThat(oven.getKind()).isEqualTo(ResourceKind.SECONDARY);
        assertThat(oven.getCapacity()).isEqualTo(2);
        assertThat(oven.getCalendar().availableIntervals())
                .containsExactly(new Interval(0, 20_000), new Interval(21_000, 50_000));
        assertThat(copy.getResources().get(1).getEfficiency()).isEqualTo(1.25);
        assertThat(copy.getResources().get(1).getCalendar().isAlways()).isTrue();

        for (int t = 0; t < original.getTasks().size(); t++) {
            Task expected = original.getTasks().get(t);
            Task actual = copy.getTasks().get(t);
            assertThat(actual.getPriority()).isEqualTo(expected.getPriority());
            assertThat(actual.getDueMs()).isEqualTo(expected.getDueMs());
            assertThat(actual.getReleaseMs()).isEqualTo(expected.getReleaseMs());
            assertThat(actual.isNoPrecedence()).isEqualTo(expected.isNoPrecedence());
            for (int a = 0; a < expected.getActivities().size(); a++) {
                Activity ea = expected.getActivities().get(a);
                Activity aa = actual.getActivities().get(a);
                assertThat(aa.getId()).isEqualTo(ea.getId());
                assertThat(aa.getDuration()).isEqualTo(ea.getDuration());
                assertThat(aa.getResourceGroups()).isEqualTo(ea.getResourceGroups());
                assertThat(aa.getPredecessors()).isEqualTo(ea.getPredecessors());
                assertThat(aa.getAttributes()).isEqualTo(ea.getAttributes());
            }
        }
    }

    @Test
    void windowTypeShouldDefaultToSoftWithUnitPenalty() {
        ScheduleRequest.WindowDto w = new ScheduleRequest.WindowDto();
        w.latestEndMs = 9_000L;

        TimeWindow window = ProblemMapper.toWindow(w);

        assertThat(window.getType()).isEqualTo(WindowType.SOFT);
        assertThat(window.getPenaltyPerMs()).isEqualTo(1.0);
    }

    @Test
    void shiftCalendarShouldBeExpandedIntoWindows() {
        ScheduleRequest.CalendarDto cal = new ScheduleRequest.CalendarDto();
        cal.shifts = ShiftCalendarConfig.defaultDayAndNightShift();
        cal.shiftStartMs = 0L;
        cal.shiftDays = 1;
        ScheduleRequest req = singleResourceRequest(cal);

        Resource r = ProblemMapper.toProblem(req).getResources().get(0);

        assertThat(r.getCalendar().availableIntervals()).containsExactlyElementsOf(
                ShiftCalendarFactory.buildDefault(0, 1).availableIntervals());
        assertThat(r.getCalendar().isWorkingTime(12 * HOUR_MS)).isFalse();

        cal.shiftDays = null;
        assertThatThrownBy(() -> ProblemMapper.toProblem(req)).isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void blockedPeriodsAloneShouldLeaveRestOfTimelineAvailable() {
        ScheduleRequest.CalendarDto cal = new ScheduleRequest.CalendarDto();
        cal.blocked = List.of(new ScheduleRequest.IntervalDto(1_000, 2_000));

        Calendar calendar = ProblemMapper.toProblem(singleResourceRequest(cal)).getResources().get(0).getCalendar();

        assertThat(calendar.isAlways()).isFalse();
        assertThat(calendar.isWorkingTime(500)).isTrue();
        assertThat(calendar.isWorkingTime(1_500)).isFalse();
        assertThat(calendar.nextAvailableSlot(1_200, 100)).hasValue(2_000);
    }

    @Test
    void malformedDistributionShouldBeRejected() {
        ScheduleRequest.DistributionDto d = new ScheduleRequest.DistributionDto();
        d.kind = "PERT";
        d.optimisticMs = 1000L;
        d.mostLikelyMs = 2000L;
        assertThatThrownBy(() -> ProblemMapper.toDistribution("X", d))
                .isInstanceOf(InvalidSpecException.class)
                .hasMessageContaining("pessimisticMs");

        d.kind = "GAMMA";
        assertThatThrownBy(() -> ProblemMapper.toDistribution("X", d)).isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void scheduleShouldConvertBothWays() {
        Schedule schedule = Schedule.builder()
                .assign(new Assignment("A1", "T1", "M1", 0, 5_000))
                .assign(new Assignment("A2", "T1", "M2", 5_000, 9_000))
                .violation(new Violation(ViolationType.TIME_WINDOW, List.of("A2"), false, "late", 1_000.0))
                .build();

        ScheduleResponse.ScheduleDto dto = ProblemMapper.toScheduleDto(schedule);
        Schedule back = ProblemMapper.toSchedule(dto);

        assertThat(dto.makespanMs).isEqualTo(9_000);
        assertThat(dto.penalty).isEqualTo(1_000.0);
        assertThat(back.getAssignments()).containsExactlyElementsOf(schedule.getAssignments());
        assertThat(back.getViolations()).containsExactlyElementsOf(schedule.getViolations());
    }

    private static ScheduleRequest singleResourceRequest(ScheduleRequest.CalendarDto calendar) {
        ScheduleRequest.ResourceDto r = new ScheduleRequest.ResourceDto();
        r.id = "R1";
        r.category = "machine";
        r.calendar = calendar;
        ScheduleRequest req = new ScheduleRequest();
        req.resources = List.of(r);
        return req;
    }
}
