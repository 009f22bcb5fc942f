package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.exception.InvalidSpecException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.iimsoft.uras.TestProblems.activity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BuiltinRulesTest {

    private final Activity a = activity("A", "T1", 1, 4000, "M1", "M2");
    private final Task dueTask = Task.builder().id("T1").priority(4).dueMs(20_000L).releaseMs(300L).activity(a).build();
    private final Task openTask = Task.builder().id("T1").activity(a).build();

    private SchedulingContext context(Task task) {
        return SchedulingContext.builder()
                .currentTimeMs(2000)
                .task(task)
                .processingMs("A", 4000)
                .remainingWork("T1", 10_000)
                .remainingOps("T1", 4)
                .queuedWork("M1", 7000)
                .queuedWork("M2", 3000)
                .utilization("M1", 0.25)
                .utilization("M2", 0.75)
                .averageProcessingMs(5000)
                .build();
    }

    @Test
    void processingTimeRulesShouldUseRegisteredDuration() {
        assertThat(new ShortestProcessingTime().evaluate(a, context(dueTask))).isEqualTo(4000);
        assertThat(new LongestProcessingTime().evaluate(a, context(dueTask))).isEqualTo(-4000);
        assertThat(new WeightedShortestProcessingTime().evaluate(a, context(dueTask))).isEqualTo(1000);
    }

    @Test
    void processingTimeShouldFallBackToNominalDuration() {
        assertThat(new ShortestProcessingTime().evaluate(a, SchedulingContext.at(0))).isEqualTo(4000);
    }

    @Test
    void workRemainingRulesShouldReadTaskWork() {
        assertThat(new LeastWorkRemaining().evaluate(a, context(dueTask))).isEqualTo(10_000);
        assertThat(new MostWorkRemaining().evaluate(a, context(dueTask))).isEqualTo(-10_000);
    }

    @Test
    void dueDateRulesShouldComputeSlack() {
        SchedulingContext ctx = context(dueTask);

        assertThat(new EarliestDueDate().evaluate(a, ctx)).isEqualTo(20_000);
        assertThat(new MinimumSlackTime().evaluate(a, ctx)).isEqualTo(8000);
        assertThat(new CriticalRatio().evaluate(a, ctx)).isEqualTo(1.8);
        assertThat(new SlackPerRemainingOperation().evaluate(a, ctx)).isEqualTo(2000);
    }

    @Test
    void dueDateRulesShouldRankTasksWithoutDueLast() {
        SchedulingContext ctx = context(openTask);

        assertThat(new EarliestDueDate().evaluate(a, ctx)).isEqualTo(Double.MAX_VALUE);
        assertThat(new MinimumSlackTime().evaluate(a, ctx)).isEqualTo(Double.MAX_VALUE);
        assertThat(new CriticalRatio().evaluate(a, ctx)).isEqualTo(Double.MAX_VALUE);
        assertThat(new SlackPerRemainingOperation().evaluate(a, ctx)).isEqualTo(Double.MAX_VALUE);
        assertThat(new ApparentTardinessCost().evaluate(a, ctx)).isZero();
    }

    @Test
    void criticalRatioShouldGuardZeroRemainingWork() {
        SchedulingContext ctx = SchedulingContext.builder().currentTimeMs(0).task(dueTask).build();

        assertThat(new CriticalRatio().evaluate(a, ctx)).isEqualTo(20_000 / CriticalRatio.EPSILON);
    }

    @Test
    void fifoShouldPreferReadyTimeThenRelease() {
        SchedulingContext withReady = SchedulingContext.builder().task(dueTask).readyTime("A", 900).build();

        assertThat(new FirstInFirstOut().evaluate(a, withReady)).isEqualTo(900);
        assertThat(new FirstInFirstOut().evaluate(a, context(dueTask))).isEqualTo(300);
        assertThat(new FirstInFirstOut().evaluate(a, context(openTask))).isZero();
    }

    @Test
    void resourceRulesShouldTakeLeastLoadedCandidate() {
        SchedulingContext ctx = context(dueTask);

        assertThat(new WorkInNextQueue().evaluate(a, ctx)).isEqualTo(3000);
        assertThat(new LeastPlannedUtilization().evaluate(a, ctx)).isEqualTo(0.25);

        SchedulingContext restricted = SchedulingContext.builder().candidates("A", List.of("M1"))
                .queuedWork("M1", 7000).queuedWork("M2", 3000).build();
        assertThat(new WorkInNextQueue().evaluate(a, restricted)).isEqualTo(7000);
    }

    @Test
    void priorityShouldPutHigherPriorityFirst() {
        assertThat(new HighestPriority().evaluate(a, context(dueTask))).isEqualTo(-4);
    }

    @Test
    void atcShouldDecayWithSlack() {
        // slack = 20000 - 4000 - 2000 = 14000; k·p̄ = 2 · 5000
        double expected = -(1.0 / 4000) * Math.exp(-14000.0 / 10000.0);

        assertThat(new ApparentTardinessCost().evaluate(a, context(dueTask))).isCloseTo(expected, within(1e-12));

        SchedulingContext late = SchedulingContext.builder().currentTimeMs(30_000).task(dueTask)
                .processingMs("A", 4000).build();
        assertThat(new ApparentTardinessCost().evaluate(a, late)).isCloseTo(-1.0 / 4000, within(1e-12));
    }

    @Test
    void atcShouldRejectNonPositiveK() {
        assertThatThrownBy(() -> new ApparentTardinessCost(0)).isInstanceOf(InvalidSpecException.class);
        assertThat(new ApparentTardinessCost(3.5).getK()).isEqualTo(3.5);
    }
}
