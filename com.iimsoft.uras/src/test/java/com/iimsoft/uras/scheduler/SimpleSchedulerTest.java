package com.iimsoft.uras.scheduler;

import com.iimsoft.uras.TestProblems;
import com.iimsoft.uras.dispatching.RuleEngine;
import com.iimsoft.uras.dispatching.rule.ShortestProcessingTime;
import com.iimsoft.uras.domain.Assignment;
import com.iimsoft.uras.domain.Calendar;
import com.iimsoft.uras.domain.Interval;
import com.iimsoft.uras.domain.PrecedenceConstraint;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.Resource;
import com.iimsoft.uras.domain.SchedulingProblem;
import com.iimsoft.uras.score.ObjectiveWeights;
import org.junit.jupiter.api.Test;

import static com.iimsoft.uras.TestProblems.activity;
import static com.iimsoft.uras.TestProblems.machine;
import static com.iimsoft.uras.TestProblems.task;
import static org.assertj.core.api.Assertions.assertThat;

class SimpleSchedulerTest {

    @Test
    void shouldPickEarliestFinishingResource() {
        SolveResult result = new SimpleScheduler().solve(new ProblemIndex(TestProblems.singleActivityTwoMachines()));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.FEASIBLE);
        Assignment a1 = result.getSchedule().get("A1").orElseThrow();
        assertThat(a1.getResourceId()).isEqualTo("M1");
        assertThat(a1.getStartMs()).isZero();
        assertThat(result.getSchedule().getMakespanMs()).isEqualTo(5000);
        assertThat(result.isProvenOptimal()).isFalse();
    }

    @Test
    void shouldFollowDispatchingRuleOnConflict() {
        SolveResult byPriority = new SimpleScheduler()
                .solve(new ProblemIndex(TestProblems.priorityVersusSoftDeadline()));
        SolveResult bySpt = new SimpleScheduler(RuleEngine.of(new ShortestProcessingTime()), ObjectiveWeights.DEFAULT)
                .solve(new ProblemIndex(TestProblems.priorityVersusSoftDeadline()));

        assertThat(byPriority.getSchedule().get("L1").orElseThrow().getStartMs()).isZero();
        assertThat(byPriority.getEvaluation().getCost()).isEqualTo(9000);
        assertThat(byPriority.getStats().get("dispatchDecisions")).isEqualTo(1);

        assertThat(bySpt.getSchedule().get("S1").orElseThrow().getStartMs()).isZero();
        assertThat(bySpt.getEvaluation().getCost()).isEqualTo(5000);
    }

    @Test
    void unreachableHardDeadlineShouldBeInfeasible() {
        SolveResult result = new SimpleScheduler().solve(new ProblemIndex(TestProblems.unreachableDeadline()));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.hasSchedule()).isFalse();
        assertThat(result.getMessage()).contains("A2");
    }

    @Test
    void precedenceDelayAndCalendarShouldShiftStart() {
        Resource welder = Resource.builder().id("W1").category("machine")
                .calendar(Calendar.of(new Interval(0, 2000), new Interval(6000, 20_000)))
                .build();
        SchedulingProblem problem = SchedulingProblem.builder()
                .resource(machine("M1"))
                .resource(welder)
                .task(task("T1",
                        activity("A", "T1", 1, 3000, "M1"),
                        activity("B", "T1", 2, 1000, "W1")))
                .constraint(new PrecedenceConstraint("A", "B", 500))
                .build();

        SolveResult result = new SimpleScheduler().solve(new ProblemIndex(problem));

        // A 结束 3000，+500 间隔 = 3500，焊机 [2000, 6000) 不可用
        assertThat(result.getSchedule().get("B").orElseThrow().getStartMs()).isEqualTo(6000);
        assertThat(result.getSchedule().getMakespanMs()).isEqualTo(7000);
    }

    @Test
    void emptyProblemShouldYieldEmptySchedule() {
        SolveResult result = new SimpleScheduler().solve(new ProblemIndex(SchedulingProblem.builder().build()));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(result.getSchedule().size()).isZero();
    }
}
