package com.iimsoft.uras.cp;

import com.iimsoft.uras.TestProblems;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.domain.SchedulingProblem;
import org.junit.jupiter.api.Test;

import static com.iimsoft.uras.TestProblems.activity;
import static com.iimsoft.uras.TestProblems.machine;
import static com.iimsoft.uras.TestProblems.task;
import static org.assertj.core.api.Assertions.assertThat;

class ArcConsistencyTest {

    @Test
    void gridShouldUseGcdOfDurations() {
        CpModel model = new CpModel(new ProblemIndex(TestProblems.crossedJobShop()), 10_000, null, 4096);

        assertThat(model.step).isEqualTo(1000);
        assertThat(model.slots).isEqualTo(11);
        assertThat(model.exact).isTrue();
    }

    @Test
    void misalignedOrCoarsenedGridShouldNotBeExact() {
        ProblemIndex index = new ProblemIndex(TestProblems.crossedJobShop());

        assertThat(new CpModel(index, 10_000, 700L, 4096).exact).isFalse();
        CpModel coarse = new CpModel(index, 10_000, null, 3);
        assertThat(coarse.exact).isFalse();
        assertThat(coarse.slots).isLessThanOrEqualTo(3);
    }

    @Test
    void precedenceShouldPruneSuccessorStarts() {
        CpModel model = new CpModel(new ProblemIndex(TestProblems.crossedJobShop()), 10_000, null, 4096);
        DomainStore d = model.initialDomains();
        ArcConsistency ac = new ArcConsistency(model);

        assertThat(ac.propagate(d)).isEqualTo(ArcConsistency.CONSISTENT);
        // J1-2 是下标 1，只能在 M2 上、J1-1 结束(3000)之后开始
        assertThat(d.minSlot(1, 0)).isEqualTo(3);
        // J1-1 必须给 J1-2 留出 2000
        assertThat(d.maxSlot(0, 0)).isEqualTo(5);
        assertThat(ac.minEnd(d, 1)).isEqualTo(5000);
        assertThat(ac.getRevisions()).isPositive();
    }

    @Test
    void unaryResourceShouldRemoveOverlappingStarts() {
        SchedulingProblem problem = SchedulingProblem.builder()
                .resource(machine("M1"))
                .task(task("T1", activity("X", "T1", 1, 3000, "M1")))
                .task(task("T2", activity("Y", "T2", 1, 2000, "M1")))
                .build();
        CpModel model = new CpModel(new ProblemIndex(problem), 5000, null, 4096);
        DomainStore d = model.initialDomains();
        ArcConsistency ac = new ArcConsistency(model);

        d.fix(0, 0, 0);

        assertThat(ac.propagate(d, 0)).isEqualTo(ArcConsistency.CONSISTENT);
        assertThat(d.size(1)).isEqualTo(1);
        assertThat(d.minSlot(1, 0)).isEqualTo(3);
    }

    @Test
    void emptiedDomainShouldBeReported() {
        CpModel model = new CpModel(new ProblemIndex(TestProblems.unreachableDeadline()), 10_000, null, 4096);
        DomainStore d = model.initialDomains();

        assertThat(new ArcConsistency(model).propagate(d)).isEqualTo(1);
    }

    @Test
    void copyShouldLeaveParentUntouched() {
        CpModel model = new CpModel(new ProblemIndex(TestProblems.crossedJobShop()), 10_000, null, 4096);
        DomainStore parent = model.initialDomains();
        long before = parent.totalSize();

        DomainStore child = parent.copy();
        child.fix(0, 0, 2);

        assertThat(parent.totalSize()).isEqualTo(before);
        assertThat(child.size(0)).isEqualTo(1);
        assertThat(child.onlyOption(0)).isZero();
    }
}
