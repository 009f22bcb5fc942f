package com.iimsoft.uras.time;

import com.iimsoft.uras.exception.ErrorKind;
import com.iimsoft.uras.exception.InvalidSpecException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PertEstimateTest {

    @Test
    void meanShouldFollowThreePointFormula() {
        PertEstimate e = new PertEstimate(4000, 6000, 14000);

        assertThat(e.meanMs()).isEqualTo(7000.0);
        assertThat(e.stdDevMs()).isCloseTo(1666.67, within(0.01));
        assertThat(e.varianceMs()).isCloseTo(e.stdDevMs() * e.stdDevMs(), within(1e-6));
    }

    @Test
    void meanShouldGrowWithEachParameter() {
        PertEstimate base = new PertEstimate(4000, 6000, 14000);

        assertThat(new PertEstimate(5000, 6000, 14000).meanMs()).isGreaterThan(base.meanMs());
        assertThat(new PertEstimate(4000, 7000, 14000).meanMs()).isGreaterThan(base.meanMs());
        assertThat(new PertEstimate(4000, 6000, 15000).meanMs()).isGreaterThan(base.meanMs());
    }

    @Test
    void quantilesShouldBeOrderedAndClamped() {
        PertEstimate e = new PertEstimate(4000, 6000, 14000);

        assertThat(e.p50()).isEqualTo(7000);
        assertThat(e.p85()).isGreaterThan(e.p50());
        assertThat(e.p95()).isGreaterThan(e.p85()).isLessThanOrEqualTo(14000);
        // z(0.95) ≈ 1.645
        assertThat(e.p95()).isBetween(9700L, 9800L);
        assertThat(e.durationAtConfidence(0.9999)).isLessThanOrEqualTo(14000);
        assertThat(e.durationAtConfidence(0.1)).isEqualTo(7000);
    }

    @Test
    void probabilityOfCompletionShouldBeHalfAtMean() {
        PertEstimate e = new PertEstimate(4000, 6000, 14000);

        assertThat(e.probabilityOfCompletion(7000)).isCloseTo(0.5, within(0.01));
        assertThat(e.probabilityOfCompletion(14000)).isGreaterThan(0.99);
        assertThat(e.probabilityOfCompletion(e.p95())).isCloseTo(0.95, within(0.01));
    }

    @Test
    void degenerateEstimateShouldBeCertain() {
        PertEstimate e = new PertEstimate(5000, 5000, 5000);

        assertThat(e.stdDevMs()).isZero();
        assertThat(e.probabilityOfCompletion(5000)).isEqualTo(1.0);
        assertThat(e.probabilityOfCompletion(4999)).isEqualTo(0.0);
        assertThat(e.p95()).isEqualTo(5000);
    }

    @Test
    void factoriesShouldSpreadAroundBase() {
        assertThat(PertEstimate.symmetric(6000, 1000)).isEqualTo(new PertEstimate(5000, 6000, 7000));
        assertThat(PertEstimate.fromVariance(10000, 0.2)).isEqualTo(new PertEstimate(8000, 10000, 12000));
    }

    @Test
    void unorderedTripleShouldBeRejected() {
        assertThatThrownBy(() -> new PertEstimate(6000, 4000, 14000))
                .isInstanceOf(InvalidSpecException.class)
                .extracting(e -> ((InvalidSpecException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_SPEC);
        assertThatThrownBy(() -> new PertEstimate(4000, 15000, 14000)).isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> new PertEstimate(-1, 0, 10)).isInstanceOf(InvalidSpecException.class);
    }
}
