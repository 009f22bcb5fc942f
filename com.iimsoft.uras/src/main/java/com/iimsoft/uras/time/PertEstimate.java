package com.iimsoft.uras.time;

import com.iimsoft.uras.exception.InvalidSpecException;

import java.util.Objects;

/**
 * 三点估计（Beta-PERT）。
 * <pre>
 * mean = (o + 4m + p) / 6
 * sd   = (p - o) / 6
 * </pre>
 * 分位数用 mean + z·sd，并截断在 [o, p] 内（Beta 分布有界）。
 */
public final class PertEstimate {

    private final long optimisticMs;
    private final long mostLikelyMs;
    private final long pessimisticMs;

    public PertEstimate(long optimisticMs, long mostLikelyMs, long pessimisticMs) {
        if (optimisticMs < 0) {
            throw new InvalidSpecException("PERT optimistic 不能为负数: " + optimisticMs);
        }
        if (optimisticMs > mostLikelyMs || mostLikelyMs > pessimisticMs) {
            throw new InvalidSpecException("PERT 需满足 optimistic <= mostLikely <= pessimistic: ("
                    + optimisticMs + ", " + mostLikelyMs + ", " + pessimisticMs + ")");
        }
        this.optimisticMs = optimisticMs;
        this.mostLikelyMs = mostLikelyMs;
        this.pessimisticMs = pessimisticMs;
    }

    /** base ± base×ratio */
    public static PertEstimate fromVariance(long baseMs, double varianceRatio) {
        long spread = (long) (baseMs * varianceRatio);
        return new PertEstimate(baseMs - spread, baseMs, baseMs + spread);
    }

    public static PertEstimate symmetric(long mostLikelyMs, long spreadMs) {
        return new PertEstimate(mostLikelyMs - spreadMs, mostLikelyMs, mostLikelyMs + spreadMs);
    }

    public double meanMs() {
        return (optimisticMs + 4.0 * mostLikelyMs + pessimisticMs) / 6.0;
    }

    public double stdDevMs() {
        return (pessimisticMs - optimisticMs) / 6.0;
    }

    public double varianceMs() {
        double sd = stdDevMs();
        return sd * sd;
    }

    public long durationAtConfidence(double confidence) {
        double z = NormalApprox.confidenceToZ(confidence);
        long d = (long) (meanMs() + z * stdDevMs());
        return Math.max(optimisticMs, Math.min(pessimisticMs, d));
    }

    /** P(实际耗时 <= durationMs) */
    public double probabilityOfCompletion(long durationMs) {
        double sd = stdDevMs();
        if (sd == 0) {
            return durationMs >= meanMs() ? 1.0 : 0.0;
        }
        return NormalApprox.cdf((durationMs - meanMs()) / sd);
    }

    public long p50() {
        return (long) meanMs();
    }

    public long p85() {
        return durationAtConfidence(0.85);
    }

    public long p95() {
        return durationAtConfidence(0.95);
    }

    public long getOptimisticMs() {
        return optimisticMs;
    }

    public long getMostLikelyMs() {
        return mostLikelyMs;
    }

    public long getPessimisticMs() {
        return pessimisticMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PertEstimate)) return false;
        PertEstimate that = (PertEstimate) o;
        return optimisticMs == that.optimisticMs && mostLikelyMs == that.mostLikelyMs && pessimisticMs == that.pessimisticMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(optimisticMs, mostLikelyMs, pessimisticMs);
    }

    @Override
    public String toString() {
        return "PERT(" + optimisticMs + ", " + mostLikelyMs + ", " + pessimisticMs + ")";
    }
}
