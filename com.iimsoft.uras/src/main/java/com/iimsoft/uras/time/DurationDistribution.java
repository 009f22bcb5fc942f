package com.iimsoft.uras.time;

import com.iimsoft.uras.exception.InvalidSpecException;

import java.util.Objects;

/**
 * 持续时间分布。均值和分位数都是解析计算的，不做蒙特卡洛。
 */
public abstract class DurationDistribution {

    public enum Kind {
        FIXED, PERT, UNIFORM, TRIANGULAR, LOG_NORMAL
    }

    private DurationDistribution() {
    }

    public abstract Kind getKind();

    /** 期望持续时间（毫秒） */
    public abstract double expectedMs();

    /** 给定置信度下的持续时间（分位数），confidence 取 [0,1] */
    public abstract long quantileMs(double confidence);

    public long p95() {
        return quantileMs(0.95);
    }

    public static DurationDistribution fixed(long ms) {
        return new Fixed(ms);
    }

    public static DurationDistribution pert(long optimisticMs, long mostLikelyMs, long pessimisticMs) {
        return new Pert(new PertEstimate(optimisticMs, mostLikelyMs, pessimisticMs));
    }

    public static DurationDistribution pert(PertEstimate estimate) {
        return new Pert(estimate);
    }

    public static DurationDistribution uniform(long minMs, long maxMs) {
        return new Uniform(minMs, maxMs);
    }

    public static DurationDistribution triangular(long minMs, long modeMs, long maxMs) {
        return new Triangular(minMs, modeMs, maxMs);
    }

    public static DurationDistribution logNormal(double mu, double sigma) {
        return new LogNormal(mu, sigma);
    }

    private static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            throw new InvalidSpecException("confidence 不能为 NaN");
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    public static final class Fixed extends DurationDistribution {
        private final long ms;

        private Fixed(long ms) {
            if (ms < 0) {
                throw new InvalidSpecException("固定时长不能为负数: " + ms);
            }
            this.ms = ms;
        }

        public long getMs() {
            return ms;
        }

        @Override
        public Kind getKind() {
            return Kind.FIXED;
        }

        @Override
        public double expectedMs() {
            return ms;
        }

        @Override
        public long quantileMs(double confidence) {
            return ms;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Fixed && ((Fixed) o).ms == ms;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(ms);
        }

        @Override
        public String toString() {
            return "Fixed(" + ms + ")";
        }
    }

    public static final class Pert extends DurationDistribution {
        private final PertEstimate estimate;

        private Pert(PertEstimate estimate) {
            this.estimate = Objects.requireNonNull(estimate, "estimate");
        }

        public PertEstimate getEstimate() {
            return estimate;
        }

        @Override
        public Kind getKind() {
            return Kind.PERT;
        }

        @Override
        public double expectedMs() {
            return estimate.meanMs();
        }

        @Override
        public long quantileMs(double confidence) {
            return estimate.durationAtConfidence(clampConfidence(confidence));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pert && ((Pert) o).estimate.equals(estimate);
        }

        @Override
        public int hashCode() {
            return estimate.hashCode();
        }

        @Override
        public String toString() {
            return estimate.toString();
        }
    }

    public static final class Uniform extends DurationDistribution {
        private final long minMs;
        private final long maxMs;

        private Uniform(long minMs, long maxMs) {
            if (minMs < 0 || maxMs < minMs) {
                throw new InvalidSpecException("Uniform 需满足 0 <= min <= max: (" + minMs + ", " + maxMs + ")");
            }
            this.minMs = minMs;
            this.maxMs = maxMs;
        }

        public long getMinMs() {
            return minMs;
        }

        public long getMaxMs() {
            return maxMs;
        }

        @Override
        public Kind getKind() {
            return Kind.UNIFORM;
        }

        @Override
        public double expectedMs() {
            return (minMs + maxMs) / 2.0;
        }

        @Override
        public long quantileMs(double confidence) {
            return minMs + (long) ((maxMs - minMs) * clampConfidence(confidence));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Uniform)) return false;
            Uniform u = (Uniform) o;
            return u.minMs == minMs && u.maxMs == maxMs;
        }

        @Override
        public int hashCode() {
            return Objects.hash(minMs, maxMs);
        }

        @Override
        public String toString() {
            return "Uniform(" + minMs + ", " + maxMs + ")";
        }
    }

    public static final class Triangular extends DurationDistribution {
        private final long minMs;
        private final long modeMs;
        private final long maxMs;

        private Triangular(long minMs, long modeMs, long maxMs) {
            if (minMs < 0 || minMs > modeMs || modeMs > maxMs) {
                throw new InvalidSpecException("Triangular 需满足 0 <= min <= mode <= max: ("
                        + minMs + ", " + modeMs + ", " + maxMs + ")");
            }
            this.minMs = minMs;
            this.modeMs = modeMs;
            this.maxMs = maxMs;
        }

        public long getMinMs() {
            return minMs;
        }

        public long getModeMs() {
            return modeMs;
        }

        public long getMaxMs() {
            return maxMs;
        }

        @Override
        public Kind getKind() {
            return Kind.TRIANGULAR;
        }

        @Override
        public double expectedMs() {
            return (minMs + modeMs + maxMs) / 3.0;
        }

        @Override
        public long quantileMs(double confidence) {
            if (maxMs == minMs) {
                return minMs;
            }
            double c = clampConfidence(confidence);
            double range = maxMs - minMs;
            double fc = (modeMs - minMs) / range;
            if (c < fc) {
                return minMs + (long) Math.sqrt(range * (modeMs - minMs) * c);
            }
            return maxMs - (long) Math.sqrt(range * (maxMs - modeMs) * (1.0 - c));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Triangular)) return false;
            Triangular t = (Triangular) o;
            return t.minMs == minMs && t.modeMs == modeMs && t.maxMs == maxMs;
        }

        @Override
        public int hashCode() {
            return Objects.hash(minMs, modeMs, maxMs);
        }

        @Override
        public String toString() {
            return "Triangular(" + minMs + ", " + modeMs + ", " + maxMs + ")";
        }
    }

    /** ln(X) ~ N(mu, sigma²)，X 单位为毫秒 */
    public static final class LogNormal extends DurationDistribution {
        private final double mu;
        private final double sigma;

        private LogNormal(double mu, double sigma) {
            if (Double.isNaN(mu) || Double.isInfinite(mu) || Double.isNaN(sigma) || sigma < 0) {
                throw new InvalidSpecException("LogNormal 参数非法: mu=" + mu + ", sigma=" + sigma);
            }
            this.mu = mu;
            this.sigma = sigma;
        }

        public double getMu() {
            return mu;
        }

        public double getSigma() {
            return sigma;
        }

        @Override
        public Kind getKind() {
            return Kind.LOG_NORMAL;
        }

        @Override
        public double expectedMs() {
            return Math.exp(mu + sigma * sigma / 2.0);
        }

        @Override
        public long quantileMs(double confidence) {
            double z = NormalApprox.confidenceToZ(clampConfidence(confidence));
            return (long) Math.exp(mu + z * sigma);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof LogNormal)) return false;
            LogNormal l = (LogNormal) o;
            return Double.compare(l.mu, mu) == 0 && Double.compare(l.sigma, sigma) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(mu, sigma);
        }

        @Override
        public String toString() {
            return "LogNormal(" + mu + ", " + sigma + ")";
        }
    }
}
