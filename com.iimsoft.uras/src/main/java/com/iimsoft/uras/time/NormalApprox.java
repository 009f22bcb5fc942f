package com.iimsoft.uras.time;

/**
 * 标准正态分布的解析近似（不做采样，保证结果可复现）。
 */
final class NormalApprox {

    private NormalApprox() {
    }

    /**
     * 置信度 -> z 值（Abramowitz-Stegun 26.2.23）。
     * confidence <= 0.5 返回 0；>= 0.999 截断为 3.09。
     */
    static double confidenceToZ(double confidence) {
        if (confidence <= 0.5) {
            return 0.0;
        }
        if (confidence >= 0.999) {
            return 3.09;
        }
        double t = Math.sqrt(-2.0 * Math.log(1.0 - confidence));
        double c0 = 2.515517, c1 = 0.802853, c2 = 0.010328;
        double d1 = 1.432788, d2 = 0.189269, d3 = 0.001308;
        return t - (c0 + c1 * t + c2 * t * t) / (1.0 + d1 * t + d2 * t * t + d3 * t * t * t);
    }

    /** 标准正态 CDF（Zelen-Severo 多项式近似） */
    static double cdf(double x) {
        double t = 1.0 / (1.0 + 0.2316419 * Math.abs(x));
        double d = 0.3989423 * Math.exp(-x * x / 2.0);
        double p = d * t * (0.3193815 + t * (-0.3565638 + t * (1.781478 + t * (-1.821256 + t * 1.330274))));
        return x > 0 ? 1.0 - p : p;
    }
}
