package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.exception.InvalidSpecException;

/**
 * ATC(k)：
 * <pre>
 * index = (1/p) · exp(-max(0, due - p - now) / (k · p̄))
 * key   = -index
 * </pre>
 * 指数越大越该先做，所以返回其相反数。没有交期的活动 index 为 0。
 */
public final class ApparentTardinessCost implements DispatchingRule {

    public static final double DEFAULT_K = 2.0;

    private final double k;

    public ApparentTardinessCost(double k) {
        if (!(k > 0)) {
            throw new InvalidSpecException("ATC k 必须 > 0: " + k);
        }
        this.k = k;
    }

    public ApparentTardinessCost() {
        this(DEFAULT_K);
    }

    public double getK() {
        return k;
    }

    @Override
    public String name() {
        return "ATC";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        if (task == null || task.getDueMs() == null) {
            return 0.0;
        }
        double p = Math.max(1.0, context.processingMs(activity));
        double slack = (double) task.getDueMs() - p - context.getCurrentTimeMs();
        double index = (1.0 / p) * Math.exp(-Math.max(0.0, slack) / (k * context.averageProcessingMs()));
        return -index;
    }

    @Override
    public String description() {
        return "Apparent tardiness cost (k=" + k + ")";
    }
}
