package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/**
 * CR = (due - now) / remaining。越小越紧急；remaining 为 0 时按 EPSILON 处理。
 */
public final class CriticalRatio implements DispatchingRule {

    static final double EPSILON = 1e-9;

    @Override
    public String name() {
        return "CR";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        if (task == null || task.getDueMs() == null) {
            return Double.MAX_VALUE;
        }
        double timeLeft = (double) task.getDueMs() - context.getCurrentTimeMs();
        double remaining = Math.max(context.remainingWorkMs(task.getId()), EPSILON);
        return timeLeft / remaining;
    }

    @Override
    public String description() {
        return "Critical ratio (time until due / remaining work)";
    }
}
