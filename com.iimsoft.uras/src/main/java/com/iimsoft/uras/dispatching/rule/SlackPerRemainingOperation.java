package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/**
 * S/RO = (due - now - remaining) / max(1, 剩余工序数)
 */
public final class SlackPerRemainingOperation implements DispatchingRule {

    @Override
    public String name() {
        return "S/RO";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        if (task == null || task.getDueMs() == null) {
            return Double.MAX_VALUE;
        }
        double slack = (double) task.getDueMs() - context.getCurrentTimeMs() - context.remainingWorkMs(task.getId());
        return slack / Math.max(1, context.remainingOps(task.getId()));
    }
}
