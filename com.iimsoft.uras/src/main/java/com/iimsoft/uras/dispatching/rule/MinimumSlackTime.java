package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/** slack = due - now - remaining */
public final class MinimumSlackTime implements DispatchingRule {

    @Override
    public String name() {
        return "MST";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        if (task == null || task.getDueMs() == null) {
            return Double.MAX_VALUE;
        }
        return (double) task.getDueMs() - context.getCurrentTimeMs() - context.remainingWorkMs(task.getId());
    }
}
