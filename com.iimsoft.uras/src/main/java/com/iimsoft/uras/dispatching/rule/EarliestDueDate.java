package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/** 最早交期优先；无交期排最后 */
public final class EarliestDueDate implements DispatchingRule {

    @Override
    public String name() {
        return "EDD";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        if (task == null || task.getDueMs() == null) {
            return Double.MAX_VALUE;
        }
        return task.getDueMs();
    }
}
