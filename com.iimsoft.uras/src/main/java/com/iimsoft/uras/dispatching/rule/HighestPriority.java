package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/** 任务优先级高者先（priority 越大越紧急） */
public final class HighestPriority implements DispatchingRule {

    @Override
    public String name() {
        return "PRIORITY";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        return task == null ? 0.0 : -(double) task.getPriority();
    }
}
