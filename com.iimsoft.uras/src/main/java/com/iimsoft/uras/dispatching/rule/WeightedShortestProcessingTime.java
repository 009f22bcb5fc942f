package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/** p / w，权重取任务优先级（至少为 1） */
public final class WeightedShortestProcessingTime implements DispatchingRule {

    @Override
    public String name() {
        return "WSPT";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Task task = context.taskOf(activity);
        int weight = task == null ? 1 : Math.max(1, task.getPriority());
        return (double) context.processingMs(activity) / weight;
    }
}
