package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;

/** 任务剩余工作量最少优先 */
public final class LeastWorkRemaining implements DispatchingRule {

    @Override
    public String name() {
        return "LWKR";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        return context.remainingWorkMs(activity.getTaskId());
    }
}
