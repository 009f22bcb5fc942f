package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;

public final class MostWorkRemaining implements DispatchingRule {

    @Override
    public String name() {
        return "MWKR";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        return -(double) context.remainingWorkMs(activity.getTaskId());
    }
}
