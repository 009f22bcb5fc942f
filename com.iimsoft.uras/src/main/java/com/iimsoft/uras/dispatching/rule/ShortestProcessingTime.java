package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;

/** 最短加工时间优先 */
public final class ShortestProcessingTime implements DispatchingRule {

    @Override
    public String name() {
        return "SPT";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        return context.processingMs(activity);
    }
}
