package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;

/** 最长加工时间优先 */
public final class LongestProcessingTime implements DispatchingRule {

    @Override
    public String name() {
        return "LPT";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        return -(double) context.processingMs(activity);
    }
}
