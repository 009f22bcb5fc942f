package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;

import java.util.List;

/**
 * 候选资源上已排队的加工时间（取最空闲的候选）。
 */
public final class WorkInNextQueue implements DispatchingRule {

    @Override
    public String name() {
        return "WINQ";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        List<String> cands = context.candidatesOf(activity);
        if (cands.isEmpty()) {
            return 0.0;
        }
        long min = Long.MAX_VALUE;
        for (String r : cands) {
            min = Math.min(min, context.queuedWorkMs(r));
        }
        return min;
    }
}
