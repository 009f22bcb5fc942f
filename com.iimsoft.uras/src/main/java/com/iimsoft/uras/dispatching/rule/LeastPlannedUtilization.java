package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;

import java.util.List;

/** 候选资源当前利用率最低者优先 */
public final class LeastPlannedUtilization implements DispatchingRule {

    @Override
    public String name() {
        return "LPUL";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        List<String> cands = context.candidatesOf(activity);
        if (cands.isEmpty()) {
            return 0.0;
        }
        double min = Double.MAX_VALUE;
        for (String r : cands) {
            min = Math.min(min, context.utilizationOf(r));
        }
        return min;
    }
}
