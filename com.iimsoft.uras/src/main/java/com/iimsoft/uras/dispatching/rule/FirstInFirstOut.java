package com.iimsoft.uras.dispatching.rule;

import com.iimsoft.uras.dispatching.DispatchingRule;
import com.iimsoft.uras.dispatching.SchedulingContext;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;

/**
 * 先到先服务：活动就绪时刻，缺省退回任务释放时间，再缺省为 0。
 */
public final class FirstInFirstOut implements DispatchingRule {

    @Override
    public String name() {
        return "FIFO";
    }

    @Override
    public double evaluate(Activity activity, SchedulingContext context) {
        Long ready = context.readyTime(activity);
        if (ready != null) {
            return ready;
        }
        Task task = context.taskOf(activity);
        if (task != null && task.getReleaseMs() != null) {
            return task.getReleaseMs();
        }
        return 0.0;
    }
}
