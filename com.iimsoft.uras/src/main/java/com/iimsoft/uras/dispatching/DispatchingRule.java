package com.iimsoft.uras.dispatching;

import com.iimsoft.uras.domain.Activity;

/**
 * 派工规则：给定上下文和一个活动，返回可比较的优先级键。键越小越先派工。
 * <p>
 * 实现必须是纯函数：相同输入总是相同输出，不修改上下文。
 */
public interface DispatchingRule {

    String name();

    double evaluate(Activity activity, SchedulingContext context);

    default String description() {
        return name();
    }
}
