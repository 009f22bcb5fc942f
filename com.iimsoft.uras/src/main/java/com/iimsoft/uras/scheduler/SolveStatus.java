package com.iimsoft.uras.scheduler;

public enum SolveStatus {
    /** 搜索穷尽，已证明最优 */
    OPTIMAL,
    /** 找到可行解，未证明最优（贪心 / GA 的正常结果） */
    FEASIBLE,
    /** 预算耗尽，返回目前最好的解（可能为空） */
    BUDGET_EXCEEDED,
    /** 不存在满足全部硬约束的排程 */
    INFEASIBLE
}
