package com.iimsoft.uras.exception;

/**
 * 失败分类。
 */
public enum ErrorKind {
    /** 参数非法（时间窗、PERT、资源效率、引用不存在等），在任何算法运行前拒绝 */
    INVALID_SPEC,
    /** 不存在满足全部硬约束的排程 */
    INFEASIBLE,
    /** 搜索预算耗尽（不是错误，正常返回 best-found） */
    BUDGET_EXCEEDED,
    /** KPI/评估拿到的排程引用了未知的 activity 或 resource */
    INCONSISTENT_SCHEDULE,
    /** 输入已通过校验后出现的程序错误，不应归咎于请求 */
    INTERNAL_ERROR
}
