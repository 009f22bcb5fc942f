package com.iimsoft.uras.dispatching;

public enum EvaluationMode {
    /** 主规则比较，相等时依次用后续规则打破平局 */
    SEQUENTIAL,
    /** 所有规则键按权重加权求和后比较 */
    WEIGHTED
}
