package com.iimsoft.uras.time;

public enum WindowType {
    /** 违反即不可行 */
    HARD,
    /** 违反按 penaltyPerMs × 超出毫秒 计罚 */
    SOFT
}
