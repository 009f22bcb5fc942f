package com.iimsoft.uras.ga;

public enum SelectionType {
    TOURNAMENT,
    /** 轮盘赌，权重与代价成反比 */
    ROULETTE
}
