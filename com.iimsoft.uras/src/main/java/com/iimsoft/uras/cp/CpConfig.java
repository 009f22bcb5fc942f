package com.iimsoft.uras.cp;

/**
 * CP 求解参数。null / 非正值的含义见各字段。
 */
public class CpConfig {
    public long timeLimitMs = 10_000L;
    public long nodeLimit = 1_000_000L;
    public double makespanWeight = 1.0;
    public double penaltyWeight = 1.0;
    /** 时间网格步长；null 表示按所有时长 / 边界的最大公约数推导 */
    public Long timeStepMs = null;
    /** 每个活动开始时间的最大网格点数，超过则加粗步长（此时不再宣称最优） */
    public int maxTimeSlots = 4096;
    /** 1 = 单线程；>1 时按根节点分支并行 */
    public int parallelWorkers = 1;
    /** 先跑一遍贪心作为初始上界 */
    public boolean seedWithGreedy = true;
    /** 找到第一个可行解即返回 */
    public boolean stopAfterFirst = false;
}
