package com.iimsoft.uras.ga;

/** 工序序列向量上的交叉方式，资源向量始终用均匀交叉 */
public enum CrossoverType {
    /** Precedence-preserving order crossover：按任务划分，一组任务的工序位置继承父代 1，其余按父代 2 的顺序填充 */
    POX,
    /** Linear order crossover：保留父代 1 的一段，其余按父代 2 的顺序填充 */
    LOX
}
