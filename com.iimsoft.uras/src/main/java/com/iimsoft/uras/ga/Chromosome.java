package com.iimsoft.uras.ga;

import com.iimsoft.uras.score.Evaluation;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

/**
 * 双向量染色体，都按活动下标寻址：
 * <ul>
 *   <li>sequence：所有活动下标的一个排列，解码时按此顺序落位</li>
 *   <li>resource：resource[a] 是活动 a 在其允许资源集合里的位置</li>
 * </ul>
 */
public final class Chromosome {

    final int[] sequence;
    final int[] resource;
    Evaluation evaluation;

    Chromosome(int n) {
        this.sequence = new int[n];
        this.resource = new int[n];
    }

    Chromosome(int[] sequence, int[] resource) {
        this.sequence = sequence;
        this.resource = resource;
    }

    Chromosome copy() {
        Chromosome c = new Chromosome(sequence.clone(), resource.clone());
        c.evaluation = this.evaluation;
        return c;
    }

    public int[] getSequence() {
        return sequence.clone();
    }

    public int[] getResource() {
        return resource.clone();
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    /** 未评估时视为最差 */
    HardSoftLongScore score() {
        return evaluation == null ? HardSoftLongScore.of(Long.MIN_VALUE, Long.MIN_VALUE) : evaluation.getScore();
    }

    int size() {
        return sequence.length;
    }
}
