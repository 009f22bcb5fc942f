package com.iimsoft.uras.score;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.Getter;

/**
 * 软目标权重：cost = makespanWeight × makespan + penaltyWeight × 软罚分
 */
@Getter
public final class ObjectiveWeights {

    public static final ObjectiveWeights DEFAULT = new ObjectiveWeights(1.0, 1.0);

    private final double makespanWeight;
    private final double penaltyWeight;

    public ObjectiveWeights(double makespanWeight, double penaltyWeight) {
        if (makespanWeight < 0 || penaltyWeight < 0 || Double.isNaN(makespanWeight) || Double.isNaN(penaltyWeight)) {
            throw new InvalidSpecException("目标权重不能为负数: makespan=" + makespanWeight + ", penalty=" + penaltyWeight);
        }
        this.makespanWeight = makespanWeight;
        this.penaltyWeight = penaltyWeight;
    }

    public static ObjectiveWeights of(Double makespanWeight, Double penaltyWeight) {
        return new ObjectiveWeights(makespanWeight == null ? 1.0 : makespanWeight,
                penaltyWeight == null ? 1.0 : penaltyWeight);
    }

    public long cost(long makespanMs, double penalty) {
        return Math.round(makespanWeight * makespanMs + penaltyWeight * penalty);
    }
}
