package com.iimsoft.uras.score;

import com.iimsoft.uras.domain.Violation;
import lombok.Getter;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import java.util.List;

/**
 * 一次排程评估的结果。score 越大越好（OptaPlanner 约定）；cost 是软目标的正数形式。
 */
@Getter
public final class Evaluation {

    private final HardSoftLongScore score;
    private final List<Violation> violations;
    private final long makespanMs;
    private final double penalty;
    private final long cost;

    public Evaluation(HardSoftLongScore score, List<Violation> violations, long makespanMs, double penalty, long cost) {
        this.score = score;
        this.violations = List.copyOf(violations);
        this.makespanMs = makespanMs;
        this.penalty = penalty;
        this.cost = cost;
    }

    public boolean isFeasible() {
        return score.hardScore() >= 0;
    }

    public List<Violation> hardViolations() {
        return violations.stream().filter(Violation::isHard).toList();
    }

    public List<Violation> softViolations() {
        return violations.stream().filter(v -> !v.isHard()).toList();
    }

    @Override
    public String toString() {
        return "Evaluation[" + score + ", makespan=" + makespanMs + ", penalty=" + penalty + "]";
    }
}
