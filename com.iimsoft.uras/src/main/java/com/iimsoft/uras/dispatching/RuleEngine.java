package com.iimsoft.uras.dispatching;

import com.iimsoft.uras.domain.Activity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 多层派工引擎：一条主规则 + 有序的平局规则链，最终按活动 id 定序。
 * <p>
 * 比较是全序：每个键先规范化（-0.0 -> 0.0，NaN -> +MAX），再用 Double.compare 精确比较，
 * 最后用 id 字典序兜底，所以相同输入永远得到相同顺序。
 */
public final class RuleEngine {

    public static final class WeightedRule {
        private final DispatchingRule rule;
        private final double weight;

        public WeightedRule(DispatchingRule rule, double weight) {
            this.rule = Objects.requireNonNull(rule, "rule");
            this.weight = weight;
        }

        public DispatchingRule getRule() {
            return rule;
        }

        public double getWeight() {
            return weight;
        }
    }

    private final List<WeightedRule> rules;
    private final EvaluationMode mode;

    private RuleEngine(List<WeightedRule> rules, EvaluationMode mode) {
        this.rules = List.copyOf(rules);
        this.mode = mode;
    }

    public static RuleEngine of(DispatchingRule primary, DispatchingRule... tieBreakers) {
        Builder b = builder().rule(primary);
        for (DispatchingRule r : tieBreakers) {
            b.rule(r);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<WeightedRule> getRules() {
        return rules;
    }

    public EvaluationMode getMode() {
        return mode;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /** 每条规则的原始键（顺序同规则链） */
    public double[] evaluate(Activity activity, SchedulingContext context) {
        double[] keys = new double[rules.size()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = normalize(rules.get(i).getRule().evaluate(activity, context));
        }
        return keys;
    }

    private double weightedSum(double[] keys) {
        double sum = 0;
        for (int i = 0; i < keys.length; i++) {
            double w = rules.get(i).getWeight();
            if (w != 0) {
                sum += w * keys[i];
            }
        }
        return normalize(sum);
    }

    private static double normalize(double v) {
        if (Double.isNaN(v)) {
            return Double.MAX_VALUE;
        }
        return v == 0.0 ? 0.0 : v;
    }

    /**
     * 稳定排序：返回新列表，入参不变。
     */
    public List<Activity> sort(Collection<Activity> activities, SchedulingContext context) {
        List<Scored> scored = new ArrayList<>(activities.size());
        for (Activity a : activities) {
            double[] keys = evaluate(a, context);
            scored.add(new Scored(a, keys, mode == EvaluationMode.WEIGHTED ? weightedSum(keys) : 0.0));
        }
        scored.sort(scoredComparator());
        List<Activity> out = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            out.add(s.activity);
        }
        return out;
    }

    public Optional<Activity> selectBest(Collection<Activity> activities, SchedulingContext context) {
        List<Activity> sorted = sort(activities, context);
        return sorted.isEmpty() ? Optional.empty() : Optional.of(sorted.get(0));
    }

    /** 基于给定上下文的比较器（每次比较都会重新求值，适合小集合） */
    public Comparator<Activity> comparator(SchedulingContext context) {
        return (x, y) -> {
            double[] kx = evaluate(x, context);
            double[] ky = evaluate(y, context);
            return compare(new Scored(x, kx, mode == EvaluationMode.WEIGHTED ? weightedSum(kx) : 0.0),
                    new Scored(y, ky, mode == EvaluationMode.WEIGHTED ? weightedSum(ky) : 0.0));
        };
    }

    private Comparator<Scored> scoredComparator() {
        return this::compare;
    }

    private int compare(Scored x, Scored y) {
        if (mode == EvaluationMode.WEIGHTED) {
            int c = Double.compare(x.sum, y.sum);
            if (c != 0) {
                return c;
            }
        } else {
            for (int i = 0; i < x.keys.length; i++) {
                int c = Double.compare(x.keys[i], y.keys[i]);
                if (c != 0) {
                    return c;
                }
            }
        }
        return x.activity.getId().compareTo(y.activity.getId());
    }

    private static final class Scored {
        final Activity activity;
        final double[] keys;
        final double sum;

        Scored(Activity activity, double[] keys, double sum) {
            this.activity = activity;
            this.keys = keys;
            this.sum = sum;
        }
    }

    public static final class Builder {
        private final List<WeightedRule> rules = new ArrayList<>();
        private EvaluationMode mode = EvaluationMode.SEQUENTIAL;

        private Builder() {
        }

        public Builder rule(DispatchingRule rule) {
            rules.add(new WeightedRule(rule, 1.0));
            return this;
        }

        public Builder rule(DispatchingRule rule, double weight) {
            rules.add(new WeightedRule(rule, weight));
            return this;
        }

        public Builder mode(EvaluationMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public RuleEngine build() {
            return new RuleEngine(rules, mode);
        }
    }
}
