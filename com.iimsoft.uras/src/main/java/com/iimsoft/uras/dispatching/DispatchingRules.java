package com.iimsoft.uras.dispatching;

import com.iimsoft.uras.exception.InvalidSpecException;

import java.util.List;
import java.util.Map;

/**
 * 从配置（规则名列表 + 模式 + 权重 + 参数）组装 {@link RuleEngine}。
 */
public final class DispatchingRules {

    /** 默认链：优先级 -> 交期 -> 最短加工 */
    public static final List<String> DEFAULT_CHAIN = List.of("PRIORITY", "EDD", "SPT");

    private DispatchingRules() {
    }

    public static RuleEngine defaultEngine() {
        return fromNames(DEFAULT_CHAIN, EvaluationMode.SEQUENTIAL, null, null);
    }

    public static RuleEngine fromNames(List<String> names,
                                       EvaluationMode mode,
                                       List<Double> weights,
                                       Map<String, Double> params) {
        List<String> chain = (names == null || names.isEmpty()) ? DEFAULT_CHAIN : names;
        if (weights != null && !weights.isEmpty() && weights.size() != chain.size()) {
            throw new InvalidSpecException("派工权重个数(" + weights.size() + ")与规则个数(" + chain.size() + ")不一致");
        }
        RuleEngine.Builder b = RuleEngine.builder().mode(mode == null ? EvaluationMode.SEQUENTIAL : mode);
        for (int i = 0; i < chain.size(); i++) {
            DispatchingRule rule = BuiltinRule.fromName(chain.get(i)).create(params);
            double w = (weights == null || weights.isEmpty()) ? 1.0 : weights.get(i);
            b.rule(rule, w);
        }
        return b.build();
    }
}
