package com.iimsoft.uras.dispatching;

import com.iimsoft.uras.dispatching.rule.EarliestDueDate;
import com.iimsoft.uras.dispatching.rule.HighestPriority;
import com.iimsoft.uras.dispatching.rule.LongestProcessingTime;
import com.iimsoft.uras.dispatching.rule.ShortestProcessingTime;
import com.iimsoft.uras.domain.Activity;
import com.iimsoft.uras.domain.Task;
import com.iimsoft.uras.exception.InvalidSpecException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.iimsoft.uras.TestProblems.activity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleEngineTest {

    private final Activity x = activity("X", "TX", 1, 3000, "M1");
    private final Activity y = activity("Y", "TY", 1, 1000, "M1");
    private final Activity z = activity("Z", "TZ", 1, 1000, "M1");

    private final SchedulingContext context = SchedulingContext.builder()
            .task(Task.builder().id("TX").priority(2).dueMs(5000L).activity(x).build())
            .task(Task.builder().id("TY").priority(1).dueMs(4000L).activity(y).build())
            .task(Task.builder().id("TZ").priority(2).dueMs(9000L).activity(z).build())
            .build();

    @Test
    void sequentialModeShouldBreakTiesWithNextRule() {
        RuleEngine engine = RuleEngine.of(new HighestPriority(), new EarliestDueDate());

        assertThat(ids(engine.sort(List.of(z, y, x), context))).containsExactly("X", "Z", "Y");
    }

    @Test
    void fullTieShouldFallBackToActivityId() {
        RuleEngine engine = RuleEngine.of(new ShortestProcessingTime());

        assertThat(ids(engine.sort(List.of(z, x, y), context))).containsExactly("Y", "Z", "X");
    }

    @Test
    void sortShouldNotDependOnInputOrder() {
        RuleEngine engine = DispatchingRules.defaultEngine();
        List<Activity> shuffled = new ArrayList<>(List.of(x, y, z));
        List<String> first = ids(engine.sort(shuffled, context));

        for (int i = 0; i < 5; i++) {
            Collections.rotate(shuffled, 1);
            assertThat(ids(engine.sort(shuffled, context))).isEqualTo(first);
        }
        assertThat(shuffled).hasSize(3);
    }

    @Test
    void weightedModeShouldSumWeightedKeys() {
        // SPT + 0.5·LPT 相当于 0.5·p，再加 EDD 的 1e-3 倍
        RuleEngine engine = RuleEngine.builder()
                .mode(EvaluationMode.WEIGHTED)
                .rule(new ShortestProcessingTime(), 1.0)
                .rule(new LongestProcessingTime(), 0.5)
                .rule(new EarliestDueDate(), 1e-3)
                .build();

        // X: 1500 + 5, Y: 500 + 4, Z: 500 + 9
        assertThat(ids(engine.sort(List.of(x, y, z), context))).containsExactly("Y", "Z", "X");
        assertThat(engine.selectBest(List.of(x, z), context)).hasValue(z);
    }

    @Test
    void comparatorShouldAgreeWithSort() {
        RuleEngine engine = RuleEngine.of(new EarliestDueDate());
        List<Activity> sorted = new ArrayList<>(List.of(z, x, y));
        sorted.sort(engine.comparator(context));

        assertThat(sorted).isEqualTo(engine.sort(List.of(z, x, y), context));
        assertThat(engine.selectBest(List.of(), context)).isEmpty();
    }

    @Test
    void evaluateShouldReturnOneKeyPerRule() {
        RuleEngine engine = RuleEngine.of(new HighestPriority(), new EarliestDueDate());

        assertThat(engine.evaluate(x, context)).containsExactly(-2.0, 5000.0);
    }

    @Test
    void fromNameShouldAcceptAliases() {
        assertThat(BuiltinRule.fromName("s/ro")).isEqualTo(BuiltinRule.SRO);
        assertThat(BuiltinRule.fromName("SLACK_RO")).isEqualTo(BuiltinRule.SRO);
        assertThat(BuiltinRule.fromName(" critical_ratio ")).isEqualTo(BuiltinRule.CR);
        assertThat(BuiltinRule.fromName("wspt")).isEqualTo(BuiltinRule.WSPT);
        assertThatThrownBy(() -> BuiltinRule.fromName("FASTEST")).isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> BuiltinRule.fromName(" ")).isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void everyBuiltinRuleShouldBeCreatable() {
        for (BuiltinRule r : BuiltinRule.values()) {
            DispatchingRule rule = r.create();
            assertThat(rule.name()).isNotBlank();
            assertThat(rule.evaluate(x, context)).isNotNaN();
        }
    }

    @Test
    void fromNamesShouldApplyParametersAndValidateWeights() {
        RuleEngine engine = DispatchingRules.fromNames(List.of("ATC", "SPT"), EvaluationMode.WEIGHTED,
                List.of(1.0, 0.0), Map.of("ATC.k", 4.0));

        assertThat(engine.getRules()).hasSize(2);
        assertThat(engine.getRules().get(0).getRule().description()).contains("k=4.0");
        assertThat(engine.getMode()).isEqualTo(EvaluationMode.WEIGHTED);
        assertThatThrownBy(() -> DispatchingRules.fromNames(List.of("SPT"), EvaluationMode.WEIGHTED,
                List.of(1.0, 2.0), null)).isInstanceOf(InvalidSpecException.class);
        assertThat(DispatchingRules.fromNames(null, null, null, null).getRules()).hasSize(3);
    }

    private static List<String> ids(List<Activity> activities) {
        List<String> out = new ArrayList<>();
        for (Activity a : activities) {
            out.add(a.getId());
        }
        return out;
    }
}
