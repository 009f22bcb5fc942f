package com.iimsoft.uras.dispatching;

import com.iimsoft.uras.dispatching.rule.ApparentTardinessCost;
import com.iimsoft.uras.dispatching.rule.CriticalRatio;
import com.iimsoft.uras.dispatching.rule.EarliestDueDate;
import com.iimsoft.uras.dispatching.rule.FirstInFirstOut;
import com.iimsoft.uras.dispatching.rule.HighestPriority;
import com.iimsoft.uras.dispatching.rule.LeastPlannedUtilization;
import com.iimsoft.uras.dispatching.rule.LeastWorkRemaining;
import com.iimsoft.uras.dispatching.rule.LongestProcessingTime;
import com.iimsoft.uras.dispatching.rule.MinimumSlackTime;
import com.iimsoft.uras.dispatching.rule.MostWorkRemaining;
import com.iimsoft.uras.dispatching.rule.ShortestProcessingTime;
import com.iimsoft.uras.dispatching.rule.SlackPerRemainingOperation;
import com.iimsoft.uras.dispatching.rule.WeightedShortestProcessingTime;
import com.iimsoft.uras.dispatching.rule.WorkInNextQueue;
import com.iimsoft.uras.exception.InvalidSpecException;

import java.util.Locale;
import java.util.Map;

/**
 * 内置规则目录。名字大小写不敏感，S/RO 也接受 SRO / SLACK_RO。
 */
public enum BuiltinRule {
    SPT, LPT, LWKR, MWKR, EDD, MST, CR, SRO, FIFO, WINQ, LPUL, ATC, WSPT, PRIORITY;

    public static BuiltinRule fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidSpecException("派工规则名不能为空");
        }
        String n = name.trim().toUpperCase(Locale.ROOT);
        switch (n) {
            case "S/RO":
            case "SLACK_RO":
                return SRO;
            case "CRITICAL_RATIO":
                return CR;
            default:
                try {
                    return valueOf(n);
                } catch (IllegalArgumentException e) {
                    throw new InvalidSpecException("未知派工规则: " + name, e);
                }
        }
    }

    /**
     * @param params 规则参数，键形如 "ATC.k"；可为 null
     */
    public DispatchingRule create(Map<String, Double> params) {
        switch (this) {
            case SPT:
                return new ShortestProcessingTime();
            case LPT:
                return new LongestProcessingTime();
            case LWKR:
                return new LeastWorkRemaining();
            case MWKR:
                return new MostWorkRemaining();
            case EDD:
                return new EarliestDueDate();
            case MST:
                return new MinimumSlackTime();
            case CR:
                return new CriticalRatio();
            case SRO:
                return new SlackPerRemainingOperation();
            case FIFO:
                return new FirstInFirstOut();
            case WINQ:
                return new WorkInNextQueue();
            case LPUL:
                return new LeastPlannedUtilization();
            case ATC:
                Double k = params == null ? null : params.get("ATC.k");
                return k == null ? new ApparentTardinessCost() : new ApparentTardinessCost(k);
            case WSPT:
                return new WeightedShortestProcessingTime();
            case PRIORITY:
                return new HighestPriority();
            default:
                throw new IllegalStateException("unhandled rule " + this);
        }
    }

    public DispatchingRule create() {
        return create(null);
    }
}
