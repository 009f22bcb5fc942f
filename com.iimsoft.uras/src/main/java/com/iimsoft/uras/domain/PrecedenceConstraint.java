package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * before 结束后至少 minDelayMs 毫秒，after 才能开始。两者可以属于不同任务。
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class PrecedenceConstraint extends Constraint {

    private final String beforeActivityId;
    private final String afterActivityId;
    private final long minDelayMs;

    public PrecedenceConstraint(String beforeActivityId, String afterActivityId, long minDelayMs) {
        if (beforeActivityId == null || afterActivityId == null) {
            throw new InvalidSpecException("precedence 约束缺少 activity id");
        }
        if (beforeActivityId.equals(afterActivityId)) {
            throw new InvalidSpecException("precedence 约束不能指向自身: " + beforeActivityId);
        }
        if (minDelayMs < 0) {
            throw new InvalidSpecException("precedence minDelayMs 不能为负数: " + minDelayMs);
        }
        this.beforeActivityId = beforeActivityId;
        this.afterActivityId = afterActivityId;
        this.minDelayMs = minDelayMs;
    }

    public PrecedenceConstraint(String beforeActivityId, String afterActivityId) {
        this(beforeActivityId, afterActivityId, 0L);
    }

    @Override
    public Kind getKind() {
        return Kind.PRECEDENCE;
    }

    @Override
    public String toString() {
        return "Precedence[" + beforeActivityId + " -> " + afterActivityId + " +" + minDelayMs + "]";
    }
}
