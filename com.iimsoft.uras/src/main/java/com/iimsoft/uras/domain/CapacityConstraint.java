package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 资源同时承载的活动数上限。与 Resource.capacity 同时存在时取较小值。
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class CapacityConstraint extends Constraint {

    private final String resourceId;
    private final int maxConcurrent;

    public CapacityConstraint(String resourceId, int maxConcurrent) {
        if (resourceId == null) {
            throw new InvalidSpecException("capacity 约束缺少 resourceId");
        }
        if (maxConcurrent < 1) {
            throw new InvalidSpecException("capacity 约束 maxConcurrent 必须 >= 1: " + maxConcurrent);
        }
        this.resourceId = resourceId;
        this.maxConcurrent = maxConcurrent;
    }

    @Override
    public Kind getKind() {
        return Kind.CAPACITY;
    }

    @Override
    public String toString() {
        return "Capacity[" + resourceId + " <= " + maxConcurrent + "]";
    }
}
