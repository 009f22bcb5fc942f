package com.iimsoft.uras.domain;

import com.iimsoft.uras.exception.InvalidSpecException;
import lombok.Builder;
import lombok.Getter;

/**
 * 可分配资源。efficiency 是名义时长的倍率：有效时长 = ceil(名义 / efficiency)。
 */
@Getter
public final class Resource {

    private final String id;
    private final String name;
    private final ResourceKind kind;
    private final String category;
    /** 同时可承载的活动数 */
    private final int capacity;
    private final double efficiency;
    private final Calendar calendar;

    @Builder
    public Resource(String id, String name, ResourceKind kind, String category,
                    Integer capacity, Double efficiency, Calendar calendar) {
        if (id == null || id.isBlank()) {
            throw new InvalidSpecException("resource.id 不能为空");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.kind = kind == null ? ResourceKind.PRIMARY : kind;
        this.category = category == null ? "" : category;
        this.capacity = capacity == null ? 1 : capacity;
        this.efficiency = efficiency == null ? 1.0 : efficiency;
        this.calendar = calendar == null ? Calendar.always() : calendar;
        if (this.capacity < 1) {
            throw new InvalidSpecException("resource " + id + " capacity 必须 >= 1: " + this.capacity);
        }
        if (!(this.efficiency > 0) || Double.isInfinite(this.efficiency)) {
            throw new InvalidSpecException("resource " + id + " efficiency 必须 > 0: " + this.efficiency);
        }
    }

    public long effectiveDurationMs(long nominalMs) {
        // 1e-9 吸收浮点误差，避免 3000/0.3 被向上取成 10001
        return (long) Math.ceil(nominalMs / efficiency - 1e-9);
    }

    @Override
    public String toString() {
        return "Resource[" + id + " " + kind + " eff=" + efficiency + "]";
    }
}
