package com.iimsoft.uras.domain;

/**
 * 约束的封闭变体集合：先后、容量、时间窗。
 */
public abstract class Constraint {

    public enum Kind {
        PRECEDENCE, CAPACITY, TIME_WINDOW
    }

    Constraint() {
    }

    public abstract Kind getKind();
}
