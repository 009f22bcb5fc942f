package com.iimsoft.uras.domain;

public enum ResourceKind {
    PRIMARY,
    SECONDARY,
    HUMAN
}
