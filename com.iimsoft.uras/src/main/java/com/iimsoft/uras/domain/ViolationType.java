package com.iimsoft.uras.domain;

public enum ViolationType {
    TIME_WINDOW,
    CAPACITY_EXCEEDED,
    PRECEDENCE_VIOLATED,
    RESOURCE_UNAVAILABLE,
    RESOURCE_NOT_ALLOWED
}
