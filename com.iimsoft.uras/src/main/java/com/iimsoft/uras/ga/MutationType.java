package com.iimsoft.uras.ga;

public enum MutationType {
    SWAP,
    INSERT,
    INVERT
}
