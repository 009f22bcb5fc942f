package com.iimsoft.uras.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public final class Violation {

    private final ViolationType type;
    private final List<String> relatedIds;
    /** 硬违反：包含它的排程不可行 */
    private final boolean hard;
    private final String message;
    private final double penalty;
}
