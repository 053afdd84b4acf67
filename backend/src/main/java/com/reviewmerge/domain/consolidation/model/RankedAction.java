package com.reviewmerge.domain.consolidation.model;

import java.util.Map;

/**
 * One entry of a source's own ranked action list.
 *
 * @param action action text
 * @param rank   the source's rank for this action, {@value #DEFAULT_RANK} when the source gave none
 * @param extra  any other fields the source attached
 */
public record RankedAction(
        String action,
        int rank,
        Map<String, Object> extra
) {
    public static final int DEFAULT_RANK = 99;

    public RankedAction {
        action = action == null ? "" : action;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }
}
