package com.reviewmerge.domain.consolidation.model;

public enum ConflictKind {
    PRIORITY_DISAGREEMENT
}
