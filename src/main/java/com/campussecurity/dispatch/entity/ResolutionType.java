package com.campussecurity.dispatch.entity;

public enum ResolutionType {
    RESOLVED_BY_GUARD,
    ESCALATED_TO_ADMIN
}
