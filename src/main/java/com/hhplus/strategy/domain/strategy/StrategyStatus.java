package com.hhplus.strategy.domain.strategy;

public enum StrategyStatus {
    DRAFT,
    ACTIVE,
    COMPLETED,
    ARCHIVED
}
