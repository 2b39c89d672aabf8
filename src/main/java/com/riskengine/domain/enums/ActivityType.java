package com.riskengine.domain.enums;

public enum ActivityType {
    CLOSED,
    BREACH
}
