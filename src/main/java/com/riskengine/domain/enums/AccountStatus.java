package com.riskengine.domain.enums;

/**
 * Status of a trading account. BREACHED is terminal: the engine never touches a
 * breached account again.
 */
public enum AccountStatus {
    ACTIVE,
    FUNDED,
    PASSED,
    SUSPENDED,
    BREACHED
}
