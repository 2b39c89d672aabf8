package com.riskengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_CONFIGURATION("INVALID_CONFIGURATION"),
    SETTLEMENT_FAILED("SETTLEMENT_FAILED");

    private final String code;
}
