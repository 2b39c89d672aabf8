package com.riskengine.exception;

import java.util.Map;

/**
 * Raised inside a settlement transaction when a write does not behave as expected.
 * Being unchecked, it rolls back the whole close: the position stays OPEN and the
 * next admitted tick retries from persisted state.
 */
public class SettlementException extends BaseException {

    public SettlementException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
