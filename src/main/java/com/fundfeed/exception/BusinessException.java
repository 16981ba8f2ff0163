package com.fundfeed.exception;

import java.util.Map;

/** Rejected caller input: malformed fund code, out-of-range lookback or ranking size. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
