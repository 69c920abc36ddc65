package com.tdengine.exception;

import java.util.Map;

public class InvalidBarException extends BaseException {

    public InvalidBarException(String message) {
        super(ErrorCode.INVALID_BAR, message);
    }

    public InvalidBarException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_BAR, message, details);
    }
}
