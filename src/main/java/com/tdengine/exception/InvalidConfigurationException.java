package com.tdengine.exception;

import java.util.Map;

public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String property, Object value) {
        super(
                ErrorCode.INVALID_CONFIGURATION,
                "Invalid value for td-indicators." + property + ": " + value,
                Map.of("property", property, "value", String.valueOf(value)));
    }
}
