package com.tdengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INSUFFICIENT_HISTORY("INSUFFICIENT_HISTORY"),
    INVALID_BAR("INVALID_BAR"),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION");

    private final String code;
}
