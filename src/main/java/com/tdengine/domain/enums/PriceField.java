package com.tdengine.domain.enums;

public enum PriceField {
    OPEN,
    HIGH,
    LOW,
    CLOSE
}
