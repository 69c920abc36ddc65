package com.tdengine.domain.model;

/**
 * One OHLC bar of an instrument's series. Identified by its position in the
 * series, so it carries no timestamp or volume.
 */
public record Bar(double open, double high, double low, double close) {

    public static Bar of(double open, double high, double low, double close) {
        return new Bar(open, high, low, close);
    }
}
