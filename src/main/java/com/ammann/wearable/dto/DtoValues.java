package com.ammann.wearable.dto;

/**
 * Conversions shared by the response DTOs.
 */
final class DtoValues {

    private DtoValues() {}

    /** Maps the {@code NaN} sentinel (and infinities) to JSON {@code null}. */
    static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
