/* (C)2026 */
package com.ammann.wearable.enumeration;

/**
 * Health metrics recorded by the wearable devices.
 *
 * <p>Blood pressure readings arrive as one record with systolic as primary and diastolic as
 * secondary value; the loader splits them into {@link #BP_SYSTOLIC} and {@link #BP_DIASTOLIC}
 * series so that each metric owns one ordered value stream.
 */
public enum MetricType {
    /** Systolic blood pressure in mmHg. */
    BP_SYSTOLIC("mmHg"),
    /** Diastolic blood pressure in mmHg. */
    BP_DIASTOLIC("mmHg"),
    /** Heart rate in beats per minute. */
    HR("bpm"),
    /** Step count. */
    STEPS("steps"),
    /** Sleep duration in hours. */
    SLEEP("hours"),
    /** Blood oxygen saturation in percent. */
    SPO2("%"),
    /** Body temperature. */
    TEMP("°F");

    private final String unit;

    MetricType(String unit) {
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
