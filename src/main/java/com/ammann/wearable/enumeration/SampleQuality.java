package com.ammann.wearable.enumeration;

/**
 * Quality of a sample that passed upstream cleaning.
 *
 * <p>Outliers and missing readings are filtered before the analysis engine sees the series,
 * so only these two states exist here.
 */
public enum SampleQuality
{
    /** Reading taken as recorded by the device. */
    VALID,
    /** Reading filled in by the cleaning stage. */
    IMPUTED
}
