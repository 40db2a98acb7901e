package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.MetricType;

import java.time.LocalDate;

/**
 * Shift of a baseline's drift-curve center between two adjacent windows that exceeds the
 * configured fraction of the overall spread. Distinct from point anomalies.
 *
 * @param shiftInSpreads {@code shift / spread}, signed
 */
public record DriftSignal(
        String participantId,
        MetricType metric,
        LocalDate fromWindowStart,
        LocalDate toWindowStart,
        double fromCenter,
        double toCenter,
        double shift,
        double shiftInSpreads)
{
}
