/* (C)2026 */
package com.ammann.wearable.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Return-to-baseline trajectory after an anomaly episode.
 *
 * <p>Refers to its episode by key only. An unresolved profile means the series ended (or
 * the next episode began) before a sustained in-band run was observed; that is a valid,
 * right-censored outcome, and {@code recoveryDuration} and {@code recoveredAt} are then
 * {@code null}.
 *
 * @param trajectorySlope least-squares slope of values per day from episode start to the
 *                        recovery point (or the last observed sample), {@code NaN} with
 *                        fewer than two points
 */
public record RecoveryProfile(
        AnomalyEvent.EpisodeKey event,
        boolean resolved,
        Duration recoveryDuration,
        Instant recoveredAt,
        double trajectorySlope) {

    public static RecoveryProfile unresolved(AnomalyEvent.EpisodeKey event, double trajectorySlope) {
        return new RecoveryProfile(event, false, null, null, trajectorySlope);
    }
}
