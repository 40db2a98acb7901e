package com.ammann.wearable.model;

/**
 * An anomaly episode with its recovery profile attached.
 */
public record AnalyzedEpisode(AnomalyEvent event, RecoveryProfile recovery) {
}
