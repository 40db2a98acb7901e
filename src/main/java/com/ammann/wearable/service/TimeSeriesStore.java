/* (C)2026 */
package com.ammann.wearable.service;

import com.ammann.wearable.model.ParticipantSeries;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Holds the cleaned participant series handed over by the loading and cleaning stage.
 *
 * <p>Series are immutable; a run works on a {@link #snapshot()} so that ingestion during a
 * run does not change its input.
 */
@ApplicationScoped
public class TimeSeriesStore {

    private static final Logger LOG = Logger.getLogger(TimeSeriesStore.class);

    private final Map<String, ParticipantSeries> series = new ConcurrentHashMap<>();

    /**
     * Adds or replaces the series of one participant.
     *
     * @return the series previously stored for the participant, if any
     */
    public Optional<ParticipantSeries> put(ParticipantSeries participantSeries) {
        ParticipantSeries previous = series.put(participantSeries.participantId(), participantSeries);
        LOG.debugf(
                "%s series for participant %s (%d samples)",
                previous == null ? "Stored" : "Replaced",
                participantSeries.participantId(),
                participantSeries.totalSamples());
        return Optional.ofNullable(previous);
    }

    public void putAll(Collection<ParticipantSeries> participants) {
        participants.forEach(this::put);
    }

    public Optional<ParticipantSeries> get(String participantId) {
        return Optional.ofNullable(series.get(participantId));
    }

    /** Participant ids in natural order. */
    public List<String> participantIds() {
        return series.keySet().stream().sorted().toList();
    }

    public int size() {
        return series.size();
    }

    /** Consistent copy of the store ordered by participant id. */
    public SortedMap<String, ParticipantSeries> snapshot() {
        return new TreeMap<>(series);
    }

    public void clear() {
        int removed = series.size();
        series.clear();
        LOG.infof("Cleared time series store (%d participants)", removed);
    }
}
