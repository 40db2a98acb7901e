/* (C)2026 */
package com.ammann.wearable.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "participant-analysis-executor" bean used by CohortAnalysisService to
 * analyse participants in parallel. At most {@code wearable.analysis.workers} units run at
 * once; the remaining participants wait in an unbounded queue since a run is a finite batch.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String PARTICIPANT_EXECUTOR = "participant-analysis-executor";

    /**
     * Produces a named ManagedExecutor for participant analysis units.
     *
     * @param settings validated analysis settings providing the worker count
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(PARTICIPANT_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createParticipantExecutor(AnalysisSettings settings) {
        return ManagedExecutor.builder()
                .maxAsync(settings.workers())
                .maxQueued(-1)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }

    void shutdown(@Disposes @Named(PARTICIPANT_EXECUTOR) ManagedExecutor executor) {
        executor.shutdown();
    }
}
