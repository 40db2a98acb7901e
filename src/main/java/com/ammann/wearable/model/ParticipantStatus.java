package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.ParticipantRunStatus;

/**
 * Outcome of one participant's unit in a run, kept so that absent results stay explainable.
 *
 * @param errorType exception type for {@link ParticipantRunStatus#FAILED}, otherwise {@code null}
 */
public record ParticipantStatus(String participantId, ParticipantRunStatus status, String errorType, String message)
{
    public static ParticipantStatus of(String participantId, ParticipantRunStatus status)
    {
        return new ParticipantStatus(participantId, status, null, null);
    }

    public static ParticipantStatus failed(String participantId, Throwable error)
    {
        return new ParticipantStatus(
                participantId, ParticipantRunStatus.FAILED, error.getClass().getSimpleName(), error.getMessage());
    }
}
