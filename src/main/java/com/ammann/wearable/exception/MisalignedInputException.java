/* (C)2026 */
package com.ammann.wearable.exception;

import com.ammann.wearable.enumeration.MetricType;
import java.time.Instant;

/**
 * Raised when a participant series violates the input contract: a sample outside the declared
 * monitoring window, a sample filed under the wrong metric or participant, timestamps that
 * are not strictly increasing, or a participant id equal to the reserved cohort scope.
 *
 * <p>Fatal for the affected participant's analysis unit only; the run continues for everybody
 * else.
 */
public class MisalignedInputException extends ApiException {

    private final String participantId;

    public MisalignedInputException(String participantId, String message) {
        super(String.format("Participant %s: %s", participantId, message));
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }

    public static MisalignedInputException outsideMonitoringWindow(
            String participantId, MetricType metric, Instant timestamp, Instant start, Instant end) {
        return new MisalignedInputException(
                participantId,
                String.format(
                        "%s sample at %s lies outside monitoring window [%s, %s]",
                        metric, timestamp, start, end));
    }

    public static MisalignedInputException metricMismatch(
            String participantId, MetricType expected, MetricType actual) {
        return new MisalignedInputException(
                participantId,
                String.format("sample of metric %s filed under %s", actual, expected));
    }

    public static MisalignedInputException participantMismatch(
            String participantId, String sampleParticipantId) {
        return new MisalignedInputException(
                participantId,
                String.format("sample belongs to participant %s", sampleParticipantId));
    }

    public static MisalignedInputException notIncreasing(
            String participantId, MetricType metric, Instant previous, Instant current) {
        return new MisalignedInputException(
                participantId,
                String.format(
                        "%s timestamps not strictly increasing: %s followed by %s",
                        metric, previous, current));
    }

    public static MisalignedInputException reservedParticipantId(String participantId) {
        return new MisalignedInputException(
                participantId, "participant id is reserved for cohort-level results");
    }
}
