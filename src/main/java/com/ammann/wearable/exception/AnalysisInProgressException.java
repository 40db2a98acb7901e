package com.ammann.wearable.exception;

/**
 * Raised when an analysis run is requested while another run is still executing.
 *
 * <p>Mapped to HTTP 409 (Conflict) by {@link GlobalExceptionHandler}.
 */
public class AnalysisInProgressException extends ApiException
{
    public AnalysisInProgressException(String runId)
    {
        super("Analysis run " + runId + " is still in progress");
    }
}
