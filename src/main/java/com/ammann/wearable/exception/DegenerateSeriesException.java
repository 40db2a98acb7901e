package com.ammann.wearable.exception;

/**
 * Raised by statistical routines when an input has zero variance, which would otherwise
 * lead to a division by zero.
 *
 * <p>Recovered locally into a NOT_COMPUTABLE or invalid result, like
 * {@link InsufficientDataException}.
 */
public class DegenerateSeriesException extends ApiException
{
    public DegenerateSeriesException(String message)
    {
        super(message);
    }
}
