package com.ammann.wearable.exception;

/**
 * Raised by statistical routines when fewer observations are available than required.
 *
 * <p>Never reaches callers of the analysis services: it is caught where it is raised and
 * turned into a typed NOT_COMPUTABLE or invalid result.
 */
public class InsufficientDataException extends ApiException
{
    private final int required;
    private final int actual;

    public InsufficientDataException(String resourceType, int required, int actual)
    {
        super(String.format("Insufficient %s: need at least %d, but got %d",
                resourceType, required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() { return required; }

    public int getActual() { return actual; }
}
