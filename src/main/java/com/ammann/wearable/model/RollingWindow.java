package com.ammann.wearable.model;

import com.ammann.wearable.enumeration.NotComputableReason;

import java.time.LocalDate;

/**
 * One entry of a rolling correlation series. A window below the minimum number of aligned
 * days carries {@code NaN} and a reason, never zero.
 */
public record RollingWindow(LocalDate windowStart, double coefficient, int sampleSize, NotComputableReason reason)
{
    public boolean computable()
    {
        return !Double.isNaN(coefficient);
    }
}
