package com.muts.ecu.api;

/**
 * Handle returned by every subscribe operation. Calling {@link #unsubscribe()}
 * more than once has no further effect.
 */
@FunctionalInterface
public interface Subscription
{
    void unsubscribe();
}
