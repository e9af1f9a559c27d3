package com.muts.ecu.safety.queue;

/**
 * Outcome of one delivery cycle.
 */
public record DeliveryReport(int attempted, int delivered, int failed)
{
    public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0);

    public boolean hadFailures()
    {
        return failed > 0;
    }
}
