package com.muts.ecu.store;

import com.muts.ecu.api.ConnectionStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Connection slice of {@link ApplicationState}.
 *
 * @param interfaceId {@code null} unless connecting or connected
 * @param lastError   {@code null} unless the last attempt failed
 */
public record ConnectionState(ConnectionStatus status, String interfaceId, String lastError, Instant timestamp)
{
    public ConnectionState {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ConnectionState disconnected(Instant at)
    {
        return new ConnectionState(ConnectionStatus.DISCONNECTED, null, null, at);
    }

    public boolean isConnected()
    {
        return status == ConnectionStatus.CONNECTED;
    }
}
