package com.muts.ecu.api;

/**
 * Link status between the pipeline and the ECU hardware transport.
 */
public enum ConnectionStatus
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
