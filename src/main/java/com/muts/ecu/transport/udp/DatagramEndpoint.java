package com.muts.ecu.transport.udp;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport to the ECU gateway.
 *
 * <p>The endpoint moves bytes only. Framing, correlation and timeouts belong
 * to {@link UdpGatewayTransport}. Implementations may be backed by Netty or a
 * test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release its resources. The listener is notified
     * via {@link DatagramEndpointListener#onTransportDown(Throwable)}.
     */
    void stop();

    /**
     * Send one datagram. Silently dropped if the endpoint is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
