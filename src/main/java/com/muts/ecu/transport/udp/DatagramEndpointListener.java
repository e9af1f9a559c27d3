package com.muts.ecu.transport.udp;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Implementations deliver callbacks serially. The Netty endpoint does so on
 * its channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause, {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with one complete datagram, copied out of any framework buffer.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
