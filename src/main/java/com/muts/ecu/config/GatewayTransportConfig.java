package com.muts.ecu.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Addressing and timing for the UDP ECU gateway transport.
 */
public record GatewayTransportConfig(
    InetSocketAddress bindAddress,
    InetSocketAddress gatewayAddress,
    Duration responseTimeout
) {
    public GatewayTransportConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(gatewayAddress, "gatewayAddress");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        if (responseTimeout.isZero() || responseTimeout.isNegative()) {
            throw new IllegalArgumentException("responseTimeout must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private InetSocketAddress gatewayAddress;
        private Duration responseTimeout = Duration.ofSeconds(2);

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withGatewayAddress(InetSocketAddress gatewayAddress) {
            this.gatewayAddress = gatewayAddress;
            return this;
        }

        public Builder withResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public GatewayTransportConfig build() {
            return new GatewayTransportConfig(bindAddress, gatewayAddress, responseTimeout);
        }
    }
}
