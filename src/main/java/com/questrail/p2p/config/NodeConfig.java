package com.questrail.p2p.config;

import com.questrail.p2p.codec.impl.JacksonDeflatePackageCodec;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of one messaging node.
 *
 * @param bindAddress     local address to listen on; port 0 picks a free port
 * @param advertisedPort  port written into outbound metadata; 0 means "the bound port"
 * @param transportKind   wire binding
 * @param maxPackageSize  largest encoded package accepted or sent, in bytes
 * @param maxInflatedSize largest decompressed package document, in bytes
 * @param responseTimeout default wait for {@code sendAndReceive}
 */
public record NodeConfig(
    InetSocketAddress bindAddress,
    int advertisedPort,
    TransportKind transportKind,
    int maxPackageSize,
    int maxInflatedSize,
    Duration responseTimeout
) {
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(5);

    public NodeConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(transportKind, "transportKind");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        if (advertisedPort < 0 || advertisedPort > 65535) {
            throw new IllegalArgumentException("advertisedPort must be in range 0-65535 (was " + advertisedPort + ")");
        }
        if (maxPackageSize <= 0) {
            throw new IllegalArgumentException("maxPackageSize must be > 0");
        }
        if (maxInflatedSize <= 0) {
            throw new IllegalArgumentException("maxInflatedSize must be > 0");
        }
        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("responseTimeout must be positive");
        }
    }

    public static NodeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private int advertisedPort = 0;
        private TransportKind transportKind = TransportKind.TCP;
        private Integer maxPackageSize;
        private int maxInflatedSize = JacksonDeflatePackageCodec.DEFAULT_MAX_INFLATED_SIZE;
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;

        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        public Builder withPort(int port) {
            this.bindAddress = new InetSocketAddress(port);
            return this;
        }

        public Builder withAdvertisedPort(int port) {
            this.advertisedPort = port;
            return this;
        }

        public Builder withTransportKind(TransportKind kind) {
            this.transportKind = kind;
            return this;
        }

        /**
         * Overrides the per-kind default ({@link TransportKind#defaultMaxPackageSize()}).
         */
        public Builder withMaxPackageSize(int bytes) {
            this.maxPackageSize = bytes;
            return this;
        }

        public Builder withMaxInflatedSize(int bytes) {
            this.maxInflatedSize = bytes;
            return this;
        }

        public Builder withResponseTimeout(Duration timeout) {
            this.responseTimeout = timeout;
            return this;
        }

        public NodeConfig build() {
            Objects.requireNonNull(transportKind, "transportKind");
            int maxSize = maxPackageSize != null ? maxPackageSize : transportKind.defaultMaxPackageSize();
            return new NodeConfig(bindAddress, advertisedPort, transportKind, maxSize, maxInflatedSize, responseTimeout);
        }
    }
}
