package com.questrail.oob.config;

import com.questrail.oob.codec.OobFraming;
import com.questrail.oob.codec.token.OobWireFormat;
import com.questrail.oob.transport.OobServiceRecord;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for an OOB channel.
 *
 * <ul>
 *   <li><b>acceptTimeout</b>: upper bound on waiting for the peer to connect.</li>
 *   <li><b>readTimeout</b>: per-read bound applied to the accepted connection;
 *       {@link Duration#ZERO} leaves reads unbounded.</li>
 *   <li><b>wireFormat</b>: interpretation of the frame payload.</li>
 *   <li><b>maxPayloadBytes</b>: largest declared payload length accepted.</li>
 *   <li><b>serviceRecord</b>: name and identifier the endpoint is registered under.</li>
 * </ul>
 */
public record OobChannelConfig(
    Duration acceptTimeout,
    Duration readTimeout,
    OobWireFormat wireFormat,
    int maxPayloadBytes,
    OobServiceRecord serviceRecord
) {
    public static final Duration DEFAULT_ACCEPT_TIMEOUT = Duration.ofSeconds(30);

    public OobChannelConfig {
        Objects.requireNonNull(acceptTimeout, "acceptTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(wireFormat, "wireFormat");
        Objects.requireNonNull(serviceRecord, "serviceRecord");

        if (acceptTimeout.isZero() || acceptTimeout.isNegative()) {
            throw new IllegalArgumentException("acceptTimeout must be positive");
        }
        if (readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be non-negative");
        }
        if (maxPayloadBytes < 1) {
            throw new IllegalArgumentException("maxPayloadBytes must be at least 1");
        }
    }

    public static OobChannelConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration acceptTimeout = DEFAULT_ACCEPT_TIMEOUT;
        private Duration readTimeout = Duration.ZERO;
        private OobWireFormat wireFormat = OobWireFormat.STRUCTURED;
        private int maxPayloadBytes = OobFraming.DEFAULT_MAX_PAYLOAD_BYTES;
        private OobServiceRecord serviceRecord = OobServiceRecord.DEFAULT;

        public Builder withAcceptTimeout(Duration acceptTimeout) {
            this.acceptTimeout = acceptTimeout;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withWireFormat(OobWireFormat wireFormat) {
            this.wireFormat = wireFormat;
            return this;
        }

        public Builder withMaxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = maxPayloadBytes;
            return this;
        }

        public Builder withServiceRecord(OobServiceRecord serviceRecord) {
            this.serviceRecord = serviceRecord;
            return this;
        }

        public OobChannelConfig build() {
            return new OobChannelConfig(acceptTimeout, readTimeout, wireFormat, maxPayloadBytes, serviceRecord);
        }
    }
}
