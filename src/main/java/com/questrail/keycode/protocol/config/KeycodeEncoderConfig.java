package com.questrail.keycode.protocol.config;

import com.questrail.keycode.protocol.observability.KeycodeObservabilitySink;
import com.questrail.keycode.protocol.observability.NullObservabilitySink;

import java.time.Clock;
import java.util.Objects;

/**
 * Aggregated configuration for the keycode encoder.
 */
public record KeycodeEncoderConfig(
    KeycodeObservabilitySink observabilitySink,
    CollisionRetryPolicy retryPolicy,
    Clock clock
) {
    public KeycodeEncoderConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(clock, "clock");
    }

    public static KeycodeEncoderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private KeycodeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private CollisionRetryPolicy retryPolicy = CollisionRetryPolicy.defaults();
        private Clock clock = Clock.systemUTC();

        public Builder withObservabilitySink(KeycodeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withRetryPolicy(CollisionRetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public KeycodeEncoderConfig build() {
            return new KeycodeEncoderConfig(observabilitySink, retryPolicy, clock);
        }
    }
}
