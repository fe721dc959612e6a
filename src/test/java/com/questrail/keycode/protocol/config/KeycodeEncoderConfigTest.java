package com.questrail.keycode.protocol.config;

import com.questrail.keycode.protocol.observability.NullObservabilitySink;
import com.questrail.keycode.protocol.observability.Slf4jKeycodeObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

final class KeycodeEncoderConfigTest
{
    @Test
    void defaultsUseNullSinkAndDefaultRetries()
    {
        KeycodeEncoderConfig config = KeycodeEncoderConfig.defaults();

        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertEquals(CollisionRetryPolicy.DEFAULT_MAX_ATTEMPTS, config.retryPolicy().maxAttempts());
        assertNotNull(config.clock());
    }

    @Test
    void builderOverridesEachSetting()
    {
        Slf4jKeycodeObservabilitySink sink = new Slf4jKeycodeObservabilitySink();
        Clock clock = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);

        KeycodeEncoderConfig config = KeycodeEncoderConfig.builder()
                .withObservabilitySink(sink)
                .withRetryPolicy(CollisionRetryPolicy.noRetry())
                .withClock(clock)
                .build();

        assertSame(sink, config.observabilitySink());
        assertEquals(1, config.retryPolicy().maxAttempts());
        assertSame(clock, config.clock());
    }

    @Test
    void rejectsMissingSettings()
    {
        assertThrows(NullPointerException.class,
                () -> KeycodeEncoderConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class,
                () -> KeycodeEncoderConfig.builder().withClock(null).build());
    }

    @Test
    void retryPolicyNeedsAtLeastOneAttempt()
    {
        assertThrows(IllegalArgumentException.class, () -> new CollisionRetryPolicy(0));
        assertEquals(1, CollisionRetryPolicy.noRetry().maxAttempts());
    }
}
