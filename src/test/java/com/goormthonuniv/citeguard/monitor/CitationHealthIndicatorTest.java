package com.goormthonuniv.citeguard.monitor;

import com.goormthonuniv.citeguard.cache.CitationCacheStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CitationHealthIndicatorTest {

    private CitationMonitoringService monitoring;
    private CitationHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
        monitoring = new CitationMonitoringService(new SimpleMeterRegistry(), mock(ApplicationEventPublisher.class),
                AlertThresholds.defaults(), clock);
        indicator = new CitationHealthIndicator(monitoring, new CitationCacheStore(true, 60, 100, clock));
    }

    @Test
    void upWithoutTraffic() {
        Health h = indicator.health();

        assertEquals(Status.UP, h.getStatus());
        assertEquals("healthy", h.getDetails().get("state"));
        assertEquals(true, h.getDetails().get("cacheEnabled"));
    }

    @Test
    void degradedWhenSomeVerificationsFail() {
        monitoring.trackVerificationSession("s", session(9, 1, 500));

        Health h = indicator.health();

        assertEquals("DEGRADED", h.getStatus().getCode());
        assertEquals(0.9, (double) h.getDetails().get("successRate"), 1e-9);
    }

    @Test
    void downWhenMostVerificationsFail() {
        monitoring.trackVerificationSession("s", session(1, 4, 500));

        Health h = indicator.health();

        assertEquals(Status.DOWN, h.getStatus());
        assertEquals(1, h.getDetails().get("recentAlerts"));
    }

    private static VerificationSessionMetrics session(int ok, int failed, long timeMs) {
        return new VerificationSessionMetrics("b2c", 300, ok + failed, timeMs, ok, failed, 0, ok + failed,
                6.0, 0, ok, failed, 7.0, Map.of("url", ok + failed));
    }
}
