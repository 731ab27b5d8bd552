package com.goormthonuniv.citeguard.monitor;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CitationMonitoringServiceTest {

    private static final Instant T0 = Instant.parse("2025-06-01T12:00:00Z");

    private SimpleMeterRegistry registry;
    private ApplicationEventPublisher publisher;
    private MutableClock clock;
    private CitationMonitoringService monitoring;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = mock(ApplicationEventPublisher.class);
        clock = new MutableClock(T0);
        monitoring = new CitationMonitoringService(registry, publisher, AlertThresholds.defaults(), clock);
    }

    @Test
    void lowSuccessRateRaisesExactlyOneLowVerificationRateAlert() {
        monitoring.trackVerificationSession("s-1", session(2, 3, 1200));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(1)).publishEvent(captor.capture());

        CitationAlert alert = (CitationAlert) captor.getValue();
        assertEquals(CitationAlert.LOW_VERIFICATION_RATE, alert.type());
        assertEquals(0.4, (double) alert.details().get("rate"), 1e-9);
        assertEquals(1, monitoring.recentAlerts().size());
    }

    @Test
    void healthySessionRaisesNoAlertAndIsMeasured() {
        monitoring.trackVerificationSession("s-1", session(5, 0, 800));

        verify(publisher, never()).publishEvent(any(Object.class));
        DistributionSummary duration = registry.find("citation.verification.session.duration")
                .tag("segment", "b2b").summary();
        assertNotNull(duration);
        assertEquals(1, duration.count());
        assertEquals(800.0, duration.totalAmount());
    }

    @Test
    void slowSessionRaisesSlowVerificationResponse() {
        monitoring.trackVerificationSession("s-1", session(5, 0, 12_000));

        assertEquals(List.of(CitationAlert.SLOW_VERIFICATION_RESPONSE), alertTypes());
    }

    @Test
    void sessionWithoutVerificationsCountsAsFullSuccess() {
        monitoring.trackVerificationSession("s-1", session(0, 0, 50));

        assertTrue(monitoring.recentAlerts().isEmpty());
    }

    @Test
    void slowApiCallRaisesSlowApiResponse() {
        monitoring.trackApiCall("moz", ApiCallMetrics.ok(15_000, 200));

        assertEquals(List.of(CitationAlert.SLOW_API_RESPONSE), alertTypes());
        assertEquals("moz", monitoring.recentAlerts().get(0).details().get("apiName"));
    }

    @Test
    void highErrorRateNeedsTwentyCalls() {
        for (int i = 0; i < 17; i++) {
            monitoring.trackApiCall("ahrefs", ApiCallMetrics.ok(100, 200));
        }
        monitoring.trackApiCall("ahrefs", ApiCallMetrics.failed(100, 503, "server_error"));
        monitoring.trackApiCall("ahrefs", ApiCallMetrics.failed(100, 503, "server_error"));
        assertTrue(monitoring.recentAlerts().isEmpty());

        monitoring.trackApiCall("ahrefs", ApiCallMetrics.failed(100, 503, "server_error"));

        assertEquals(List.of(CitationAlert.HIGH_API_ERROR_RATE), alertTypes());
    }

    @Test
    void cachePerformanceAlertsOnlyWithTraffic() {
        monitoring.trackCachePerformance(new CachePerformanceMetrics(0, 0, 0, 0, 0));
        assertTrue(monitoring.recentAlerts().isEmpty());

        monitoring.trackCachePerformance(new CachePerformanceMetrics(100, 20, 80, 5, 0));
        assertEquals(List.of(CitationAlert.LOW_CACHE_HIT_RATE), alertTypes());
    }

    @Test
    void coldCacheDoesNotAlertBeforeMinimumLookups() {
        monitoring.trackCachePerformance(new CachePerformanceMetrics(10, 0, 10, 10, 0));
        monitoring.trackCachePerformance(new CachePerformanceMetrics(
                CitationMonitoringService.MIN_CACHE_LOOKUPS_FOR_HIT_RATE - 1, 2, 47, 40, 0));
        assertTrue(monitoring.recentAlerts().isEmpty());

        monitoring.trackCachePerformance(new CachePerformanceMetrics(
                CitationMonitoringService.MIN_CACHE_LOOKUPS_FOR_HIT_RATE, 45, 5, 40, 0));
        assertTrue(monitoring.recentAlerts().isEmpty());
    }

    @Test
    void healthIsHealthyWithoutRecentSessions() {
        HealthStatus h = monitoring.getHealthStatus();

        assertEquals(HealthState.HEALTHY, h.status());
        assertEquals(1.0, h.successRate());
        assertEquals(0, h.activeVerifications());
    }

    @Test
    void healthDegradesAndFailsOnThresholds() {
        assertEquals(HealthState.UNHEALTHY, monitoring.determineHealth(0.79, 100));
        assertEquals(HealthState.UNHEALTHY, monitoring.determineHealth(1.0, 10_001));
        assertEquals(HealthState.DEGRADED, monitoring.determineHealth(0.94, 100));
        assertEquals(HealthState.DEGRADED, monitoring.determineHealth(1.0, 7_001));
        assertEquals(HealthState.HEALTHY, monitoring.determineHealth(0.95, 7_000));
    }

    @Test
    void healthOnlyLooksAtTheLastFiveMinutes() {
        monitoring.trackVerificationSession("old", session(1, 9, 100));
        clock.advance(Duration.ofMinutes(6));
        monitoring.trackVerificationSession("new", session(10, 0, 100));

        HealthStatus h = monitoring.getHealthStatus();

        assertEquals(HealthState.HEALTHY, h.status());
        assertEquals(1, h.activeVerifications());
        assertEquals(10, h.totalVerifications());
    }

    @Test
    void flushPurgesOldSessionsOnlyOnceBufferIsLarge() {
        for (int i = 0; i < 1000; i++) {
            monitoring.trackVerificationSession("s-" + i, session(1, 0, 10));
        }
        clock.advance(Duration.ofHours(25));
        monitoring.flushMetrics();
        assertEquals(1000, monitoring.bufferedSessions());

        monitoring.trackVerificationSession("fresh", session(1, 0, 10));
        monitoring.flushMetrics();

        assertEquals(1, monitoring.bufferedSessions());
    }

    @Test
    void analyticsReportSumsSessionsInRange() {
        monitoring.trackVerificationSession("a", new VerificationSessionMetrics("b2b", 1000, 4, 6000, 3, 1, 0, 4,
                6.5, 1, 2, 0, 7.0, Map.of("url", 3, "doi", 1)));
        monitoring.trackVerificationSession("b", new VerificationSessionMetrics("b2b", 1000, 2, 6000, 2, 0, 0, 2,
                7.5, 0, 1, 1, 9.0, Map.of("url", 2)));
        clock.advance(Duration.ofHours(2));
        monitoring.trackVerificationSession("late", session(1, 0, 10));

        CitationAnalysisMetrics r = monitoring.generateAnalyticsReport(T0.minusSeconds(1), T0.plusSeconds(1));

        assertEquals(6, r.totalCitations());
        assertEquals(5, r.verifiedCitations());
        assertEquals(1, r.unverifiedCitations());
        assertEquals(7.0, r.averageAuthorityScore());
        assertEquals(8.0, r.averageRecencyScore());
        assertEquals(3.0, r.citationDensity());
        assertEquals(5, r.sourceTypeDistribution().get("url"));
        assertTrue(r.improvementSuggestions().contains("Consider increasing cache TTL to improve cache hit rates"));
        assertTrue(r.improvementSuggestions().contains("Optimize external API calls or implement request batching"));
        assertTrue(r.improvementSuggestions().contains("Favor tier-1 sources to raise the share of high-authority citations"));
    }

    @Test
    void analyticsReportIsEmptyWithoutSessions() {
        assertEquals(CitationAnalysisMetrics.empty(), monitoring.generateAnalyticsReport(T0, T0.plusSeconds(60)));
    }

    private List<String> alertTypes() {
        return monitoring.recentAlerts().stream().map(CitationAlert::type).toList();
    }

    private static VerificationSessionMetrics session(int ok, int failed, long timeMs) {
        return new VerificationSessionMetrics("b2b", 500, ok + failed, timeMs, ok, failed, 1, 1,
                7.0, ok, 0, failed, 8.0, Map.of("url", ok + failed));
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override public Instant instant() { return now; }
    }
}
