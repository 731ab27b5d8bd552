package com.goormthonuniv.citeguard.service;

import com.goormthonuniv.citeguard.authority.ApiRetryPolicy;
import com.goormthonuniv.citeguard.authority.CrossRefDoiRegistry;
import com.goormthonuniv.citeguard.authority.DomainAuthorityProvider;
import com.goormthonuniv.citeguard.authority.ProviderOutcome;
import com.goormthonuniv.citeguard.authority.UrlChecker;
import com.goormthonuniv.citeguard.dto.AuthoritySource;
import com.goormthonuniv.citeguard.dto.DoiVerificationResult;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import com.goormthonuniv.citeguard.dto.UrlValidationResult;
import com.goormthonuniv.citeguard.monitor.AlertThresholds;
import com.goormthonuniv.citeguard.monitor.CitationMonitoringService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ExternalAuthorityGatewayTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private SimpleMeterRegistry registry;
    private UrlChecker urlChecker;
    private DomainAuthorityProvider moz;
    private DomainAuthorityProvider ahrefs;
    private CrossRefDoiRegistry doiRegistry;
    private ExternalAuthorityGateway gateway;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        urlChecker = mock(UrlChecker.class);
        moz = provider(AuthoritySource.MOZ, true);
        ahrefs = provider(AuthoritySource.AHREFS, false);
        doiRegistry = mock(CrossRefDoiRegistry.class);
        CitationMonitoringService monitoring = new CitationMonitoringService(registry,
                mock(ApplicationEventPublisher.class), AlertThresholds.defaults(), Clock.systemUTC());

        gateway = new ExternalAuthorityGateway(urlChecker, List.of(moz, ahrefs), doiRegistry,
                new ApiRetryPolicy(2, 0), monitoring);
    }

    @Test
    void unconfiguredProviderIsSkippedWithoutMetrics() {
        ProviderOutcome<DomainAuthorityResult> out = gateway.lookupAuthority(ahrefs, "nature.com");

        assertTrue(out.isUnavailable());
        verify(ahrefs, never()).lookup(anyString());
        assertEquals(Optional.empty(), gateway.getAhrefsDomainAuthority("nature.com"));
        assertNull(registry.find("citation.api.calls").tag("api", "ahrefs").counter());
    }

    @Test
    void successfulLookupIsTrackedUnderProviderName() {
        DomainAuthorityResult result = authority("nature.com", 93);
        when(moz.lookup("nature.com")).thenReturn(ProviderOutcome.success(result, 200));

        Optional<DomainAuthorityResult> out = gateway.getMozDomainAuthority("nature.com");

        assertEquals(Optional.of(result), out);
        Counter calls = registry.find("citation.api.calls").tags("api", "moz", "outcome", "success").counter();
        assertNotNull(calls);
        assertEquals(1.0, calls.count());
    }

    @Test
    void transientFailureIsRetriedThenReported() {
        when(moz.lookup("nature.com")).thenReturn(ProviderOutcome.failed("HTTP 502", 502, true));

        ProviderOutcome<DomainAuthorityResult> out = gateway.lookupAuthority(moz, "nature.com");

        assertFalse(out.isSuccess());
        verify(moz, times(2)).lookup("nature.com");
        Counter failures = registry.find("citation.api.calls").tags("api", "moz", "outcome", "server_error").counter();
        assertNotNull(failures);
        assertEquals(1.0, failures.count());
    }

    @Test
    void doiFailureBecomesInvalidResult() {
        when(doiRegistry.lookup("10.9999/missing")).thenReturn(ProviderOutcome.failed("HTTP 404", 404, false));

        DoiVerificationResult r = gateway.verifyDoi("10.9999/missing");

        assertFalse(r.valid());
        assertEquals("HTTP 404", r.error());
        assertEquals("10.9999/missing", r.doi());
    }

    @Test
    void blankDoiIsInvalidWithoutLookup() {
        assertFalse(gateway.verifyDoi(" ").valid());
        verifyNoInteractions(doiRegistry);
    }

    @Test
    void doiSuccessPassesThrough() {
        DoiVerificationResult ok = new DoiVerificationResult("10.1/x", true, Map.of("title", "T"), null, NOW);
        when(doiRegistry.lookup("10.1/x")).thenReturn(ProviderOutcome.success(ok, 200));

        assertSame(ok, gateway.verifyDoi("10.1/x"));
    }

    @Test
    void onlyWellFormedUrlsAreTracked() {
        when(urlChecker.check("bad")).thenReturn(new UrlValidationResult("bad", false, false, null, null, null,
                null, false, List.of("Invalid URL format"), NOW, 0));
        when(urlChecker.check("https://a.org")).thenReturn(new UrlValidationResult("https://a.org", true, false, 404,
                null, null, null, true, List.of("HTTP 404"), NOW, 5));

        gateway.validateUrl("bad");
        assertNull(registry.find("citation.api.calls").tag("api", "url-validation").counter());

        gateway.validateUrl("https://a.org");
        Counter calls = registry.find("citation.api.calls").tags("api", "url-validation", "outcome", "http_404").counter();
        assertNotNull(calls);
        assertEquals(1.0, calls.count());
    }

    private static DomainAuthorityProvider provider(AuthoritySource source, boolean configured) {
        DomainAuthorityProvider p = mock(DomainAuthorityProvider.class);
        when(p.source()).thenReturn(source);
        when(p.isConfigured()).thenReturn(configured);
        return p;
    }

    static DomainAuthorityResult authority(String domain, double score) {
        return new DomainAuthorityResult(domain, score, score, null, null, null,
                false, false, false, false, AuthoritySource.MOZ, NOW);
    }
}
