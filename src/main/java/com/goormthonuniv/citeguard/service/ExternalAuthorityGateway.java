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
import com.goormthonuniv.citeguard.monitor.ApiCallMetrics;
import com.goormthonuniv.citeguard.monitor.CitationMonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 네트워크로 나가는 모든 호출의 단일 창구.
 * 실패는 예외가 아니라 값(무효 결과, empty, FAILED)으로 돌려주고, 호출마다 모니터링에 보고한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExternalAuthorityGateway {

    static final String API_URL_VALIDATION = "url-validation";
    static final String API_CROSSREF = "crossref";

    private final UrlChecker urlChecker;
    private final List<DomainAuthorityProvider> authorityProviders;
    private final CrossRefDoiRegistry doiRegistry;
    private final ApiRetryPolicy retryPolicy;
    private final CitationMonitoringService monitoring;

    /** 형식 오류면 네트워크 호출 없이 isValid=false */
    public UrlValidationResult validateUrl(String url) {
        UrlValidationResult r = urlChecker.check(url);
        if (r.isValid()) {
            monitoring.trackApiCall(API_URL_VALIDATION, new ApiCallMetrics(
                    r.responseTimeMs(),
                    r.isAccessible(),
                    r.statusCode(),
                    r.isAccessible() ? null : (r.statusCode() == null ? "network_error" : "http_" + r.statusCode()),
                    false));
        }
        return r;
    }

    /** 폴백 순서대로 정렬된 권위 프로바이더 */
    public List<DomainAuthorityProvider> authorityProviders() {
        return authorityProviders;
    }

    public Optional<DomainAuthorityResult> getMozDomainAuthority(String domain) {
        return providerFor(AuthoritySource.MOZ).flatMap(p -> lookupAuthority(p, domain).value());
    }

    public Optional<DomainAuthorityResult> getAhrefsDomainAuthority(String domain) {
        return providerFor(AuthoritySource.AHREFS).flatMap(p -> lookupAuthority(p, domain).value());
    }

    public ProviderOutcome<DomainAuthorityResult> lookupAuthority(DomainAuthorityProvider provider, String domain) {
        if (!provider.isConfigured()) {
            log.debug("{} not configured, skipping", provider.source().label());
            return ProviderOutcome.unavailable(provider.source().label() + " not configured");
        }
        return timed(provider.source().label(), () -> provider.lookup(domain));
    }

    /** 어떤 실패든 valid=false 로 */
    public DoiVerificationResult verifyDoi(String doi) {
        if (doi == null || doi.isBlank()) {
            return DoiVerificationResult.invalid(doi, "DOI is empty", Instant.now());
        }
        ProviderOutcome<DoiVerificationResult> outcome = timed(API_CROSSREF, () -> doiRegistry.lookup(doi));
        return outcome.value()
                .orElseGet(() -> DoiVerificationResult.invalid(doi, outcome.reason(), Instant.now()));
    }

    private <T> ProviderOutcome<T> timed(String apiName, Supplier<ProviderOutcome<T>> call) {
        long start = System.currentTimeMillis();
        ProviderOutcome<T> outcome = retryPolicy.execute(apiName, call);
        long duration = System.currentTimeMillis() - start;

        if (outcome.isUnavailable()) return outcome;
        if (outcome.isSuccess()) {
            monitoring.trackApiCall(apiName, ApiCallMetrics.ok(duration, outcome.statusCode()));
        } else {
            log.warn("{} call failed: {}", apiName, outcome.reason());
            monitoring.trackApiCall(apiName, ApiCallMetrics.failed(duration, outcome.statusCode(), outcome.errorType()));
        }
        return outcome;
    }

    private Optional<DomainAuthorityProvider> providerFor(AuthoritySource source) {
        return authorityProviders.stream()
                .filter(p -> p.source() == source)
                .findFirst();
    }
}
