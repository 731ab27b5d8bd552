package com.goormthonuniv.citeguard.service;

import com.goormthonuniv.citeguard.authority.DomainAuthorityProvider;
import com.goormthonuniv.citeguard.authority.ProviderOutcome;
import com.goormthonuniv.citeguard.cache.CacheKind;
import com.goormthonuniv.citeguard.cache.CitationCacheStore;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import com.goormthonuniv.citeguard.verify.DomainAuthorityHeuristics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * 도메인 권위 폴백 체인: 캐시 → Moz → Ahrefs → 정적 휴리스틱.
 * 어느 단계에서 얻었든 결과는 domain 캐시에 다시 쓴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DomainAuthorityResolver {

    private final ExternalAuthorityGateway gateway;
    private final DomainAuthorityHeuristics heuristics;
    private final CitationCacheStore cache;

    public DomainAuthorityResult resolve(String domain) {
        Optional<DomainAuthorityResult> cached = cache.get(CacheKind.DOMAIN, domain);
        if (cached.isPresent()) {
            return cached.get();
        }

        DomainAuthorityResult resolved = null;
        for (DomainAuthorityProvider provider : gateway.authorityProviders()) {
            ProviderOutcome<DomainAuthorityResult> outcome = gateway.lookupAuthority(provider, domain);
            if (outcome.isSuccess()) {
                resolved = outcome.get();
                break;
            }
            log.debug("{} authority unavailable for {}: {}", provider.source().label(), domain, outcome.reason());
        }
        if (resolved == null) {
            resolved = heuristics.assess(domain, Instant.now());
            log.debug("Heuristic authority for {}: {}", domain, resolved.authorityScore());
        }

        cache.set(CacheKind.DOMAIN, domain, resolved);
        return resolved;
    }
}
