package com.goormthonuniv.citeguard.authority;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.citeguard.dto.AuthoritySource;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import com.goormthonuniv.citeguard.verify.DomainAuthorityHeuristics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@Order(1)
public class MozAuthorityProvider implements DomainAuthorityProvider {

    private final RestClient rest;
    private final String endpoint;
    private final String accessId;
    private final String secret;

    public MozAuthorityProvider(RestClient rest,
                                @Value("${citeguard.authority.moz.endpoint:https://lsapi.seomoz.com}") String endpoint,
                                @Value("${citeguard.authority.moz.accessId:}") String accessId,
                                @Value("${citeguard.authority.moz.secret:}") String secret) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.accessId = accessId;
        this.secret = secret;
    }

    @Override public AuthoritySource source() { return AuthoritySource.MOZ; }

    @Override
    public boolean isConfigured() {
        return accessId != null && !accessId.isBlank() && secret != null && !secret.isBlank();
    }

    @Override
    public ProviderOutcome<DomainAuthorityResult> lookup(String domain) {
        if (!isConfigured()) {
            return ProviderOutcome.unavailable("Moz API credentials not configured");
        }
        try {
            log.debug("Getting Moz domain authority for: {}", domain);
            JsonNode res = rest.post()
                    .uri(endpoint + "/linkscape/url-metrics/{domain}", domain)
                    .headers(h -> h.setBasicAuth(accessId, secret))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("targets", List.of(domain)))
                    .retrieve()
                    .body(JsonNode.class);

            if (res == null || !res.isObject()) {
                return ProviderOutcome.failed("empty Moz response", 200, false);
            }

            return ProviderOutcome.success(new DomainAuthorityResult(
                    domain,
                    res.path("domain_authority").asDouble(0),
                    res.path("page_authority").asDouble(0),
                    res.path("spam_score").asDouble(0),
                    res.path("external_equity_links").asLong(0),
                    res.path("linking_root_domains").asLong(0),
                    DomainAuthorityHeuristics.isGovernment(domain),
                    DomainAuthorityHeuristics.isEducational(domain),
                    DomainAuthorityHeuristics.isNonProfit(domain),
                    DomainAuthorityHeuristics.isNewsDomain(domain),
                    AuthoritySource.MOZ,
                    Instant.now()
            ), 200);
        } catch (Exception e) {
            log.warn("Moz API request failed for {}: {}", domain, e.getMessage());
            return ProviderOutcome.fromException(e);
        }
    }
}
