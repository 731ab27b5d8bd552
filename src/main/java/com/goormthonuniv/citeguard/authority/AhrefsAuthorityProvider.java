package com.goormthonuniv.citeguard.authority;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.citeguard.dto.AuthoritySource;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import com.goormthonuniv.citeguard.verify.DomainAuthorityHeuristics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;

@Slf4j
@Component
@Order(2)
public class AhrefsAuthorityProvider implements DomainAuthorityProvider {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;

    public AhrefsAuthorityProvider(RestClient rest,
                                   @Value("${citeguard.authority.ahrefs.endpoint:https://apiv2.ahrefs.com}") String endpoint,
                                   @Value("${citeguard.authority.ahrefs.apiKey:}") String apiKey) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override public AuthoritySource source() { return AuthoritySource.AHREFS; }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ProviderOutcome<DomainAuthorityResult> lookup(String domain) {
        if (!isConfigured()) {
            return ProviderOutcome.unavailable("Ahrefs API key not configured");
        }
        try {
            log.debug("Getting Ahrefs domain authority for: {}", domain);
            JsonNode res = rest.get()
                    .uri(endpoint + "/domain-rating?target={target}&token={token}", domain, apiKey)
                    .retrieve()
                    .body(JsonNode.class);

            if (res == null || !res.isObject()) {
                return ProviderOutcome.failed("empty Ahrefs response", 200, false);
            }

            // Ahrefs 는 trust 점수가 따로 없어서 rating 을 그대로 쓴다
            double rating = res.path("domain_rating").asDouble(0);
            return ProviderOutcome.success(new DomainAuthorityResult(
                    domain,
                    rating,
                    rating,
                    null,
                    res.path("backlinks").asLong(0),
                    res.path("referring_domains").asLong(0),
                    DomainAuthorityHeuristics.isGovernment(domain),
                    DomainAuthorityHeuristics.isEducational(domain),
                    DomainAuthorityHeuristics.isNonProfit(domain),
                    DomainAuthorityHeuristics.isNewsDomain(domain),
                    AuthoritySource.AHREFS,
                    Instant.now()
            ), 200);
        } catch (Exception e) {
            log.warn("Ahrefs API request failed for {}: {}", domain, e.getMessage());
            return ProviderOutcome.fromException(e);
        }
    }
}
