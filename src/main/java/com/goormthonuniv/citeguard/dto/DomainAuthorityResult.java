package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainAuthorityResult(
        String domain,
        double authorityScore,   // 0~100
        double trustScore,       // 0~100
        Double spamScore,
        Long backlinks,
        Long referringDomains,
        boolean isGovernment,
        boolean isEducational,
        boolean isNonProfit,
        boolean isNews,
        AuthoritySource source,
        Instant checkedAt
) {}
