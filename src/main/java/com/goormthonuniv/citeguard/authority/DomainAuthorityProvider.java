package com.goormthonuniv.citeguard.authority;

import com.goormthonuniv.citeguard.dto.AuthoritySource;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;

/** 도메인 권위(0~100) 프로바이더. 주입 순서(@Order)가 폴백 순서. */
public interface DomainAuthorityProvider {
    AuthoritySource source(); // moz, ahrefs

    /** 자격증명이 없으면 false. lookup 은 호출 없이 UNAVAILABLE 을 돌려준다. */
    boolean isConfigured();

    ProviderOutcome<DomainAuthorityResult> lookup(String domain);
}
