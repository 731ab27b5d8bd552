package com.goormthonuniv.citeguard.cache;

import com.goormthonuniv.citeguard.dto.CitationVerificationResult;
import com.goormthonuniv.citeguard.dto.DomainAuthorityResult;
import com.goormthonuniv.citeguard.dto.UrlValidationResult;

import java.util.List;

/** 캐시에 담기는 결과 종류. 키 접두사 겸 타입 토큰. */
public final class CacheKind<T> {

    public static final CacheKind<CitationVerificationResult> CITATION =
            new CacheKind<>("citation", CitationVerificationResult.class);
    public static final CacheKind<DomainAuthorityResult> DOMAIN =
            new CacheKind<>("domain", DomainAuthorityResult.class);
    public static final CacheKind<UrlValidationResult> URL =
            new CacheKind<>("url", UrlValidationResult.class);

    private final String prefix;
    private final Class<T> resultType;

    private CacheKind(String prefix, Class<T> resultType) {
        this.prefix = prefix;
        this.resultType = resultType;
    }

    public static List<CacheKind<?>> values() {
        return List.of(CITATION, DOMAIN, URL);
    }

    public String prefix() { return prefix; }

    public String compositeKey(String rawKey) {
        return prefix + ":" + rawKey;
    }

    T cast(Object value) {
        return resultType.cast(value);
    }

    @Override
    public String toString() {
        return prefix;
    }
}
