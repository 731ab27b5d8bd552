package com.goormthonuniv.citeguard.monitor;

import java.time.Instant;
import java.util.Map;

/** 임계치 알림. ApplicationEvent 로 발행된다. */
public record CitationAlert(
        String type,   // LowVerificationRate | SlowVerificationResponse | SlowApiResponse | LowCacheHitRate | HighApiErrorRate
        Map<String, Object> details,
        Instant raisedAt
) {
    public static final String LOW_VERIFICATION_RATE = "LowVerificationRate";
    public static final String SLOW_VERIFICATION_RESPONSE = "SlowVerificationResponse";
    public static final String SLOW_API_RESPONSE = "SlowApiResponse";
    public static final String LOW_CACHE_HIT_RATE = "LowCacheHitRate";
    public static final String HIGH_API_ERROR_RATE = "HighApiErrorRate";

    public CitationAlert {
        details = Map.copyOf(details);
    }
}
