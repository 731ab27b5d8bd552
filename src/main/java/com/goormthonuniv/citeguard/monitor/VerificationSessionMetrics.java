package com.goormthonuniv.citeguard.monitor;

import java.util.Map;

public record VerificationSessionMetrics(
        String segment,
        int contentLength,          // 단어 수
        int citationsFound,
        long verificationTime,      // ms
        int successfulVerifications,
        int failedVerifications,
        int cacheHits,
        int apiCalls,
        double overallScore,
        int highAuthority,
        int moderateAuthority,
        int lowAuthority,
        double averageRecencyScore,
        Map<String, Integer> typeDistribution
) {
    public VerificationSessionMetrics {
        typeDistribution = typeDistribution == null ? Map.of() : Map.copyOf(typeDistribution);
    }

    /** 검증이 한 건도 없으면 1.0 */
    public double successRate() {
        int total = successfulVerifications + failedVerifications;
        return total == 0 ? 1.0 : (double) successfulVerifications / total;
    }

    /** 조회가 한 건도 없으면 1.0 */
    public double cacheHitRate() {
        int total = cacheHits + apiCalls;
        return total == 0 ? 1.0 : (double) cacheHits / total;
    }
}
