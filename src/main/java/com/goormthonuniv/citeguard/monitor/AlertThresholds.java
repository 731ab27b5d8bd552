package com.goormthonuniv.citeguard.monitor;

public record AlertThresholds(
        double lowVerificationRate,
        double highErrorRate,
        long slowResponseTime,    // ms
        double lowCacheHitRate
) {
    public static AlertThresholds defaults() {
        return new AlertThresholds(0.5, 0.1, 10_000, 0.3);
    }
}
