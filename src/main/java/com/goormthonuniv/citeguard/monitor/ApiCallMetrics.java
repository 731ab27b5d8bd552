package com.goormthonuniv.citeguard.monitor;

public record ApiCallMetrics(
        long duration,       // ms
        boolean success,
        Integer statusCode,
        String errorType,
        Boolean cacheHit
) {
    public static ApiCallMetrics ok(long duration, Integer statusCode) {
        return new ApiCallMetrics(duration, true, statusCode, null, false);
    }

    public static ApiCallMetrics failed(long duration, Integer statusCode, String errorType) {
        return new ApiCallMetrics(duration, false, statusCode, errorType, false);
    }
}
