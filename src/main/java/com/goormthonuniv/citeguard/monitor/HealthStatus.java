package com.goormthonuniv.citeguard.monitor;

import java.time.Instant;

public record HealthStatus(
        HealthState status,
        double successRate,
        double averageResponseTime,
        int activeVerifications,   // 최근 5분 세션 수
        int totalVerifications,
        Instant timestamp
) {}
