package com.goormthonuniv.citeguard.monitor;

import com.goormthonuniv.citeguard.cache.CacheStats;
import com.goormthonuniv.citeguard.cache.CitationCacheStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/** /actuator/health 의 "citation" 항목 */
@Component("citation")
@RequiredArgsConstructor
public class CitationHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "citation verification is slow or partially failing");

    private final CitationMonitoringService monitoring;
    private final CitationCacheStore cache;

    @Override
    public Health health() {
        HealthStatus h = monitoring.getHealthStatus();
        CacheStats stats = cache.stats();

        Health.Builder builder = switch (h.status()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status(DEGRADED);
            case UNHEALTHY -> Health.down();
        };
        return builder
                .withDetail("state", h.status().label())
                .withDetail("successRate", h.successRate())
                .withDetail("averageResponseTime", h.averageResponseTime())
                .withDetail("activeVerifications", h.activeVerifications())
                .withDetail("totalVerifications", h.totalVerifications())
                .withDetail("cacheEnabled", stats.enabled())
                .withDetail("cacheEntries", stats.totalEntries())
                .withDetail("cacheHitRate", stats.hitRate())
                .withDetail("cacheEvictions", stats.evictions())
                .withDetail("recentAlerts", monitoring.recentAlerts().size())
                .build();
    }
}
