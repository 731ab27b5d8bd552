package com.goormthonuniv.citeguard.monitor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
