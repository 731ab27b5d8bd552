package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VerificationStatus {
    HIGH_AUTHORITY("high_authority"),
    MODERATE_AUTHORITY("moderate_authority"),
    LOW_AUTHORITY("low_authority"),
    UNVERIFIED("unverified");

    private final String label;

    VerificationStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
