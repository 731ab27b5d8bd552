package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuthoritySource {
    MOZ("moz"),
    AHREFS("ahrefs"),
    INTERNAL_HEURISTIC("internal-heuristic");

    private final String label;

    AuthoritySource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
