package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Segment {
    B2B,
    B2C;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Segment fromLabel(String raw) {
        if (raw == null) throw new IllegalArgumentException("segment is required");
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
