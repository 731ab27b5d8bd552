package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CitationType {
    URL("url"),
    DOI("doi"),
    ACADEMIC("academic"),
    BOOK("book"),
    REPORT("report"),
    OTHER("other");

    private final String label;

    CitationType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** AI 추출 결과처럼 느슨한 라벨을 받아들인다. 모르는 값은 OTHER. */
    @JsonCreator
    public static CitationType fromLabel(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        String l = raw.trim().toLowerCase(Locale.ROOT);
        if (l.equals("website") || l.equals("web")) return URL;
        if (l.equals("paper") || l.equals("journal")) return ACADEMIC;
        for (CitationType t : values()) {
            if (t.label.equals(l)) return t;
        }
        return OTHER;
    }
}
