package com.goormthonuniv.citeguard.dto;

public record CitationPosition(
        int start,   // 섹션 텍스트 기준 문자 오프셋
        int end
) {
    public static final CitationPosition UNKNOWN = new CitationPosition(0, 0);
}
