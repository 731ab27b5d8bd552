package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedCitation(
        String id,               // 중복 제거 후 부여
        String text,             // 주변 문맥 스니펫
        String url,
        String doi,
        String title,
        List<String> authors,
        Integer year,
        String source,
        String section,          // 발견된 섹션 키
        CitationPosition position,
        CitationType type
) {
    public ExtractedCitation {
        authors = authors == null ? List.of() : List.copyOf(authors);
        text = text == null ? "" : text;
        position = position == null ? CitationPosition.UNKNOWN : position;
        type = type == null ? CitationType.OTHER : type;
    }

    public ExtractedCitation withId(String newId) {
        return new ExtractedCitation(newId, text, url, doi, title, authors, year, source, section, position, type);
    }

    public ExtractedCitation withSourceAndYear(String newSource, Integer newYear) {
        return new ExtractedCitation(id, text, url, doi, title, authors, newYear, newSource, section, position, type);
    }

    public boolean hasUrl() { return url != null && !url.isBlank(); }

    public boolean hasDoi() { return doi != null && !doi.isBlank(); }

    public boolean hasIdentity() {
        return hasUrl() || hasDoi() || !authors.isEmpty()
                || (title != null && !title.isBlank())
                || (source != null && !source.isBlank())
                || year != null
                || !text.isBlank();
    }

    /** 중복 제거/캐시 키의 기준: url, doi, 없으면 text 앞 100자 */
    public String identityKey() {
        if (hasUrl()) return url;
        if (hasDoi()) return doi;
        return text.length() > 100 ? text.substring(0, 100) : text;
    }
}
