package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 검증 대상 콘텐츠.
 * - 문자열 본문 하나(content) 또는 섹션 맵(sections) 중 하나를 가진다.
 * - 추출기는 {@link #toSectionMap()} 으로 정규화된 섹션 맵만 본다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentDocument(
        String title,
        String content,
        Map<String, ContentSection> sections
) {
    public static final String MAIN_SECTION = "main";

    public ContentDocument {
        sections = sections == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    public static ContentDocument ofText(String text) {
        return new ContentDocument(null, text, null);
    }

    public static ContentDocument ofSections(String title, Map<String, String> sectionTexts) {
        Map<String, ContentSection> m = new LinkedHashMap<>();
        sectionTexts.forEach((k, v) -> m.put(k, ContentSection.of(v)));
        return new ContentDocument(title, null, m);
    }

    public static ContentDocument empty() {
        return new ContentDocument(null, null, null);
    }

    public boolean hasSections() {
        return sections != null && !sections.isEmpty();
    }

    /** sections 가 있으면 그대로, 없으면 {"main": content}, 둘 다 없으면 빈 맵 */
    public Map<String, String> toSectionMap() {
        Map<String, String> out = new LinkedHashMap<>();
        if (hasSections()) {
            sections.forEach((k, s) -> out.put(k, s == null ? "" : s.content()));
        } else if (content != null && !content.isEmpty()) {
            out.put(MAIN_SECTION, content);
        }
        return out;
    }

    public int wordCount() {
        int words = 0;
        for (String text : toSectionMap().values()) {
            String t = text.strip();
            if (!t.isEmpty()) words += t.split("\\s+").length;
        }
        return words;
    }
}
