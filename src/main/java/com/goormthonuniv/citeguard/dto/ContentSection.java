package com.goormthonuniv.citeguard.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** 섹션 본문. JSON 에서는 문자열 하나만 와도 된다. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ContentSection(
        String content,
        List<EnhancedCitation> citations   // 보강 후에만 채워짐
) {
    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public ContentSection(@JsonProperty("content") String content,
                          @JsonProperty("citations") List<EnhancedCitation> citations) {
        this.content = content == null ? "" : content;
        this.citations = citations == null ? List.of() : List.copyOf(citations);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ContentSection of(String content) {
        return new ContentSection(content, List.of());
    }
}
