package com.goormthonuniv.citeguard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.citeguard.dto.CitationExtractionResult;
import com.goormthonuniv.citeguard.dto.CitationType;
import com.goormthonuniv.citeguard.dto.ContentDocument;
import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.llm.CompletionResponse;
import com.goormthonuniv.citeguard.llm.TextGenerationException;
import com.goormthonuniv.citeguard.llm.TextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CitationExtractionServiceTest {

    private TextGenerator textGenerator;
    private CitationExtractionService service;

    @BeforeEach
    void setUp() {
        textGenerator = mock(TextGenerator.class);
        when(textGenerator.generateCompletion(any())).thenThrow(new TextGenerationException("no provider"));
        service = new CitationExtractionService(textGenerator, new ObjectMapper());
    }

    @Test
    void emptyContentYieldsNothing() {
        CitationExtractionResult r = service.extractCitations(ContentDocument.ofText(""));

        assertEquals(0, r.totalFound());
        assertTrue(r.citations().isEmpty());
        assertEquals(0.0, r.confidence());
        assertEquals(CitationExtractionService.METHOD_HYBRID, r.extractionMethod());
        verify(textGenerator, never()).generateCompletion(any());
    }

    @Test
    void nullContentYieldsNothing() {
        CitationExtractionResult r = service.extractCitations(null);

        assertEquals(0, r.totalFound());
    }

    @Test
    void singleUrlIsExtractedEvenWhenAiFails() {
        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("See https://www.nature.com/articles/123 for details"));

        assertEquals(1, r.totalFound());
        ExtractedCitation c = r.citations().get(0);
        assertEquals(CitationType.URL, c.type());
        assertEquals("https://www.nature.com/articles/123", c.url());
        assertEquals("main", c.section());
        assertEquals(4, c.position().start());
        assertTrue(c.id().startsWith("citation-extract-"));
        assertTrue(c.id().endsWith("-1"));
        assertEquals(Map.of("url", 1), r.byType());
        assertEquals(Map.of("main", 1), r.bySection());
    }

    @Test
    void trailingPunctuationIsNotPartOfTheUrl() {
        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("Read more at https://example.org/report."));

        assertEquals("https://example.org/report", r.citations().get(0).url());
    }

    @Test
    void repeatedUrlIsReportedOnce() {
        CitationExtractionResult r = service.extractCitations(ContentDocument.ofText(
                "Source: https://a.example.com/x and later again https://a.example.com/x"));

        assertEquals(1, r.totalFound());
    }

    @Test
    void doiIsExtractedWithResolverUrl() {
        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("The trial is described in doi: 10.1000/xyz123."));

        assertEquals(1, r.totalFound());
        ExtractedCitation c = r.citations().get(0);
        assertEquals(CitationType.DOI, c.type());
        assertEquals("10.1000/xyz123", c.doi());
        assertEquals("https://doi.org/10.1000/xyz123", c.url());
    }

    @Test
    void doiLinkIsOneCitationCarryingBothFields() {
        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("Published at https://doi.org/10.1038/abc in 2021"));

        assertEquals(1, r.totalFound());
        ExtractedCitation c = r.citations().get(0);
        assertEquals(CitationType.URL, c.type());
        assertEquals("10.1038/abc", c.doi());
    }

    @Test
    void legacyDoiResolverLinkIsCanonicalizedAndDeduplicated() {
        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("Data from http://dx.doi.org/10.1000/xyz supports this."));

        assertEquals(1, r.totalFound());
        ExtractedCitation c = r.citations().get(0);
        assertEquals("https://doi.org/10.1000/xyz", c.url());
        assertEquals("10.1000/xyz", c.doi());
    }

    @Test
    void academicReferenceIsParsed() {
        CitationExtractionResult r = service.extractCitations(ContentDocument.ofText(
                "As shown by Smith and Jones (2020). Deep learning at scale. Journal of AI. More text follows"));

        assertEquals(1, r.totalFound());
        ExtractedCitation c = r.citations().get(0);
        assertEquals(CitationType.ACADEMIC, c.type());
        assertEquals(List.of("Smith", "Jones"), c.authors());
        assertEquals(2020, c.year());
        assertEquals("Deep learning at scale", c.title());
        assertEquals("Journal of AI", c.source());
    }

    @Test
    void sectionsAreScannedSeparately() {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put("intro", "Intro cites https://intro.example.com/a");
        sections.put("body", "Body cites https://body.example.com/b");

        CitationExtractionResult r = service.extractCitations(ContentDocument.ofSections("Doc", sections));

        assertEquals(2, r.totalFound());
        assertEquals(Map.of("intro", 1, "body", 1), r.bySection());
        assertEquals("intro", r.citations().get(0).section());
    }

    @Test
    void aiCitationsInsideCodeFenceAreMerged() {
        reset(textGenerator);
        when(textGenerator.generateCompletion(any())).thenReturn(new CompletionResponse("""
                ```json
                [{"text": "Gartner market guide", "type": "report", "year": "2023", "source": "Gartner"},
                 {"type": "website"}]
                ```"""));

        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("According to Gartner, spending grew. See https://example.com/g"));

        assertEquals(2, r.totalFound());
        ExtractedCitation ai = r.citations().get(1);
        assertEquals(CitationExtractionService.AI_SECTION, ai.section());
        assertEquals(CitationType.REPORT, ai.type());
        assertEquals(2023, ai.year());
        assertEquals("Gartner", ai.source());
        assertEquals(Map.of("url", 1, "report", 1), r.byType());
    }

    @Test
    void malformedAiJsonIsIgnored() {
        reset(textGenerator);
        when(textGenerator.generateCompletion(any())).thenReturn(new CompletionResponse("not json at all"));

        CitationExtractionResult r = service.extractCitations(
                ContentDocument.ofText("Link https://example.com/a"));

        assertEquals(1, r.totalFound());
        assertEquals(CitationExtractionService.METHOD_HYBRID, r.extractionMethod());
    }

    @Test
    void confidenceRewardsStructureAndTypeVariety() {
        ExtractedCitation url = new ExtractedCitation(null, "t", "https://a.com", null,
                null, null, null, null, "main", null, CitationType.URL);
        ExtractedCitation bare = new ExtractedCitation(null, "plain mention", null, null,
                null, null, null, null, "main", null, CitationType.OTHER);

        assertEquals(0.0, CitationExtractionService.confidence(List.of()));
        assertEquals(0.5 + 0.3 + 0.04, CitationExtractionService.confidence(List.of(url)), 1e-9);
        assertEquals(0.5 + 0.15 + 0.08, CitationExtractionService.confidence(List.of(url, bare)), 1e-9);
    }

    @Test
    void deduplicateKeepsFirstAndDropsEmpty() {
        ExtractedCitation first = new ExtractedCitation(null, "first", "https://a.com", null,
                null, null, null, null, "intro", null, CitationType.URL);
        ExtractedCitation second = new ExtractedCitation(null, "second", "https://a.com", null,
                null, null, null, null, "body", null, CitationType.URL);
        ExtractedCitation empty = new ExtractedCitation(null, "", null, null,
                null, null, null, null, "body", null, CitationType.OTHER);

        List<ExtractedCitation> out = CitationExtractionService.deduplicate(List.of(first, second, empty));

        assertEquals(List.of(first), out);
    }
}
