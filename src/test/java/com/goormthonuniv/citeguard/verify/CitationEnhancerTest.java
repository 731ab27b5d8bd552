package com.goormthonuniv.citeguard.verify;

import com.goormthonuniv.citeguard.dto.CitationPosition;
import com.goormthonuniv.citeguard.dto.CitationType;
import com.goormthonuniv.citeguard.dto.CitationVerificationResult;
import com.goormthonuniv.citeguard.dto.ContentDocument;
import com.goormthonuniv.citeguard.dto.ContentSection;
import com.goormthonuniv.citeguard.dto.EnhancedCitation;
import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.dto.Segment;
import com.goormthonuniv.citeguard.dto.VerificationMetadata;
import com.goormthonuniv.citeguard.dto.VerificationStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CitationEnhancerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    /** 항상 0 을 내는 난수원 → 목록 첫 번째 출처, 올해 */
    private final Random firstPick = new Random() {
        @Override
        public int nextInt(int bound) {
            return 0;
        }
    };

    private final CitationEnhancer enhancer = new CitationEnhancer(firstPick, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void replacesOnlyCitationsBelowHighAuthority() {
        ExtractedCitation strong = citation("https://www.nature.com/a", "Nature", 2024, "intro");
        ExtractedCitation weak = citation("https://blog.example.io/b", "Some Blog", 2012, "intro");

        List<EnhancedCitation> out = enhancer.enhance(List.of(
                result(strong, VerificationStatus.HIGH_AUTHORITY),
                result(weak, VerificationStatus.LOW_AUTHORITY)), Segment.B2B);

        assertFalse(out.get(0).enhanced());
        assertSame(strong, out.get(0).citation());

        EnhancedCitation replaced = out.get(1);
        assertTrue(replaced.enhanced());
        assertEquals("Harvard Business Review", replaced.citation().source());
        assertEquals(2025, replaced.citation().year());
        assertEquals(weak, replaced.originalCitation());
        assertTrue(replaced.enhancementReason().contains("Some Blog"));
    }

    @Test
    void b2cUsesConsumerSourceList() {
        ExtractedCitation weak = citation("https://blog.example.io/b", null, null, "main");

        EnhancedCitation e = enhancer.enhance(List.of(result(weak, VerificationStatus.UNVERIFIED)), Segment.B2C).get(0);

        assertEquals("Nielsen Consumer Research", e.citation().source());
        assertTrue(CitationEnhancer.authoritativeSources(Segment.B2C).contains(e.citation().source()));
    }

    @Test
    void integrateAppendsNumberedReferencesToOriginatingSection() {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put("intro", "Intro text https://blog.example.io/b here.");
        sections.put("outro", "Nothing cited.");
        ContentDocument doc = ContentDocument.ofSections("Doc", sections);

        ExtractedCitation c = citation("https://blog.example.io/b", "Gartner", 2025, "intro");
        ContentDocument out = enhancer.integrate(doc, List.of(new EnhancedCitation(c, true, "r", c)));

        ContentSection intro = out.sections().get("intro");
        assertEquals("Intro text https://blog.example.io/b here."
                + "\n\n**References:**\n"
                + "\n1. Gartner (2025). \"context for https://blog.example.io/b\" https://blog.example.io/b",
                intro.content());
        assertEquals(1, intro.citations().size());
        assertEquals("Nothing cited.", out.sections().get("outro").content());
        assertEquals("Doc", out.title());
    }

    @Test
    void plainContentIsIntegratedThroughMainSection() {
        ExtractedCitation c = citation("https://x.example/1", "Gartner", 2025, ContentDocument.MAIN_SECTION);

        ContentDocument out = enhancer.integrate(ContentDocument.ofText("Body."),
                List.of(new EnhancedCitation(c, true, "r", c)));

        assertTrue(out.hasSections());
        assertTrue(out.sections().get("main").content().startsWith("Body.\n\n**References:**\n"));
    }

    private static ExtractedCitation citation(String url, String source, Integer year, String section) {
        return new ExtractedCitation("citation-1", "context for " + url, url, null, null, null, year, source,
                section, new CitationPosition(0, 10), CitationType.URL);
    }

    private static CitationVerificationResult result(ExtractedCitation c, VerificationStatus status) {
        return new CitationVerificationResult(c, Map.of("authorityScore", 5.0), true, null, 5.0, status,
                List.of(), List.of(), new VerificationMetadata(NOW, VerificationMetadata.METHOD_PRODUCTION, null, null));
    }
}
