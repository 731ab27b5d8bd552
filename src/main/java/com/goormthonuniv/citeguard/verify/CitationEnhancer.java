package com.goormthonuniv.citeguard.verify;

import com.goormthonuniv.citeguard.dto.CitationVerificationResult;
import com.goormthonuniv.citeguard.dto.ContentDocument;
import com.goormthonuniv.citeguard.dto.ContentSection;
import com.goormthonuniv.citeguard.dto.EnhancedCitation;
import com.goormthonuniv.citeguard.dto.ExtractedCitation;
import com.goormthonuniv.citeguard.dto.Segment;
import com.goormthonuniv.citeguard.dto.VerificationStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * 권위가 낮은 인용을 세그먼트별 권위 출처로 교체하고, 원래 섹션 뒤에 참고문헌 목록을 붙인다.
 */
@Component
public class CitationEnhancer {

    static final String REFERENCES_HEADER = "\n\n**References:**\n";
    private static final Pattern TRAILING_ELLIPSIS = Pattern.compile("\\.\\.\\.$");

    private static final Map<Segment, List<String>> AUTHORITATIVE_SOURCES = Map.of(
            Segment.B2B, List.of(
                    "Harvard Business Review",
                    "Gartner",
                    "McKinsey Global Institute",
                    "MIT Technology Review",
                    "IEEE Spectrum"
            ),
            Segment.B2C, List.of(
                    "Nielsen Consumer Research",
                    "Pew Research Center",
                    "Journal of Consumer Psychology",
                    "Consumer Reports",
                    "National Institutes of Health"
            )
    );

    private final Random random;
    private final Clock clock;

    @Autowired
    public CitationEnhancer() {
        this(new Random(), Clock.systemUTC());
    }

    public CitationEnhancer(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    public static List<String> authoritativeSources(Segment segment) {
        return AUTHORITATIVE_SOURCES.get(segment);
    }

    public List<EnhancedCitation> enhance(List<CitationVerificationResult> verified, Segment segment) {
        List<String> sources = authoritativeSources(segment);
        int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();

        List<EnhancedCitation> out = new ArrayList<>(verified.size());
        for (CitationVerificationResult r : verified) {
            ExtractedCitation original = r.citation();
            if (r.verificationStatus() == VerificationStatus.HIGH_AUTHORITY) {
                out.add(EnhancedCitation.unchanged(original));
                continue;
            }
            String source = sources.get(random.nextInt(sources.size()));
            int year = currentYear - random.nextInt(2);
            String from = original.source() == null || original.source().isBlank() ? "unknown source" : original.source();
            out.add(new EnhancedCitation(
                    original.withSourceAndYear(source, year),
                    true,
                    "Replaced " + from + " with " + source,
                    original
            ));
        }
        return out;
    }

    /**
     * 보강된 인용을 발견된 섹션에 되돌려 넣는다.
     * 섹션 맵이 없던 본문은 "main" 섹션으로 정규화해서 다룬다.
     */
    public ContentDocument integrate(ContentDocument content, List<EnhancedCitation> citations) {
        Map<String, List<EnhancedCitation>> bySection = new LinkedHashMap<>();
        for (EnhancedCitation ec : citations) {
            String section = ec.citation().section();
            bySection.computeIfAbsent(section == null ? ContentDocument.MAIN_SECTION : section, k -> new ArrayList<>()).add(ec);
        }

        Map<String, ContentSection> sections = new LinkedHashMap<>();
        content.toSectionMap().forEach((key, text) -> {
            List<EnhancedCitation> mine = bySection.getOrDefault(key, List.of());
            String body = mine.isEmpty() ? text : text + referenceList(mine);
            sections.put(key, new ContentSection(body, mine));
        });
        return new ContentDocument(content.title(), null, sections);
    }

    static String referenceList(List<EnhancedCitation> citations) {
        StringBuilder sb = new StringBuilder(REFERENCES_HEADER);
        int n = 1;
        for (EnhancedCitation ec : citations) {
            ExtractedCitation c = ec.citation();
            sb.append('\n').append(n++).append(". ")
                    .append(c.source() == null ? "Unknown source" : c.source())
                    .append(" (").append(c.year() == null ? "n.d." : c.year()).append("). ")
                    .append('"').append(TRAILING_ELLIPSIS.matcher(c.text()).replaceAll("")).append('"');
            if (c.hasUrl()) sb.append(' ').append(c.url());
        }
        return sb.toString();
    }
}
