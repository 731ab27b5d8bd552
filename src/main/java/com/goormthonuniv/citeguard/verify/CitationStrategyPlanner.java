package com.goormthonuniv.citeguard.verify;

import com.goormthonuniv.citeguard.dto.CitationStrategy;
import com.goormthonuniv.citeguard.dto.CitationStrategy.AuthorityHierarchy;
import com.goormthonuniv.citeguard.dto.CitationStrategy.DensityRecommendation;
import com.goormthonuniv.citeguard.dto.CitationStrategy.QualityThresholds;
import com.goormthonuniv.citeguard.dto.CitationStrategy.VisualPresentation;
import com.goormthonuniv.citeguard.dto.Segment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/** (topic, segment) 만으로 정해지는 인용 전략. 외부 호출 없음. */
@Component
public class CitationStrategyPlanner {

    private static final String KEY_CLAIM_REQUIREMENT = "All significant claims require citation";

    private final Clock clock;

    @Autowired
    public CitationStrategyPlanner() {
        this(Clock.systemUTC());
    }

    public CitationStrategyPlanner(Clock clock) {
        this.clock = clock;
    }

    public CitationStrategy plan(String topic, Segment segment) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(segment, "segment");

        boolean b2b = segment == Segment.B2B;
        return new CitationStrategy(
                topic,
                segment,
                b2b ? List.of("Industry research reports", "Academic papers", "Technical documentation",
                              "Case studies", "Industry standards bodies")
                    : List.of("Consumer research studies", "Expert opinions", "Trusted media publications",
                              "Government/official sources", "User surveys and data"),
                b2b ? List.of("IEEE", "APA", "Industry-specific", "Technical whitepaper")
                    : List.of("APA", "Chicago", "Hyperlinked", "Footnoted"),
                hierarchy(segment),
                b2b ? new DensityRecommendation(2, 3, KEY_CLAIM_REQUIREMENT)
                    : new DensityRecommendation(1, 2, KEY_CLAIM_REQUIREMENT),
                b2b ? new VisualPresentation("Numbered references", "Required", "Subtle")
                    : new VisualPresentation("Hyperlinked text", "Optional", "Noticeable but unobtrusive"),
                b2b ? new QualityThresholds(7.0, 3, List.of("academic", "report"))
                    : new QualityThresholds(6.0, 5, List.of("url", "report")),
                clock.instant()
        );
    }

    private static AuthorityHierarchy hierarchy(Segment segment) {
        if (segment == Segment.B2B) {
            return new AuthorityHierarchy(
                    List.of("Peer-reviewed academic research", "Industry standards organizations", "Major research institutions"),
                    List.of("Industry analyst reports", "Technical documentation", "White papers from major vendors"),
                    List.of("Case studies", "Industry blogs from recognized experts", "Conference proceedings"),
                    List.of("Industry forums", "Company blogs", "Opinion pieces")
            );
        }
        return new AuthorityHierarchy(
                List.of("Government health/safety agencies", "Major academic research institutions", "Peer-reviewed journals"),
                List.of("Major consumer research organizations", "Established media with fact-checking", "Industry expert opinions"),
                List.of("Smaller studies", "Expert blogs", "Industry publications"),
                List.of("Consumer testimonials", "Social media", "Opinion content")
        );
    }
}
