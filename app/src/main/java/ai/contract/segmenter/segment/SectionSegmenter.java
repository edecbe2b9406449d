package ai.contract.segmenter.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits normalized contract text into sections at every line the {@link HeadingClassifier} accepts.
 *
 * <p>A heading line is never part of a section body. Sections whose body is blank are not emitted, so a heading
 * directly followed by another heading leaves no trace. When no section survives but the text is not blank, the
 * whole text becomes a single section without heading.
 */
public class SectionSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionSegmenter.class);

    private final HeadingClassifier headingClassifier;

    public SectionSegmenter(HeadingClassifier headingClassifier) {
        this.headingClassifier = Objects.requireNonNull(headingClassifier, "headingClassifier");
    }

    public List<Section> segment(String normalizedText) {
        String text = normalizedText == null ? "" : normalizedText;
        List<Section> sections = new ArrayList<>();
        IdSequence sectionIds = new IdSequence();
        SectionAccumulator accumulator = new SectionAccumulator();

        for (String line : text.split("\n", -1)) {
            if (headingClassifier.isHeading(line)) {
                accumulator.flush(sectionIds).ifPresent(sections::add);
                accumulator.startSection(UnicodeWhitespace.strip(line));
            } else {
                accumulator.collect(line);
            }
        }
        accumulator.flush(sectionIds).ifPresent(sections::add);

        String trimmed = UnicodeWhitespace.strip(text);
        if (sections.isEmpty() && !trimmed.isEmpty()) {
            LOGGER.debug("No section bodies detected; treating the whole document as one section");
            sections.add(new Section(1, Optional.empty(), trimmed));
        }
        return sections;
    }

    /**
     * Collects body lines for the section currently being read.
     */
    private static final class SectionAccumulator {

        private String heading;
        private final List<String> lines = new ArrayList<>();

        void collect(String line) {
            if (!UnicodeWhitespace.isBlank(line) || !lines.isEmpty()) {
                lines.add(line);
            }
        }

        void startSection(String newHeading) {
            heading = newHeading;
            lines.clear();
        }

        Optional<Section> flush(IdSequence sectionIds) {
            if (heading == null && lines.isEmpty()) {
                return Optional.empty();
            }
            String body = UnicodeWhitespace.strip(String.join("\n", lines));
            lines.clear();
            if (body.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Section(sectionIds.next(), Optional.ofNullable(heading), body));
        }
    }
}
