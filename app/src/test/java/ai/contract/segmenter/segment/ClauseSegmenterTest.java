package ai.contract.segmenter.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ClauseSegmenterTest {

    private final ClauseSegmenter segmenter = new ClauseSegmenter(new SubclauseLabelParser());

    @Test
    void splitsSectionAtSubclauseMarkers() {
        Section section = new Section(1, Optional.of("SECTION 1. TERM"),
                "Lead-in sentence.\n(a) First item.\n(b) Second item\ncontinues here.");

        List<Clause> clauses = segmenter.segment(List.of(section));

        assertThat(clauses)
                .extracting(Clause::clauseId, Clause::localIndex, Clause::label, Clause::text)
                .containsExactly(
                        tuple(1, 1, Optional.empty(), "Lead-in sentence."),
                        tuple(2, 2, Optional.of("(a)"), "First item."),
                        tuple(3, 3, Optional.of("(b)"), "Second item\ncontinues here."));
        assertThat(clauses)
                .extracting(Clause::sectionId, Clause::sectionHeading)
                .containsOnly(tuple(1, Optional.of("SECTION 1. TERM")));
    }

    @Test
    void sectionWithoutMarkersYieldsOneUnlabeledClause() {
        Section section = new Section(1, Optional.empty(), "Whole body.\n\nSecond paragraph.");

        List<Clause> clauses = segmenter.segment(List.of(section));

        assertThat(clauses).singleElement().satisfies(clause -> {
            assertThat(clause.label()).isEmpty();
            assertThat(clause.localIndex()).isEqualTo(1);
            assertThat(clause.text()).isEqualTo("Whole body.\n\nSecond paragraph.");
        });
    }

    @Test
    void firstMarkerOfSectionGetsLocalIndexOne() {
        Section section = new Section(1, Optional.empty(), "i) Term.\nii) Renewal.");

        List<Clause> clauses = segmenter.segment(List.of(section));

        assertThat(clauses)
                .extracting(Clause::localIndex, Clause::label, Clause::text)
                .containsExactly(
                        tuple(1, Optional.of("i)"), "Term."),
                        tuple(2, Optional.of("ii)"), "Renewal."));
    }

    @Test
    void clauseIdsContinueAcrossSectionsWhileLocalIndexRestarts() {
        Section first = new Section(1, Optional.of("SECTION 1. TERM"), "(a) One.\n(b) Two.");
        Section second = new Section(2, Optional.of("SECTION 2. PAYMENT"), "(a) Three.");

        List<Clause> clauses = segmenter.segment(List.of(first, second));

        assertThat(clauses)
                .extracting(Clause::clauseId, Clause::sectionId, Clause::localIndex, Clause::sectionHeading)
                .containsExactly(
                        tuple(1, 1, 1, Optional.of("SECTION 1. TERM")),
                        tuple(2, 1, 2, Optional.of("SECTION 1. TERM")),
                        tuple(3, 2, 1, Optional.of("SECTION 2. PAYMENT")));
    }

    @Test
    void blankLinesAfterMarkerAreNotLeadingContent() {
        Section section = new Section(1, Optional.empty(), "Intro.\n\n(a) Item.\n\nTail of item.");

        List<Clause> clauses = segmenter.segment(List.of(section));

        assertThat(clauses)
                .extracting(Clause::text)
                .containsExactly("Intro.", "Item.\n\nTail of item.");
    }

    @Test
    void noSectionsYieldNoClauses() {
        assertThat(segmenter.segment(List.of())).isEmpty();
    }
}
