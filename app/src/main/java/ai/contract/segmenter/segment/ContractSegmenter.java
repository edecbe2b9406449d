package ai.contract.segmenter.segment;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full segmentation pipeline: normalize, split into sections, split sections into clauses, merge short
 * clauses.
 *
 * <p>Instances hold no per-document state and may be shared between threads.
 */
public class ContractSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContractSegmenter.class);

    private final TextPreprocessor preprocessor;
    private final SectionSegmenter sectionSegmenter;
    private final ClauseSegmenter clauseSegmenter;
    private final ClauseMerger clauseMerger;

    public ContractSegmenter() {
        this(SegmenterConfig.defaults());
    }

    public ContractSegmenter(SegmenterConfig config) {
        this(new TextPreprocessor(),
                new SectionSegmenter(new DefaultHeadingClassifier()),
                new ClauseSegmenter(new SubclauseLabelParser()),
                new ClauseMerger(config));
    }

    public ContractSegmenter(TextPreprocessor preprocessor,
                             SectionSegmenter sectionSegmenter,
                             ClauseSegmenter clauseSegmenter,
                             ClauseMerger clauseMerger) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.sectionSegmenter = Objects.requireNonNull(sectionSegmenter, "sectionSegmenter");
        this.clauseSegmenter = Objects.requireNonNull(clauseSegmenter, "clauseSegmenter");
        this.clauseMerger = Objects.requireNonNull(clauseMerger, "clauseMerger");
    }

    public SegmentationResult segment(String text) {
        String normalized = preprocessor.normalize(text);
        List<Section> sections = sectionSegmenter.segment(normalized);
        List<Clause> rawClauses = clauseSegmenter.segment(sections);
        List<Clause> clauses = clauseMerger.merge(rawClauses);
        LOGGER.debug("Segmented {} sections into {} clauses ({} before merging)",
                sections.size(), clauses.size(), rawClauses.size());
        return new SegmentationResult(sections, clauses);
    }

    public List<Clause> segmentClauses(String text) {
        return segment(text).clauses();
    }
}
