package ai.contract.segmenter.segment;

/**
 * Tuning knobs of the segmentation engine.
 *
 * @param minClauseLenChars clauses whose trimmed text is shorter than this are merged into their predecessor
 * @param mergeShortClauses enables the merge pass
 */
public record SegmenterConfig(int minClauseLenChars, boolean mergeShortClauses) {

    public static final int DEFAULT_MIN_CLAUSE_LEN_CHARS = 25;

    public SegmenterConfig {
        if (minClauseLenChars < 0) {
            throw new IllegalArgumentException("minClauseLenChars must be zero or greater");
        }
    }

    public static SegmenterConfig defaults() {
        return new SegmenterConfig(DEFAULT_MIN_CLAUSE_LEN_CHARS, true);
    }
}
