package ai.contract.segmenter.segment;

/**
 * Dense 1-based id counter scoped to a single segmentation call.
 */
final class IdSequence {

    private int last;

    int next() {
        return ++last;
    }
}
