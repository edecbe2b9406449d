package ai.contract.segmenter.segment;

/**
 * Decides whether a single line opens a new section.
 */
@FunctionalInterface
public interface HeadingClassifier {

    boolean isHeading(String line);
}
