package ai.contract.segmenter.writer;

import ai.contract.segmenter.config.OutputFormat;

/**
 * Picks the {@link ClauseWriter} for an output format.
 */
public final class ClauseWriters {

    private ClauseWriters() {
    }

    public static ClauseWriter forFormat(OutputFormat format) {
        return switch (format) {
            case TEXT -> new ClauseReportWriter();
            case JSON -> new ClauseJsonWriter();
        };
    }
}
