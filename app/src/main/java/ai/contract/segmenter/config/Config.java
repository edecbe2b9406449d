package ai.contract.segmenter.config;

import ai.contract.segmenter.segment.SegmenterConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        List<Path> inputs,
        Optional<Path> output,
        OutputFormat outputFormat,
        LogFormat logFormat,
        boolean verbose,
        SegmenterConfig segmenterConfig,
        int parallelism
) {

    public Config {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one input file must be provided");
        }
        output = output == null ? Optional.empty() : output;
        if (inputs.size() > 1 && output.isEmpty()) {
            throw new IllegalArgumentException("--output directory is required when segmenting more than one input");
        }
        outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        segmenterConfig = Objects.requireNonNull(segmenterConfig, "segmenterConfig");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be 1 or greater");
        }
    }

    public boolean singleInput() {
        return inputs.size() == 1;
    }
}
