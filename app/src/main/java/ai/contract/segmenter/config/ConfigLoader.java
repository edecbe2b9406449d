package ai.contract.segmenter.config;

import ai.contract.segmenter.cli.CliArguments;
import ai.contract.segmenter.segment.SegmenterConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MIN_CLAUSE_LEN_CHARS = "CONTRACT_MIN_CLAUSE_LEN_CHARS";
    static final String ENV_MERGE_SHORT_CLAUSES = "CONTRACT_MERGE_SHORT_CLAUSES";
    static final String ENV_OUTPUT_FORMAT = "CONTRACT_OUTPUT_FORMAT";
    static final String ENV_PARALLELISM = "CONTRACT_PARALLELISM";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> inputs = arguments.inputs();
        Optional<Path> output = Optional.ofNullable(arguments.output());
        if (inputs != null && inputs.size() > 1 && output.isPresent() && Files.isRegularFile(output.get())) {
            throw new IllegalArgumentException(
                    "--output must be a directory when segmenting more than one input: " + output.get());
        }

        OutputFormat outputFormat = resolveOutputFormat(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        SegmenterConfig segmenterConfig = new SegmenterConfig(resolveMinClauseLength(arguments),
                resolveMergeShortClauses(arguments));
        int parallelism = resolveParallelism(arguments);

        return new Config(inputs, output, outputFormat, logFormat, arguments.verbose(), segmenterConfig, parallelism);
    }

    private OutputFormat resolveOutputFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.outputFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_OUTPUT_FORMAT)
                .map(OutputFormat::from)
                .orElse(OutputFormat.TEXT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveMinClauseLength(CliArguments arguments) {
        Integer cliValue = arguments.minClauseLength();
        if (cliValue != null) {
            return requireNonNegative(cliValue, "--min-clause-len");
        }
        return environmentReader.getNonBlank(ENV_MIN_CLAUSE_LEN_CHARS)
                .map(value -> requireNonNegative(parseInteger(value, ENV_MIN_CLAUSE_LEN_CHARS), ENV_MIN_CLAUSE_LEN_CHARS))
                .orElse(SegmenterConfig.DEFAULT_MIN_CLAUSE_LEN_CHARS);
    }

    private boolean resolveMergeShortClauses(CliArguments arguments) {
        Boolean cliValue = arguments.mergeShortClauses();
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.getNonBlank(ENV_MERGE_SHORT_CLAUSES)
                .map(ConfigLoader::parseBoolean)
                .orElse(true);
    }

    private int resolveParallelism(CliArguments arguments) {
        Integer cliValue = arguments.parallelism();
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.getNonBlank(ENV_PARALLELISM)
                .map(value -> parseInteger(value, ENV_PARALLELISM))
                .orElse(Runtime.getRuntime().availableProcessors());
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be zero or greater");
        }
        return value;
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        if (raw.equalsIgnoreCase("true") || raw.equals("1")) {
            return true;
        }
        if (raw.equalsIgnoreCase("false") || raw.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException(ENV_MERGE_SHORT_CLAUSES + " must be true or false: " + raw);
    }
}
