package ai.contract.segmenter.cli;

import ai.contract.segmenter.config.LogFormat;
import ai.contract.segmenter.config.OutputFormat;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "contract-segmenter", mixinStandardHelpOptions = true, version = "contract-segmenter 0.1.0",
        description = "Splits legal contracts (.txt or .pdf) into sections and clauses")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "INPUT", description = "Contract files to segment (.txt or .pdf)")
    private List<Path> inputs;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "PATH",
            description = "Output file for a single input, or output directory; defaults to standard output")
    private Path output;

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class, paramLabel = "FORMAT",
            description = "Output format: text or json")
    private OutputFormat outputFormat;

    @CommandLine.Option(names = "--min-clause-len", paramLabel = "CHARS",
            description = "Clauses shorter than this many characters are merged into the previous clause (default 25)")
    private Integer minClauseLength;

    @CommandLine.Option(names = "--merge-short-clauses", negatable = true,
            description = "Merge short clauses into their predecessor (default true)")
    private Boolean mergeShortClauses;

    @CommandLine.Option(names = "--parallelism", paramLabel = "THREADS",
            description = "Number of documents segmented concurrently")
    private Integer parallelism;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Enable debug logging")
    private boolean verbose;

    public List<Path> inputs() {
        return inputs == null ? List.of() : inputs;
    }

    public Path output() {
        return output;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public Integer minClauseLength() {
        return minClauseLength;
    }

    public Boolean mergeShortClauses() {
        return mergeShortClauses;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
