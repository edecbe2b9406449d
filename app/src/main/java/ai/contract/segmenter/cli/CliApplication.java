package ai.contract.segmenter.cli;

import ai.contract.segmenter.batch.BatchOutcome;
import ai.contract.segmenter.batch.BatchSegmentationService;
import ai.contract.segmenter.batch.DocumentFailure;
import ai.contract.segmenter.batch.DocumentSegmentation;
import ai.contract.segmenter.config.Config;
import ai.contract.segmenter.config.ConfigLoader;
import ai.contract.segmenter.config.EnvironmentReader;
import ai.contract.segmenter.load.ContractLoader;
import ai.contract.segmenter.logging.LoggingConfigurator;
import ai.contract.segmenter.segment.ContractSegmenter;
import ai.contract.segmenter.writer.ClauseWriter;
import ai.contract.segmenter.writer.ClauseWriters;
import ai.contract.segmenter.writer.SegmentationOutputWriter;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and segmentation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_DOCUMENT_FAILED = 1;

    private final ConfigLoader configLoader;
    private final ContractLoader contractLoader;
    private final SegmentationOutputWriter outputWriter;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new ContractLoader(), new SegmentationOutputWriter(),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true),
                new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
    }

    CliApplication(ConfigLoader configLoader,
                   ContractLoader contractLoader,
                   SegmentationOutputWriter outputWriter,
                   PrintWriter out,
                   PrintWriter err) {
        this.configLoader = configLoader;
        this.contractLoader = contractLoader;
        this.outputWriter = outputWriter;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Segmenting {} document(s) (minClauseLenChars={}, mergeShortClauses={}, format={})",
                config.inputs().size(), config.segmenterConfig().minClauseLenChars(),
                config.segmenterConfig().mergeShortClauses(), config.outputFormat());

        ContractSegmenter segmenter = new ContractSegmenter(config.segmenterConfig());
        BatchSegmentationService batchService = new BatchSegmentationService(contractLoader, segmenter,
                config.parallelism());
        BatchOutcome outcome = batchService.process(config.inputs());

        ClauseWriter clauseWriter = ClauseWriters.forFormat(config.outputFormat());
        List<String> unwrittenFiles = new ArrayList<>();
        for (DocumentSegmentation segmentation : outcome.results()) {
            String rendered = clauseWriter.render(segmentation.result().clauses());
            if (config.output().isEmpty()) {
                out.print(rendered);
                out.flush();
                continue;
            }
            Path target = resolveTarget(config, segmentation.source(), clauseWriter.fileExtension());
            try {
                outputWriter.write(target, rendered);
                LOGGER.info("Wrote {} clauses for {} to {}", segmentation.result().clauses().size(),
                        segmentation.source().getFileName(), target);
            } catch (UncheckedIOException ex) {
                LOGGER.error("Failed to write output for {}", segmentation.source(), ex);
                err.println("Error writing output file: " + ex.getMessage());
                unwrittenFiles.add(segmentation.source().toString());
            }
        }

        for (DocumentFailure failure : outcome.failures()) {
            err.println("Error reading input file: " + failure.message());
        }
        if (!outcome.failures().isEmpty()) {
            LOGGER.warn("Segmentation failed for files: {}", String.join(", ", outcome.failedFiles()));
        }
        if (!unwrittenFiles.isEmpty()) {
            LOGGER.warn("Output could not be written for files: {}", String.join(", ", unwrittenFiles));
        }
        if (!outcome.failures().isEmpty() || !unwrittenFiles.isEmpty()) {
            return EXIT_DOCUMENT_FAILED;
        }
        return 0;
    }

    static Path resolveTarget(Config config, Path source, String extension) {
        Path output = config.output().orElseThrow();
        if (config.singleInput() && !Files.isDirectory(output)) {
            return output;
        }
        return output.resolve(baseName(source) + ".clauses." + extension);
    }

    private static String baseName(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
