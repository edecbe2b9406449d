package ai.contract.segmenter.cli;

import ai.contract.segmenter.config.OutputFormat;
import picocli.CommandLine;

/**
 * Parses output format CLI options.
 */
public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {

    @Override
    public OutputFormat convert(String value) {
        return OutputFormat.from(value);
    }
}
