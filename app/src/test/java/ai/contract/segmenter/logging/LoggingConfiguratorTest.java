package ai.contract.segmenter.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.contract.segmenter.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final Logger root = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    private final Level originalLevel = root.getLevel();

    @AfterEach
    void restore() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
        root.setLevel(originalLevel);
    }

    @Test
    void switchesAppendersToJsonAndRaisesVerbosity() {
        LoggingConfigurator.configure(LogFormat.JSON, true);

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        OutputStreamAppender<ILoggingEvent> appender = firstAppender();
        assertThat(appender.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) appender.getEncoder()).getLayout())
                .isInstanceOf(SimpleJsonLayout.class);
        assertThat(appender.isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPatternWithDocumentName() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(firstAppender().getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                encoder -> assertThat(encoder.getPattern()).contains("%X{document:-}"));
    }

    private OutputStreamAppender<ILoggingEvent> firstAppender() {
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            if (iterator.next() instanceof OutputStreamAppender<ILoggingEvent> appender) {
                return appender;
            }
        }
        throw new AssertionError("no output stream appender configured");
    }
}
