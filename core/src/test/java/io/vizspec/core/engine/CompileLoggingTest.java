package io.vizspec.core.engine;

import static io.vizspec.core.testkit.TestSpecs.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.vizspec.core.error.UnsupportedSpecException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** The compiler logs one structured line per call: {@code compile.complete} or {@code compile.failed}. */
@DisplayName("CompileLoggingTest")
class CompileLoggingTest {

    private final VizCompiler compiler = new VizCompiler();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger compilerLogger;

    @BeforeEach
    void setUp() {
        compilerLogger = (Logger) LoggerFactory.getLogger(VizCompiler.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        compilerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        compilerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("success logs compile.complete with name, root type and warning count")
    void completeEntry() {
        compiler.compile(json("""
                {"name": "trend", "mark": "line",
                 "encoding": {"x": {"field": "t", "bin": "binned", "type": "quantitative"}, "x2": {"field": "u"}}}
                """));

        assertThat(logAppender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage())
                    .startsWith("compile.complete name=trend root=unit warnings=1 durationMs=");
        });
    }

    @Test
    @DisplayName("failure logs compile.failed at WARN with stage and reason")
    void failedEntry() {
        assertThatThrownBy(() -> compiler.compile(json("""
                        {"name": "box", "mark": "boxplot"}
                        """)))
                .isInstanceOf(UnsupportedSpecException.class);

        assertThat(logAppender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage())
                    .startsWith("compile.failed name=box stage=NORMALIZE reason=Need a continuous");
        });
    }
}
