package io.paramcast.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for log output of schema definition and casting: {@code info} when a schema compiles,
 * {@code warn} when a definition replaces another, {@code debug} per cast.
 */
@DisplayName("CastLoggingTest")
class CastLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger packageLogger;

    @BeforeEach
    void setUp() {
        packageLogger = (Logger) LoggerFactory.getLogger("io.paramcast.core");
        logAppender = new ListAppender<>();
        logAppender.start();
        packageLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        packageLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    void compiledSchemaIsLoggedAtInfo() {
        new ParamCaster().define("Kitten", Map.of("breed!", "string", "home", Map.of("city", "string")));

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message)
                        .contains("Compiled schema 'Kitten'")
                        .contains("required=[breed]")
                        .contains("inline_embeds=1"));
    }

    @Test
    void redefinitionIsLoggedAtWarn() {
        ParamCaster caster = new ParamCaster();
        caster.define("Tag", Map.of("label", "string"));
        caster.define("Tag", Map.of("label", "string", "color", "string"));

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Schema 'Tag' re-registered — previous definition replaced");
    }

    @Test
    void fieldDecisionsAreLoggedAtDebug() {
        ParamCaster caster = new ParamCaster();
        caster.define("Tag", Map.of("size", "integer"));

        caster.cast("Tag", Map.of("size", "huge"));

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.DEBUG)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("Field 'Tag.size' failed coercion to Scalar[type=integer]")
                .anySatisfy(message -> assertThat(message).startsWith("Cast schema 'Tag'"))
                .contains("Cast 'Tag' (MAP): ERROR");
    }
}
