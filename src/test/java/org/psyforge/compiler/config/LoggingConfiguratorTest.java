package org.psyforge.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("org.psyforge.sample").setLevel(null);
        LoggingConfigurator.reset();
    }

    /**
     * Verifies the root level, a named logger and that unknown level names are skipped.
     */
    @Test
    void appliesLevels() {
        // Arrange
        String hocon = """
                logging {
                  default-level = ERROR
                  levels {
                    "org.psyforge.sample" = DEBUG
                    "org.psyforge.unknown" = LOUD
                  }
                }
                """;

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.psyforge.sample").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.psyforge.unknown").getLevel()).isNull();
    }

    /**
     * Verifies that a second call is ignored until the configurator is reset.
     */
    @Test
    void configuresOnlyOnce() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.psyforge.sample\" = INFO }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.psyforge.sample\" = TRACE }"));

        // Assert
        assertThat(context.getLogger("org.psyforge.sample").getLevel()).isEqualTo(Level.INFO);
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.psyforge.sample\" = TRACE }"));
        assertThat(context.getLogger("org.psyforge.sample").getLevel()).isEqualTo(Level.TRACE);
    }
}
