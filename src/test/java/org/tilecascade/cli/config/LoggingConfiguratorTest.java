package org.tilecascade.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.tilecascade.junit.extensions.logging.ExpectLog;
import org.tilecascade.junit.extensions.logging.LogLevel;
import org.tilecascade.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.tilecascade.sample").setLevel(null);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD' for logger 'org.tilecascade.noisy'")
    void appliesDefaultAndSpecificLevels() {
        int configured = LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  default-level = "ERROR"
                  levels {
                    "org.tilecascade.sample" = "DEBUG"
                    "org.tilecascade.noisy" = "LOUD"
                  }
                }
                """));

        assertThat(configured).isEqualTo(2);
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.tilecascade.sample").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.tilecascade.noisy").getLevel()).isNull();
    }

    @Test
    void withoutLoggingBlockNothingChanges() {
        assertThat(LoggingConfigurator.configure(ConfigFactory.empty())).isZero();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }
}
