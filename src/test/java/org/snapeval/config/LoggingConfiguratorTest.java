package org.snapeval.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.snapeval.junit.extensions.logging.ExpectLog;
import org.snapeval.junit.extensions.logging.LogLevel;
import org.snapeval.junit.extensions.logging.LogWatchExtension;
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

    private static final String SAMPLE_LOGGER = "org.snapeval.sample.Component";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(SAMPLE_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "snapeval.logging { default-level = ERROR, levels { \"" + SAMPLE_LOGGER + "\" = DEBUG } }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void secondConfigurationHasNoEffect() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "snapeval.logging.levels { \"" + SAMPLE_LOGGER + "\" = DEBUG }"));
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "snapeval.logging.levels { \"" + SAMPLE_LOGGER + "\" = ERROR }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void missingBlockLeavesLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger '" + SAMPLE_LOGGER + "'")
    void unknownLevelIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "snapeval.logging.levels { \"" + SAMPLE_LOGGER + "\" = LOUD }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isNull();
    }
}
