package org.chasm.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.chasm.junit.extensions.logging.ExpectLog;
import org.chasm.junit.extensions.logging.LogLevel;
import org.chasm.junit.extensions.logging.LogWatchExtension;
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

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.chasm.test.a").setLevel(null);
        context.getLogger("org.chasm.test.b").setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        Config config = ConfigFactory.parseString(
                "logging { format = PLAIN, default-level = ERROR, levels { \"org.chasm.test.a\" = DEBUG } }");

        LoggingConfigurator.configure(config);

        assertThat(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.chasm.test.a").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo(LoggingConfigurator.PLAIN_APPENDER);
    }

    @Test
    void configuresOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.chasm.test.a\" = TRACE }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.chasm.test.a\" = ERROR }"));

        assertThat(context.getLogger("org.chasm.test.a").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void toleratesMissingLoggingSection() {
        LoggingConfigurator.configure(ConfigFactory.parseString("chasm.output.format = HEX"));

        assertThat(context.getLogger("org.chasm.test.a").getLevel()).isNull();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = "Ignoring unknown log level 'LOUD'.*")
    void skipsUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"org.chasm.test.a\" = LOUD, \"org.chasm.test.b\" = WARN }"));

        assertThat(context.getLogger("org.chasm.test.a").getLevel()).isNull();
        assertThat(context.getLogger("org.chasm.test.b").getLevel()).isEqualTo(Level.WARN);
    }
}
