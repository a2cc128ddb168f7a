package ch.so.agi.gretlreclass.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LogEnvironmentTest {

    @BeforeEach
    @AfterEach
    void resetLogging() {
        LogEnvironment.setLogFactory(null);
    }

    @Test
    void loggerRequiresSource() {
        assertThrows(IllegalArgumentException.class, () -> LogEnvironment.getLogger(null));
    }

    @Test
    void configuredFactoryIsUsed() {
        RecordingLogFactory factory = new RecordingLogFactory();
        LogEnvironment.setLogFactory(factory);

        LogEnvironment.getLogger(LogEnvironmentTest.class).lifecycle("hello");

        assertEquals(1, factory.getMessages().size());
        assertEquals("LIFECYCLE hello", factory.getMessages().get(0));
    }

    @Test
    void standaloneDoesNotReplaceConfiguredFactory() {
        RecordingLogFactory factory = new RecordingLogFactory();
        LogEnvironment.setLogFactory(factory);

        LogEnvironment.initStandalone(Level.DEBUG);
        LogEnvironment.getLogger(LogEnvironmentTest.class).info("kept");

        assertEquals(1, factory.withPrefix("INFO").size());
    }

    @Test
    void julAdaptorHonoursLevel() {
        LogEnvironment.initStandalone(Level.LIFECYCLE);
        ReclassLogger logger = LogEnvironment.getLogger(LogEnvironmentTest.class);

        assertTrue(logger instanceof JulLogAdaptor);
        assertTrue(!logger.isDebugEnabled(), "LIFECYCLE must not enable debug output");
        assertEquals(java.util.logging.Level.CONFIG, ((JulLogAdaptor) logger).getInnerLogger().getLevel());
    }

    @Test
    void levelsParseIgnoringCase() {
        assertSame(Level.DEBUG, Level.parse("debug"));
        assertSame(Level.LIFECYCLE, Level.parse(" Lifecycle "));
        assertThrows(IllegalArgumentException.class, () -> Level.parse("verbose"));
    }
}
