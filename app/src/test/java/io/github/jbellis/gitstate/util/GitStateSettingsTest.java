package io.github.jbellis.gitstate.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class GitStateSettingsTest {

    @Test
    void emptyPropertiesFallBackToDefaults() {
        var settings = new GitStateSettings(new Properties());
        assertEquals(72, settings.wrapColumn());
        assertEquals(60, settings.discardHistoryMaxLength());
        assertEquals("gitstate.historySha", settings.discardHistoryConfigKey());
        assertEquals("git", settings.gitExecutable());
        assertEquals(Duration.ofSeconds(30), settings.networkTimeout());
        assertEquals(4, settings.executorThreads());
    }

    @Test
    void bundledPropertiesAreLoaded() {
        var settings = GitStateSettings.load();
        assertSame(settings, GitStateSettings.load());
        assertTrue(settings.wrapColumn() > 0);
        assertFalse(settings.discardHistoryConfigKey().isBlank());
    }

    @Test
    void withOverridesOneKeyAndLeavesOriginalAlone() {
        var base = new GitStateSettings(new Properties());
        var changed = base.with(GitStateSettings.WRAP_COLUMN_KEY, "50");

        assertEquals(50, changed.wrapColumn());
        assertEquals(72, base.wrapColumn());
        assertEquals(base.discardHistoryMaxLength(), changed.discardHistoryMaxLength());
    }

    @Test
    void malformedNumbersFallBackToDefaults() {
        var settings = new GitStateSettings(new Properties())
                .with(GitStateSettings.HISTORY_MAX_LENGTH_KEY, "lots")
                .with(GitStateSettings.NETWORK_TIMEOUT_KEY, " ");
        assertEquals(60, settings.discardHistoryMaxLength());
        assertEquals(Duration.ofSeconds(30), settings.networkTimeout());
    }

    @Test
    void executorThreadsIsAtLeastOne() {
        var settings = new GitStateSettings(new Properties()).with(GitStateSettings.EXECUTOR_THREADS_KEY, "0");
        assertEquals(1, settings.executorThreads());
    }
}
