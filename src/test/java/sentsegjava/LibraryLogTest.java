package sentsegjava;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

class LibraryLogTest {

    @Test
    void loadingTablesDirectlyStaysQuiet() {
        LanguageRegistry.get();
        LanguageDataTable.get();
        FallbackTable.get();

        assertThat(Logger.getLogger(LanguageRegistry.class.getName()).isLoggable(Level.INFO)).isFalse();
        assertThat(Logger.getLogger(LanguageDataTable.class.getName()).isLoggable(Level.INFO)).isFalse();
        assertThat(Logger.getLogger(FallbackTable.class.getName()).isLoggable(Level.WARNING)).isFalse();
    }

    @Test
    void verboseLoggingEnablesInfo() {
        try {
            SentenceSegmenter.setVerboseLogging(true);

            Logger registryLogger = Logger.getLogger(LanguageRegistry.class.getName());
            assertThat(registryLogger.isLoggable(Level.INFO)).isTrue();
            assertThat(registryLogger.isLoggable(Level.FINE)).isFalse();
        } finally {
            SentenceSegmenter.setVerboseLogging(false);
        }
        assertThat(Logger.getLogger(LanguageRegistry.class.getName()).isLoggable(Level.INFO)).isFalse();
    }
}
