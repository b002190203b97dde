package sentsegjava;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the parent logger of the library. Every library class obtains its logger here, so
 * the parent is switched off before any of them can log, whichever class loads first.
 */
final class LibraryLog {

    private static final Logger PARENT = Logger.getLogger("sentsegjava");

    static {
        PARENT.setLevel(Level.OFF);
    }

    private LibraryLog() {
    }

    /**
     * @param type the logging class
     * @return the logger named after {@code type}, a child of the library logger
     */
    static Logger forClass(Class<?> type) {
        return Logger.getLogger(type.getName());
    }

    static void setVerbose(boolean enabled) {
        PARENT.setLevel(enabled ? Level.INFO : Level.OFF);
    }
}
