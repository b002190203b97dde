package sentsegjava;

import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * SentenceSegmenter splits text into sentences using language-specific rules for
 * abbreviations, quotations, parenthetical asides, numbered references and exclamation
 * words.
 *
 * <p>Language rules and data are loaded once per JVM on first use and shared by all
 * instances. Segmentation is stateless and thread-safe.</p>
 *
 * <pre>{@code
 * List<String> sentences = SentenceSegmenter.segment("en", "This is Dr. Watson. Thanks for having me!");
 * // ["This is Dr. Watson.", "Thanks for having me!"]
 * }</pre>
 */
public class SentenceSegmenter {
    /**
     * Enables or disables verbose logging of data loading and language resolution. Logging
     * is disabled by default to keep library users' consoles quiet.
     *
     * @param enabled {@code true} to log at {@code INFO}, {@code false} to disable logging
     */
    public static void setVerboseLogging(boolean enabled) {
        LibraryLog.setVerbose(enabled);
    }

    private final Language language;

    /**
     * Creates a segmenter for a language, resolving fallbacks once.
     *
     * @param languageCode language code such as {@code "en"} or {@code "de-at"}
     * @throws LanguageNotSupportedException if the code cannot be resolved
     */
    public SentenceSegmenter(String languageCode) {
        this.language = LanguageRegistry.get().resolve(languageCode);
    }

    /**
     * Splits text into sentences with this segmenter's language.
     *
     * @param text input text
     * @return sentences in order; paragraphs are separated by a {@code "\n\n"} element
     */
    public List<String> segment(String text) {
        Objects.requireNonNull(text, "text");
        return BoundaryResolver.segment(language, text);
    }

    /**
     * @return the resolved language, which differs from the requested code after a fallback
     */
    public Language getLanguage() {
        return language;
    }

    /**
     * Splits text into sentences.
     *
     * @param languageCode language code such as {@code "en"}
     * @param text         input text
     * @return sentences in order; paragraphs are separated by a {@code "\n\n"} element
     * @throws LanguageNotSupportedException if the code cannot be resolved
     */
    public static List<String> segment(String languageCode, String text) {
        Objects.requireNonNull(text, "text");
        Language resolved = LanguageRegistry.get().resolve(languageCode);
        return BoundaryResolver.segment(resolved, text);
    }

    /**
     * Returns the codes of languages with their own rules and data.
     *
     * @return sorted language codes
     */
    public static SortedSet<String> getSupportedLanguages() {
        return LanguageRegistry.get().registeredCodes();
    }

    /**
     * Returns whether a code resolves, directly or through fallbacks.
     *
     * @param languageCode language code
     * @return {@code true} if {@link #segment(String, String)} accepts it
     */
    public static boolean isSupported(String languageCode) {
        return LanguageRegistry.get().isSupported(languageCode);
    }
}
