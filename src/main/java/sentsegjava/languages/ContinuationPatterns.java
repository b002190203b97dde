package sentsegjava.languages;

import java.util.regex.Pattern;

/**
 * Continuation rules shared by several languages.
 */
final class ContinuationPatterns {

    private ContinuationPatterns() {
    }

    /**
     * Lowercase Latin letter or digit after optional non-word characters.
     */
    static final Pattern LATIN_AFTER_NON_WORD =
            Pattern.compile("^\\W*[0-9a-z]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Lowercase Latin or Cyrillic letter or digit after optional non-word characters.
     */
    static final Pattern LATIN_CYRILLIC_AFTER_NON_WORD =
            Pattern.compile("^\\W*[0-9a-zа-я]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Lowercase Latin or Cyrillic letter or digit right after the terminator.
     */
    static final Pattern LATIN_CYRILLIC =
            Pattern.compile("^[0-9a-zа-я]");
}
