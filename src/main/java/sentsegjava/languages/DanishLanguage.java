package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;

/**
 * Danish: punctuation and spaces after a terminator are skipped before checking for a
 * lowercase start.
 */
public final class DanishLanguage extends Language {

    public DanishLanguage(LanguageData data) {
        super("da", data);
    }

    @Override
    public boolean continueInNextWord(CharSequence textAfterBoundary) {
        return ContinuationPatterns.LATIN_CYRILLIC_AFTER_NON_WORD.matcher(textAfterBoundary).lookingAt();
    }
}
