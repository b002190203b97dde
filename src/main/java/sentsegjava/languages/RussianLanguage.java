package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;

/**
 * Russian: a sentence continues when the next character is a lowercase Latin or
 * Cyrillic letter or a digit.
 */
public final class RussianLanguage extends Language {

    public RussianLanguage(LanguageData data) {
        super("ru", data);
    }

    @Override
    public boolean continueInNextWord(CharSequence textAfterBoundary) {
        return ContinuationPatterns.LATIN_CYRILLIC.matcher(textAfterBoundary).lookingAt();
    }
}
