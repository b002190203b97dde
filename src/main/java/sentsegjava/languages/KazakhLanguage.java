package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;

public final class KazakhLanguage extends Language {

    public KazakhLanguage(LanguageData data) {
        super("kk", data);
    }

    @Override
    public boolean continueInNextWord(CharSequence textAfterBoundary) {
        return ContinuationPatterns.LATIN_CYRILLIC_AFTER_NON_WORD.matcher(textAfterBoundary).lookingAt();
    }
}
