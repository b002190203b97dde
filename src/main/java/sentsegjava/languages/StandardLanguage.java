package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;

/**
 * A language that uses the default rules for every hook.
 */
public final class StandardLanguage extends Language {

    public StandardLanguage(String code, LanguageData data) {
        super(code, data);
    }
}
