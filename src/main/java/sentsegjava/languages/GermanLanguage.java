package sentsegjava.languages;

import sentsegjava.LanguageData;

/**
 * German: month-aware continuation, and a terminator directly before a closing quote
 * ends the sentence after the quote.
 */
public final class GermanLanguage extends MonthAwareLanguage {

    public GermanLanguage(LanguageData data) {
        super("de", data,
                "Januar", "Februar", "März", "April", "Mai", "Juni",
                "Juli", "August", "September", "Oktober", "November", "Dezember");
    }

    @Override
    public boolean isPunctuationBetweenQuotes() {
        return true;
    }
}
