package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;

import java.util.regex.Pattern;

/**
 * Italian: an elided article is not part of the last word, so {@code "dell'art."} is
 * checked as {@code "art"}.
 */
public final class ItalianLanguage extends Language {

    private static final Pattern ELISION = Pattern.compile("l['’]");

    public ItalianLanguage(LanguageData data) {
        super("it", data);
    }

    @Override
    public String lastWord(CharSequence text) {
        String word = super.lastWord(text);
        String[] parts = ELISION.split(word, -1);
        return parts[parts.length - 1];
    }
}
