package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;
import sentsegjava.Terminators;

import java.util.regex.Pattern;

/**
 * Greek: the semicolon is the question mark.
 */
public final class GreekLanguage extends Language {

    private static final Pattern TERMINATORS = Terminators.runPattern(
            Terminators.globalWith(new int[]{';', 0x037E}, new int[0]));

    public GreekLanguage(LanguageData data) {
        super("el", data);
    }

    @Override
    public Pattern terminatorPattern() {
        return TERMINATORS;
    }
}
