package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;
import sentsegjava.Terminators;

import java.util.regex.Pattern;

public final class BurmeseLanguage extends Language {

    // Myanmar symbol genitive
    private static final Pattern TERMINATORS = Terminators.runPattern(
            Terminators.globalWith(new int[]{0x104F}, new int[0]));

    public BurmeseLanguage(LanguageData data) {
        super("my", data);
    }

    @Override
    public Pattern terminatorPattern() {
        return TERMINATORS;
    }
}
