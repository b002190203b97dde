package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;
import sentsegjava.Terminators;

import java.util.regex.Pattern;

/**
 * Armenian: sentences end with the vertsaket ({@code ։}, often typed as {@code :}) or the
 * exclamation mark {@code ՜}; the full stop is not a terminator.
 */
public final class ArmenianLanguage extends Language {

    private static final Pattern TERMINATORS = Terminators.runPattern(
            Terminators.globalWith(new int[]{0x0589, 0x055C, ':'}, new int[]{'.'}));

    public ArmenianLanguage(LanguageData data) {
        super("hy", data);
    }

    @Override
    public Pattern terminatorPattern() {
        return TERMINATORS;
    }
}
