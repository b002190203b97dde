package sentsegjava.languages;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.BreakIterator;
import sentsegjava.Language;
import sentsegjava.LanguageData;
import sentsegjava.Terminators;

import java.util.*;

/**
 * Base for languages that write ordinal day numbers with a full stop, as in
 * {@code "den 3. Januar 2020"}. A terminator followed by a month name does not end the
 * sentence.
 */
public abstract class MonthAwareLanguage extends Language {

    private final Set<String> months;

    /**
     * @param code   language code
     * @param data   language data
     * @param months month names in any case; compared case-insensitively
     */
    protected MonthAwareLanguage(String code, LanguageData data, String... months) {
        super(code, data);
        Set<String> lowered = new HashSet<>();
        for (String month : months) {
            lowered.add(month.toLowerCase(Locale.ROOT));
        }
        this.months = Collections.unmodifiableSet(lowered);
    }

    @Override
    public boolean continueInNextWord(CharSequence textAfterBoundary) {
        if (ContinuationPatterns.LATIN_AFTER_NON_WORD.matcher(textAfterBoundary).lookingAt()) {
            return true;
        }
        String word = Terminators.stripTerminators(firstWord(textAfterBoundary));
        return !word.isEmpty() && isMonth(word);
    }

    /**
     * @param word a single word
     * @return whether it names a month in this language
     */
    public boolean isMonth(String word) {
        return months.contains(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the first word-boundary segment of the text after any leading Unicode white
     * space, including no-break spaces.
     */
    static String firstWord(CharSequence text) {
        int from = 0;
        while (from < text.length()) {
            int cp = Character.codePointAt(text, from);
            if (!UCharacter.isUWhiteSpace(cp)) {
                break;
            }
            from += Character.charCount(cp);
        }
        if (from == text.length()) {
            return "";
        }
        BreakIterator words = BreakIterator.getWordInstance(Locale.ROOT);
        words.setText(text);
        int end = words.following(from);
        return text.subSequence(from, end == BreakIterator.DONE ? text.length() : end).toString();
    }
}
