package sentsegjava;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sentence-boundary rules of one language.
 *
 * <p>The base class implements the behavior shared by most languages. Subclasses in
 * {@code sentsegjava.languages} override individual hooks; {@link BoundaryResolver} never
 * checks which language it is working with, it only calls these hooks.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public abstract class Language {

    /**
     * Default continuation rule: the next sentence would start lowercase or with a digit.
     */
    private static final Pattern CONTINUATION = Pattern.compile("^[0-9a-z]");

    /**
     * One or more bracketed integers at the start of the tail, e.g. {@code [7][8]}.
     */
    private static final Pattern NUMBERED_REFERENCE = Pattern.compile("^(\\[\\d+])+");

    private final String code;
    private final LanguageData data;

    /**
     * @param code language code, e.g. {@code "en"}
     * @param data abbreviation and exclamation data of this language
     */
    protected Language(String code, LanguageData data) {
        this.code = Objects.requireNonNull(code, "code");
        this.data = Objects.requireNonNull(data, "data");
    }

    /**
     * @return the language code this variant is registered under
     */
    public final String languageCode() {
        return code;
    }

    /**
     * Pattern matching a run of characters that may end a sentence.
     *
     * @return terminator run pattern
     */
    public Pattern terminatorPattern() {
        return Terminators.GLOBAL_PATTERN;
    }

    /**
     * Pattern matching numbered references at the start of the text after a terminator.
     *
     * @return reference pattern anchored at the start
     */
    public Pattern numberedReferencePattern() {
        return NUMBERED_REFERENCE;
    }

    /**
     * Returns whether the sentence continues after a terminator.
     *
     * @param textAfterBoundary the paragraph text following the terminator
     * @return {@code true} to suppress the boundary
     */
    public boolean continueInNextWord(CharSequence textAfterBoundary) {
        return CONTINUATION.matcher(textAfterBoundary).lookingAt();
    }

    /**
     * Returns whether the terminator closes a known abbreviation.
     *
     * @param head      paragraph text before the terminator
     * @param separator the terminator grapheme
     * @return {@code true} to suppress the boundary
     */
    public boolean isAbbreviation(CharSequence head, String separator) {
        if (!data.getAbbreviationChar().equals(separator)) {
            return false;
        }
        String lastWord = lastWord(head);
        if (lastWord.isEmpty()) {
            return false;
        }

        Set<String> abbreviations = data.getAbbreviations();
        return abbreviations.contains(lastWord)
                || abbreviations.contains(lowerFirst(lastWord))
                || abbreviations.contains(lastWord.toLowerCase(Locale.ROOT))
                || abbreviations.contains(lastWord.toUpperCase(Locale.ROOT));
    }

    /**
     * Returns whether the last word and its terminator form an exclamation word
     * such as {@code "Yahoo!"}.
     *
     * @param head      paragraph text before the terminator
     * @param separator the terminator grapheme
     * @return {@code true} to suppress the boundary
     */
    public boolean isExclamationWord(CharSequence head, String separator) {
        Set<String> words = data.getExclamationWords();
        if (words.isEmpty()) {
            return false;
        }
        return words.contains(lastWord(head) + separator);
    }

    /**
     * Whether a terminator right before a closing quote ends the sentence at the quote.
     *
     * @return {@code false} unless overridden
     */
    public boolean isPunctuationBetweenQuotes() {
        return false;
    }

    /**
     * Returns the last word of the text; empty when the text ends with a separator.
     *
     * @param text text to inspect
     * @return the final token
     */
    public String lastWord(CharSequence text) {
        int i = text.length();
        while (i > 0 && !isWordSeparator(text.charAt(i - 1))) {
            i--;
        }
        return text.subSequence(i, text.length()).toString();
    }

    /**
     * Whitespace as in {@code \s} of {@link java.util.regex.Pattern}, or a full stop.
     */
    private static boolean isWordSeparator(char ch) {
        switch (ch) {
            case ' ':
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case '.':
                return true;
            default:
                return false;
        }
    }

    /**
     * @return the static data of this language
     */
    public final LanguageData data() {
        return data;
    }

    /**
     * @return sentences of {@code text}, see {@link BoundaryResolver#segment(Language, String)}
     */
    public List<String> segment(String text) {
        return BoundaryResolver.segment(this, text);
    }

    /**
     * Lowercases the first code point of a word.
     */
    protected static String lowerFirst(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int first = Character.charCount(word.codePointAt(0));
        return word.substring(0, first).toLowerCase(Locale.ROOT) + word.substring(first);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + code + ")";
    }
}
