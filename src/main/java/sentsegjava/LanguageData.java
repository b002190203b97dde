package sentsegjava;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Static data of one language: the abbreviation marker, the known abbreviations and the
 * exclamation words that do not end a sentence (e.g. {@code "Yahoo!"}).
 *
 * <p>Instances are immutable; the sets are unmodifiable copies.</p>
 */
public final class LanguageData {

    private final String abbreviationChar;
    private final Set<String> abbreviations;
    private final Set<String> exclamationWords;

    /**
     * Creates a data entry. Missing collections are treated as empty.
     *
     * @param abbreviationChar the single-character abbreviation marker, usually {@code "."}
     * @param abbreviations    abbreviation words, without the marker
     * @param exclamationWords words including their trailing terminator
     */
    @JsonCreator
    public LanguageData(@JsonProperty(value = "abbreviation_char", required = true) String abbreviationChar,
                        @JsonProperty("abbreviations") Collection<String> abbreviations,
                        @JsonProperty("exclamation_words") Collection<String> exclamationWords) {
        if (abbreviationChar == null || abbreviationChar.isEmpty()) {
            throw new IllegalArgumentException("abbreviation_char must be a non-empty string");
        }
        this.abbreviationChar = abbreviationChar;
        this.abbreviations = freeze(abbreviations);
        this.exclamationWords = freeze(exclamationWords);
    }

    private static Set<String> freeze(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new HashSet<>(values));
    }

    @JsonProperty("abbreviation_char")
    public String getAbbreviationChar() {
        return abbreviationChar;
    }

    @JsonProperty("abbreviations")
    public Set<String> getAbbreviations() {
        return abbreviations;
    }

    @JsonProperty("exclamation_words")
    public Set<String> getExclamationWords() {
        return exclamationWords;
    }

    @Override
    public String toString() {
        return "<LanguageData '" + abbreviationChar + "' with " + abbreviations.size()
                + " abbreviations, " + exclamationWords.size() + " exclamation words>";
    }
}
