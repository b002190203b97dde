package sentsegjava.languages;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import sentsegjava.Language;
import sentsegjava.LanguageRegistry;
import sentsegjava.SentenceSegmenter;

class LanguageRulesTest {

    private static Language language(String code) {
        return LanguageRegistry.get().resolve(code);
    }

    @Test
    void germanDayNumberBeforeMonthDoesNotSplit() {
        assertThat(SentenceSegmenter.segment("de", "Am 3. Januar 2020 war es kalt. Dann schneite es."))
                .containsExactly("Am 3. Januar 2020 war es kalt.", "Dann schneite es.");
    }

    @Test
    void germanMonthsMatchIgnoringCase() {
        MonthAwareLanguage german = (MonthAwareLanguage) language("de");

        assertThat(german.isMonth("MÄRZ")).isTrue();
        assertThat(german.isMonth("dezember")).isTrue();
        assertThat(german.isMonth("Montag")).isFalse();
        assertThat(german.continueInNextWord(" Oktober.")).isTrue();
    }

    @Test
    void monthAfterNonBreakingSpaceContinues() {
        assertThat(language("de").continueInNextWord("\u00A0Januar 2020")).isTrue();
        assertThat(SentenceSegmenter.segment("de", "Am 3.\u00A0Januar war es kalt. Dann schneite es."))
                .containsExactly("Am 3.\u00A0Januar war es kalt.", "Dann schneite es.");
    }

    @Test
    void germanContinuesAfterLeadingPunctuation() {
        assertThat(language("de").continueInNextWord(" (klein)")).isTrue();
        assertThat(language("en").continueInNextWord(" (klein)")).isFalse();
    }

    @Test
    void finnishAndSlovakKnowTheirMonths() {
        assertThat(SentenceSegmenter.segment("fi", "Kokous on 12. Joulukuu 2020. Tervetuloa."))
                .containsExactly("Kokous on 12. Joulukuu 2020.", "Tervetuloa.");
        assertThat(SentenceSegmenter.segment("sk", "Narodil sa 5. Januára 1990. Potom odišiel."))
                .containsExactly("Narodil sa 5. Januára 1990.", "Potom odišiel.");
    }

    @Test
    void firstWordUsesWordBoundaries() {
        assertThat(MonthAwareLanguage.firstWord("Januar 2020")).isEqualTo("Januar");
        assertThat(MonthAwareLanguage.firstWord("")).isEmpty();
        assertThat(MonthAwareLanguage.firstWord(" \u00A0\u2003Mai 2021")).isEqualTo("Mai");
        assertThat(MonthAwareLanguage.firstWord("\u00A0 ")).isEmpty();
    }

    @Test
    void russianContinuesOnCyrillicLowercase() {
        assertThat(SentenceSegmenter.segment("ru", "Он пришёл.потом ушёл.")).hasSize(1);
        assertThat(SentenceSegmenter.segment("en", "Он пришёл.потом ушёл.")).hasSize(2);
    }

    @Test
    void russianAbbreviationDoesNotSplit() {
        assertThat(SentenceSegmenter.segment("ru", "Он живёт в г. Москва. Это большой город."))
                .containsExactly("Он живёт в г. Москва.", "Это большой город.");
    }

    @Test
    void danishAndKazakhSkipLeadingSpaceBeforeLowercase() {
        assertThat(SentenceSegmenter.segment("da", "Det er slut. og så videre.")).hasSize(1);
        assertThat(SentenceSegmenter.segment("en", "It ended. and so on.")).hasSize(2);
        assertThat(SentenceSegmenter.segment("kk", "Ол келді. кейін кетті.")).hasSize(1);
    }

    @Test
    void greekQuestionMarkIsTerminator() {
        assertThat(SentenceSegmenter.segment("el", "Τι κάνεις; Καλά είμαι."))
                .containsExactly("Τι κάνεις;", "Καλά είμαι.");
        assertThat(SentenceSegmenter.segment("en", "Τι κάνεις; Καλά είμαι.")).hasSize(1);
    }

    @Test
    void armenianIgnoresFullStop() {
        assertThat(SentenceSegmenter.segment("hy", "Ա. Բ. Գ։ Դ։")).containsExactly("Ա. Բ. Գ։", "Դ։");
        assertThat(SentenceSegmenter.segment("hy", "Բարեւ: Ինչ կա:")).containsExactly("Բարեւ:", "Ինչ կա:");
    }

    @Test
    void burmeseGenitiveSymbolEndsSentence() {
        String text = "သူသည် ကျောင်းသား ဖြစ်၏ ကျွန်ုပ်လည်း ဖြစ်သည်။";

        assertThat(SentenceSegmenter.segment("my", text)).hasSize(2);
        assertThat(SentenceSegmenter.segment("en", text)).hasSize(1);
    }

    @Test
    void italianElidedArticleIsNotPartOfWord() {
        Language italian = language("it");

        assertThat(italian.lastWord("Vedi dell'art")).isEqualTo("art");
        assertThat(italian.lastWord("Vedi l’art")).isEqualTo("art");
        assertThat(SentenceSegmenter.segment("it", "Vedi l'art. 5 del codice. Poi basta."))
                .containsExactly("Vedi l'art. 5 del codice.", "Poi basta.");
    }

    @Test
    void germanExclamationWord() {
        assertThat(SentenceSegmenter.segment("de", "Ich suche bei Yahoo! Nach Antworten.")).hasSize(1);
    }

    @Test
    void everyCodeHasItsVariant() {
        assertThat(language("de")).isInstanceOf(GermanLanguage.class);
        assertThat(language("hy")).isInstanceOf(ArmenianLanguage.class);
        assertThat(language("pa")).isInstanceOf(StandardLanguage.class);
        assertThat(Languages.codes()).hasSize(30).contains("am", "ta", "te", "sk");
    }
}
