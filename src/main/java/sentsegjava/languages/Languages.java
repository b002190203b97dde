package sentsegjava.languages;

import sentsegjava.Language;
import sentsegjava.LanguageData;
import sentsegjava.LanguageDataTable;

import java.util.*;
import java.util.function.Function;

/**
 * Catalog of the supported languages.
 *
 * <p>Languages with special rules have their own class; all others are
 * {@link StandardLanguage}s that differ only in their {@link LanguageData}.</p>
 */
public final class Languages {

    private Languages() {
    }

    /**
     * Codes of languages that use the default rules.
     */
    private static final List<String> STANDARD_CODES = List.of(
            "am", "ar", "bg", "bn", "ca", "en", "es", "fr", "gu", "hi", "kn", "ml",
            "mr", "nl", "or", "pa", "pl", "pt", "ta", "te");

    /**
     * Languages with overridden hooks, keyed by code.
     */
    private static final Map<String, Function<LanguageData, Language>> SPECIAL;

    static {
        Map<String, Function<LanguageData, Language>> m = new LinkedHashMap<>();
        m.put("da", DanishLanguage::new);
        m.put("de", GermanLanguage::new);
        m.put("el", GreekLanguage::new);
        m.put("fi", FinnishLanguage::new);
        m.put("hy", ArmenianLanguage::new);
        m.put("it", ItalianLanguage::new);
        m.put("kk", KazakhLanguage::new);
        m.put("my", BurmeseLanguage::new);
        m.put("ru", RussianLanguage::new);
        m.put("sk", SlovakLanguage::new);
        SPECIAL = Collections.unmodifiableMap(m);
    }

    /**
     * @return all supported language codes, sorted
     */
    public static SortedSet<String> codes() {
        SortedSet<String> codes = new TreeSet<>(STANDARD_CODES);
        codes.addAll(SPECIAL.keySet());
        return Collections.unmodifiableSortedSet(codes);
    }

    /**
     * Instantiates every supported language with its data.
     *
     * @param table language data
     * @return one variant per supported code, in code order
     * @throws IllegalStateException if the table lacks an entry for a supported code
     */
    public static List<Language> create(LanguageDataTable table) {
        List<Language> languages = new ArrayList<>();
        for (String code : codes()) {
            LanguageData data = table.require(code);
            Function<LanguageData, Language> factory = SPECIAL.get(code);
            languages.add(factory != null ? factory.apply(data) : new StandardLanguage(code, data));
        }
        return languages;
    }
}
