package sentsegjava.languages;

import sentsegjava.LanguageData;

/**
 * Slovak: month names in nominative and genitive.
 */
public final class SlovakLanguage extends MonthAwareLanguage {

    public SlovakLanguage(LanguageData data) {
        super("sk", data,
                "Január", "Február", "Marec", "Apríl", "Máj", "Jún",
                "Júl", "August", "September", "Október", "November", "December",
                "Januára", "Februára", "Marca", "Apríla", "Mája", "Júna",
                "Júla", "Augusta", "Septembra", "Októbra", "Novembra", "Decembra");
    }
}
