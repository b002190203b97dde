package sentsegjava.languages;

import sentsegjava.LanguageData;

public final class FinnishLanguage extends MonthAwareLanguage {

    public FinnishLanguage(LanguageData data) {
        super("fi", data,
                "tammikuu", "helmikuu", "maaliskuu", "huhtikuu", "toukokuu", "kesäkuu",
                "heinäkuu", "elokuu", "syyskuu", "lokakuu", "marraskuu", "joulukuu");
    }
}
