package sentsegjava;

/**
 * Thrown when a language code cannot be resolved, neither directly nor through its
 * fallback chain.
 */
public class LanguageNotSupportedException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String languageCode;

    public LanguageNotSupportedException(String languageCode) {
        super("Language `" + languageCode + "` not supported");
        this.languageCode = languageCode;
    }

    /**
     * @return the code that could not be resolved
     */
    public String getLanguageCode() {
        return languageCode;
    }
}
