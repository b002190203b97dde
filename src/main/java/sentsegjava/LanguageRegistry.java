package sentsegjava;

import sentsegjava.languages.Languages;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps language codes to {@link Language} variants, following fallback chains for codes
 * that are not registered.
 *
 * <p>A registry is immutable once built. The shared instance returned by {@link #get()}
 * holds all supported languages and the bundled fallback table.</p>
 */
public final class LanguageRegistry {
    private static final Logger LOGGER = LibraryLog.forClass(LanguageRegistry.class);

    private final Map<String, Language> languages;
    private final FallbackTable fallbacks;

    /**
     * Creates a registry over the given languages.
     *
     * @param languages variants to register under their codes
     * @param fallbacks fallback chains consulted on a miss
     */
    public LanguageRegistry(Collection<? extends Language> languages, FallbackTable fallbacks) {
        Map<String, Language> map = new HashMap<>();
        for (Language language : languages) {
            if (map.put(language.languageCode(), language) != null) {
                throw new IllegalArgumentException("Duplicate language: " + language.languageCode());
            }
        }
        this.languages = Collections.unmodifiableMap(map);
        this.fallbacks = Objects.requireNonNull(fallbacks, "fallbacks");
    }

    private static final class Holder {
        private static final LanguageRegistry DEFAULT = build();

        private static LanguageRegistry build() {
            LanguageRegistry registry = new LanguageRegistry(
                    Languages.create(LanguageDataTable.get()), FallbackTable.get());
            LOGGER.info(() -> "Language registry ready with " + registry.languages.size() + " languages");
            return registry;
        }
    }

    /**
     * Returns the shared registry, built on first call.
     *
     * @return the shared registry
     * @throws IllegalStateException if the bundled language data is missing or incomplete
     */
    public static LanguageRegistry get() {
        return Holder.DEFAULT;
    }

    /**
     * Resolves a code to a language, directly or through its fallback chain.
     *
     * <p>On a miss, each code of the chain is resolved in order, recursively. A code that
     * is already being resolved higher up is skipped, so a cyclic table fails instead of
     * looping.</p>
     *
     * @param code language code
     * @return the resolved language
     * @throws LanguageNotSupportedException if neither the code nor any fallback resolves
     */
    public Language resolve(String code) {
        Objects.requireNonNull(code, "language code");
        Language language = resolve(code, new LinkedHashSet<>());
        if (language == null) {
            throw new LanguageNotSupportedException(code);
        }
        return language;
    }

    private Language resolve(String code, Set<String> path) {
        Language language = languages.get(code);
        if (language != null) {
            return language;
        }
        if (!path.add(code)) {
            LOGGER.log(Level.WARNING, "Fallback cycle detected: {0} -> {1}", new Object[]{path, code});
            return null;
        }
        try {
            for (String fallback : fallbacks.chainFor(code)) {
                Language resolved = resolve(fallback, path);
                if (resolved != null) {
                    LOGGER.fine(() -> "Resolved `" + code + "` via fallback `" + resolved.languageCode() + "`");
                    return resolved;
                }
            }
            return null;
        } finally {
            path.remove(code);
        }
    }

    /**
     * Returns whether a code resolves, directly or through fallbacks.
     *
     * @param code language code
     * @return {@code true} if {@link #resolve(String)} would succeed
     */
    public boolean isSupported(String code) {
        return code != null && resolve(code, new LinkedHashSet<>()) != null;
    }

    /**
     * @return codes registered directly, sorted
     */
    public SortedSet<String> registeredCodes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(languages.keySet()));
    }

    public FallbackTable fallbacks() {
        return fallbacks;
    }
}
