package sentsegjava;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.Logger;

/**
 * Ordered fallback languages for codes that have no registered {@link Language}.
 *
 * <p>JSON shape:</p>
 * <pre>{@code
 * {
 *   "default": ["en"],
 *   "fallbacks": { "de-at": ["de"], "oc": ["ca", "fr"] }
 * }
 * }</pre>
 *
 * <p>The default list is used for any code without an entry of its own.</p>
 */
public final class FallbackTable {
    private static final Logger LOGGER = LibraryLog.forClass(FallbackTable.class);

    static final String FILE_NAME = "fallbacks.json";

    private final List<String> defaults;
    private final Map<String, List<String>> fallbacks;

    @JsonCreator
    public FallbackTable(@JsonProperty("default") List<String> defaults,
                         @JsonProperty("fallbacks") Map<String, List<String>> fallbacks) {
        this.defaults = defaults == null ? Collections.emptyList() : List.copyOf(defaults);
        Map<String, List<String>> copy = new HashMap<>();
        if (fallbacks != null) {
            fallbacks.forEach((code, chain) -> copy.put(code, chain == null ? List.of() : List.copyOf(chain)));
        }
        this.fallbacks = Collections.unmodifiableMap(copy);
    }

    /**
     * A table with no entries and an empty default list.
     *
     * @return an empty table
     */
    public static FallbackTable empty() {
        return new FallbackTable(null, null);
    }

    private static final class Holder {
        private static final FallbackTable DEFAULT = load();
    }

    /**
     * Returns the shared table, loaded once from {@code langdata/fallbacks.json} in the
     * working directory or from the classpath resource of the same name.
     *
     * @return the shared table
     * @throws IllegalStateException if no source can be read or parsed
     */
    public static FallbackTable get() {
        return Holder.DEFAULT;
    }

    private static FallbackTable load() {
        try {
            Path jsonPath = Paths.get("langdata", FILE_NAME);
            if (Files.exists(jsonPath)) {
                try (InputStream in = Files.newInputStream(jsonPath)) {
                    FallbackTable table = fromJson(in);
                    LOGGER.info(() -> "Loaded " + table.fallbacks.size() + " fallback chains from " + jsonPath.toAbsolutePath());
                    return table;
                }
            }
            try (InputStream in = FallbackTable.class.getResourceAsStream("/langdata/" + FILE_NAME)) {
                if (in == null) {
                    throw new FileNotFoundException("Missing resource: /langdata/" + FILE_NAME);
                }
                FallbackTable table = fromJson(in);
                LOGGER.info(() -> "Loaded " + table.fallbacks.size() + " fallback chains from classpath");
                return table;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load language fallbacks", e);
        }
    }

    /**
     * Parses a table from JSON.
     *
     * @param in JSON input
     * @return the parsed table
     * @throws IOException if reading or parsing fails
     */
    public static FallbackTable fromJson(InputStream in) throws IOException {
        return new ObjectMapper().readValue(in, FallbackTable.class);
    }

    /**
     * Returns the fallback chain of a code: its own entry, or the default list.
     *
     * @param code language code
     * @return ordered fallback codes, possibly empty
     */
    public List<String> chainFor(String code) {
        return fallbacks.getOrDefault(code, defaults);
    }

    /**
     * Returns whether the code has an entry of its own.
     *
     * @param code language code
     * @return {@code true} if configured explicitly
     */
    public boolean hasEntry(String code) {
        return fallbacks.containsKey(code);
    }

    @JsonProperty("default")
    public List<String> getDefaults() {
        return defaults;
    }

    @JsonProperty("fallbacks")
    public Map<String, List<String>> getFallbacks() {
        return fallbacks;
    }
}
