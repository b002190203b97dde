package sentsegjava;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.Logger;

/**
 * Per-language abbreviation and exclamation data, keyed by language code.
 *
 * <p>The shared table is loaded once, on first access, from
 * {@code langdata/languages.json} in the working directory if present, otherwise from the
 * {@code /langdata/languages.json} classpath resource. It is never modified afterwards.</p>
 */
public final class LanguageDataTable {
    private static final Logger LOGGER = LibraryLog.forClass(LanguageDataTable.class);

    static final String FILE_NAME = "languages.json";

    private final Map<String, LanguageData> entries;

    private LanguageDataTable(Map<String, LanguageData> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    /**
     * Lazily loaded shared table.
     */
    private static final class Holder {
        private static final LanguageDataTable DEFAULT = load();
    }

    /**
     * Returns the shared table, loading it on first call.
     *
     * @return the shared table
     * @throws IllegalStateException if no source can be read or parsed
     */
    public static LanguageDataTable get() {
        return Holder.DEFAULT;
    }

    private static LanguageDataTable load() {
        try {
            Path jsonPath = Paths.get("langdata", FILE_NAME);
            if (Files.exists(jsonPath)) {
                LanguageDataTable table = fromJson(jsonPath);
                LOGGER.info(() -> "Loaded " + table.size() + " language entries from " + jsonPath.toAbsolutePath());
                return table;
            }
            try (InputStream in = LanguageDataTable.class.getResourceAsStream("/langdata/" + FILE_NAME)) {
                if (in == null) {
                    throw new FileNotFoundException("Missing resource: /langdata/" + FILE_NAME);
                }
                LanguageDataTable table = fromJson(in);
                LOGGER.info(() -> "Loaded " + table.size() + " language entries from classpath");
                return table;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load language data", e);
        }
    }

    /**
     * Parses a table from a JSON object of {@code code → entry}.
     *
     * @param in JSON input
     * @return the parsed table
     * @throws IOException if reading or parsing fails
     */
    public static LanguageDataTable fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return new LanguageDataTable(mapper.readValue(in, new TypeReference<Map<String, LanguageData>>() {
        }));
    }

    /**
     * Parses a table from a JSON file.
     *
     * @param path file path
     * @return the parsed table
     * @throws IOException if reading or parsing fails
     */
    public static LanguageDataTable fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    /**
     * Builds a table from already constructed entries.
     *
     * @param entries code → entry
     * @return a new immutable table
     */
    public static LanguageDataTable of(Map<String, LanguageData> entries) {
        return new LanguageDataTable(entries);
    }

    /**
     * Returns the entry for a language.
     *
     * @param code language code
     * @return the entry
     * @throws IllegalStateException if the table has no entry for {@code code}
     */
    public LanguageData require(String code) {
        LanguageData data = entries.get(code);
        if (data == null) {
            throw new IllegalStateException("No language data for `" + code + "`");
        }
        return data;
    }

    public boolean contains(String code) {
        return entries.containsKey(code);
    }

    public Set<String> codes() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
