package sentsegjava;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Sentence-terminating punctuation shared by all languages.
 *
 * <p>The global set covers the sentence-terminal marks of the scripts the library
 * supports, so most languages use {@link #GLOBAL_PATTERN} unchanged. Languages that
 * add or remove marks build their own pattern with {@link #runPattern(Collection)}.</p>
 */
public final class Terminators {

    private Terminators() {
    }

    /**
     * Global sentence terminators, as code points.
     */
    private static final int[] GLOBAL_CODE_POINTS = {
            // Latin / common
            '!', '.', '?',
            // Armenian full stop
            0x0589,
            // Arabic
            0x061D, 0x061E, 0x061F, 0x06D4,
            // Syriac
            0x0700, 0x0701, 0x0702,
            // NKo
            0x07F9,
            // Samaritan
            0x0837, 0x0839, 0x083D, 0x083E,
            // Devanagari danda / double danda
            0x0964, 0x0965,
            // Myanmar
            0x104A, 0x104B,
            // Ethiopic
            0x1362, 0x1367, 0x1368,
            // Canadian syllabics
            0x166E,
            // Philippine
            0x1735, 0x1736,
            // Mongolian
            0x1803, 0x1809,
            // Limbu
            0x1944, 0x1945,
            // Tai Tham
            0x1AA8, 0x1AA9, 0x1AAA, 0x1AAB,
            // Balinese
            0x1B5A, 0x1B5B, 0x1B5E, 0x1B5F,
            // Lepcha
            0x1C3B, 0x1C3C,
            // Ol Chiki
            0x1C7E, 0x1C7F,
            // General punctuation
            0x203C, 0x203D, 0x2047, 0x2048, 0x2049,
            0x2E2E, 0x2E3C,
            // Ideographic full stop
            0x3002,
            // Vai, Cyrillic ext., Bamum
            0xA4FF, 0xA60E, 0xA60F, 0xA6F3, 0xA6F7,
            // Phags-pa, Saurashtra, Kayah Li
            0xA876, 0xA877, 0xA8CE, 0xA8CF, 0xA92F,
            // Javanese, Cham
            0xA9C8, 0xA9C9, 0xAA5D, 0xAA5E, 0xAA5F,
            // Meetei Mayek
            0xAAF0, 0xAAF1, 0xABEB,
            // Small form variants
            0xFE52, 0xFE56, 0xFE57,
            // Full-width / half-width forms
            0xFF01, 0xFF0E, 0xFF1F, 0xFF61,
            // Brahmi, Kaithi, Chakma, Sharada, Khojki, Siddham, Modi, Takri
            0x11047, 0x11048, 0x110BE, 0x110BF, 0x110C0, 0x110C1,
            0x11141, 0x11142, 0x11143, 0x111C5, 0x111C6, 0x111CD,
            0x11238, 0x11239, 0x1123B, 0x1123C,
            0x115C2, 0x115C3, 0x11641, 0x11642, 0x1173C, 0x1173D, 0x1173E,
            // Duployan
            0x1BC9F,
            // Sutton SignWriting
            0x1DA88
    };

    /**
     * Unmodifiable set of the global terminators.
     */
    public static final Set<Integer> GLOBAL;

    /**
     * Pattern matching a run of one or more global terminators.
     */
    public static final Pattern GLOBAL_PATTERN;

    static {
        Set<Integer> set = new LinkedHashSet<>();
        for (int cp : GLOBAL_CODE_POINTS) {
            set.add(cp);
        }
        GLOBAL = Collections.unmodifiableSet(set);
        GLOBAL_PATTERN = runPattern(GLOBAL);
    }

    /**
     * Returns {@code true} if the code point is a global terminator.
     *
     * @param codePoint the code point to test
     * @return whether it is in {@link #GLOBAL}
     */
    public static boolean isGlobalTerminator(int codePoint) {
        return GLOBAL.contains(codePoint);
    }

    /**
     * Returns a copy of the global set with the given code points added and removed.
     *
     * @param add    code points to add
     * @param remove code points to remove
     * @return a new ordered set
     */
    public static Set<Integer> globalWith(int[] add, int[] remove) {
        Set<Integer> set = new LinkedHashSet<>(GLOBAL);
        for (int cp : remove) {
            set.remove(cp);
        }
        for (int cp : add) {
            set.add(cp);
        }
        return set;
    }

    /**
     * Builds a pattern that matches a run ({@code [...]+}) of the given terminators.
     *
     * @param codePoints terminators to include
     * @return compiled pattern
     */
    public static Pattern runPattern(Collection<Integer> codePoints) {
        StringBuilder sb = new StringBuilder("[");
        for (int cp : codePoints) {
            sb.append(String.format("\\x{%X}", cp));
        }
        sb.append("]+");
        return Pattern.compile(sb.toString());
    }

    /**
     * Strips leading and trailing runs of global terminators from a word.
     *
     * @param word the word to strip
     * @return the stripped word, possibly empty
     */
    public static String stripTerminators(String word) {
        int start = 0;
        int end = word.length();
        while (start < end) {
            int cp = word.codePointAt(start);
            if (!isGlobalTerminator(cp)) break;
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = word.codePointBefore(end);
            if (!isGlobalTerminator(cp)) break;
            end -= Character.charCount(cp);
        }
        return word.substring(start, end);
    }
}
