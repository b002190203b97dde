package sentsegjava;

import java.nio.CharBuffer;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into sentences with the rules of a {@link Language}.
 *
 * <p>The text is cut into paragraphs at runs of two or more newlines. Within a paragraph,
 * every run of terminators is a candidate boundary that the language may reject
 * (continuation, abbreviation, exclamation word). Accepted boundaries inside quotes,
 * brackets or e-mail addresses are dropped, or moved behind the closing quote when the
 * language treats punctuation before a closing quote as final. A terminator followed by
 * numbered references such as {@code [7][8]} always ends the sentence after the last
 * reference.</p>
 *
 * <p>All methods are pure; the class holds no state.</p>
 */
public final class BoundaryResolver {

    /**
     * Emitted between the sentences of consecutive paragraphs.
     */
    public static final String PARAGRAPH_BREAK = "\n\n";

    private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\n{2,}");

    private BoundaryResolver() {
    }

    /**
     * Segments text into sentences.
     *
     * @param language rules to apply
     * @param text     input text
     * @return sentences in order, with {@link #PARAGRAPH_BREAK} between paragraphs;
     * empty for empty input
     */
    public static List<String> segment(Language language, String text) {
        List<String> sentences = new ArrayList<>();
        if (text.isEmpty()) {
            return sentences;
        }

        for (String paragraph : PARAGRAPH_SPLIT.split(text)) {
            List<String> paragraphSentences = segmentParagraph(language, paragraph);
            if (paragraphSentences.isEmpty()) {
                continue;
            }
            if (!sentences.isEmpty()) {
                sentences.add(PARAGRAPH_BREAK);
            }
            sentences.addAll(paragraphSentences);
        }
        return sentences;
    }

    /**
     * Segments a single paragraph.
     *
     * @param language  rules to apply
     * @param paragraph text without paragraph breaks
     * @return trimmed, non-empty sentences
     */
    static List<String> segmentParagraph(Language language, String paragraph) {
        int[] boundaries = resolveBoundaries(language, paragraph);

        List<String> sentences = new ArrayList<>();
        for (int k = 0; k < boundaries.length; k++) {
            int from = boundaries[k];
            int to = k + 1 < boundaries.length ? boundaries[k + 1] : paragraph.length();
            String sentence = trimSpaces(paragraph.substring(from, to));
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    /**
     * Computes the sentence boundaries of one paragraph.
     *
     * @param language  rules to apply
     * @param paragraph text without paragraph breaks
     * @return strictly increasing offsets starting with 0; each is a grapheme start of the
     * paragraph or its length
     */
    public static int[] resolveBoundaries(Language language, String paragraph) {
        GraphemeCursor cursor = GraphemeCursor.of(paragraph);
        SkipRangeScan skipRanges = new SkipRangeScan(SkipRanges.compute(paragraph));

        List<Integer> boundaries = new ArrayList<>();
        boundaries.add(0);

        Matcher m = language.terminatorPattern().matcher(paragraph);
        while (m.find()) {
            Candidate candidate = findBoundary(language, paragraph, cursor, m.start(), m.end());
            if (candidate == null) {
                continue;
            }

            int boundary = candidate.offset;
            if (!candidate.forced) {
                boundary = applySkipRanges(language, cursor, skipRanges, boundary);
                if (boundary < 0) {
                    continue;
                }
            }

            if (boundary > boundaries.get(boundaries.size() - 1)) {
                boundaries.add(boundary);
            }
        }

        int[] out = new int[boundaries.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = boundaries.get(i);
        }
        return out;
    }

    /**
     * Decides whether the terminator run {@code [start, end)} ends a sentence.
     *
     * @return the candidate, or {@code null} if the run does not end a sentence
     */
    private static Candidate findBoundary(Language language, String text, GraphemeCursor cursor,
                                          int start, int end) {
        int next = cursor.nextGrapheme(start);
        if (next == GraphemeCursor.NONE) {
            return null;
        }
        CharSequence head = CharBuffer.wrap(text, 0, start);
        CharSequence tail = CharBuffer.wrap(text, next, text.length());

        Matcher refs = language.numberedReferencePattern().matcher(tail);
        if (refs.lookingAt()) {
            return new Candidate(cursor.ceilGrapheme(next + refs.end()), true);
        }

        if (language.continueInNextWord(tail)) {
            return null;
        }

        String separator = cursor.graphemeAt(start);
        if (language.isAbbreviation(head, separator)) {
            return null;
        }
        if (language.isExclamationWord(head, separator)) {
            return null;
        }

        return new Candidate(cursor.ceilGrapheme(end), false);
    }

    /**
     * Checks an accepted boundary against the skip ranges; the first range, in category
     * order, that strictly contains it decides.
     *
     * @return the boundary, moved to the range end if the language allows it, or -1 when
     * it falls inside a range
     */
    private static int applySkipRanges(Language language, GraphemeCursor cursor,
                                       SkipRangeScan ranges, int boundary) {
        SkipRange range = ranges.containing(boundary);
        if (range == null) {
            return boundary;
        }
        if (cursor.nextGrapheme(boundary) == range.end() && language.isPunctuationBetweenQuotes()) {
            return range.end();
        }
        return -1;
    }

    /**
     * Strips the plain space character, and only that, from both ends.
     */
    static String trimSpaces(String s) {
        int from = 0;
        int to = s.length();
        while (from < to && s.charAt(from) == ' ') from++;
        while (to > from && s.charAt(to - 1) == ' ') to--;
        return s.substring(from, to);
    }

    /**
     * Walks the skip ranges of one paragraph for non-decreasing offsets. Ranges of one kind
     * never overlap and come in text order, so each kind keeps a pointer to its first range
     * not yet behind the offset.
     */
    private static final class SkipRangeScan {
        private final List<List<SkipRange>> byKind;
        private final int[] next;

        SkipRangeScan(List<SkipRange> ranges) {
            Map<SkipRange.Kind, List<SkipRange>> grouped = new EnumMap<>(SkipRange.Kind.class);
            for (SkipRange range : ranges) {
                grouped.computeIfAbsent(range.kind(), k -> new ArrayList<>()).add(range);
            }
            this.byKind = new ArrayList<>(grouped.values());
            this.next = new int[byKind.size()];
        }

        SkipRange containing(int offset) {
            for (int k = 0; k < byKind.size(); k++) {
                List<SkipRange> kind = byKind.get(k);
                int i = next[k];
                while (i < kind.size() && kind.get(i).end() <= offset) {
                    i++;
                }
                next[k] = i;
                if (i < kind.size() && kind.get(i).strictlyContains(offset)) {
                    return kind.get(i);
                }
            }
            return null;
        }
    }

    private static final class Candidate {
        final int offset;
        final boolean forced;

        Candidate(int offset, boolean forced) {
            this.offset = offset;
            this.forced = forced;
        }
    }
}
