package sentsegjava;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the spans of a paragraph in which a terminator does not end a sentence:
 * quoted text, parenthetical asides and e-mail addresses.
 *
 * <p>Ranges of the three kinds are collected into one list, quotes first, then e-mails,
 * then parentheses. They are neither merged nor sorted, so ranges may overlap.</p>
 */
public final class SkipRanges {

    private SkipRanges() {
    }

    // ---------------------------------------------------------------------
    // Quote pairs (open → close)
    // ---------------------------------------------------------------------

    /**
     * Opening/closing quote glyphs. The single ASCII quote requires a preceding space so
     * that elisions and possessives ({@code l'un}, {@code meeting's}) never open a span.
     */
    private static final String[][] QUOTE_PAIRS = {
            {"\"", "\""},
            {" '", "'"},
            {"«", "»"},
            {"‘", "’"},
            {"‚", "‘"},
            {"“", "”"},
            {"„", "“"},
            {"‹", "›"},
            {"「", "」"},
            {"『", "』"},
            {"〝", "〞"},
            {"﹁", "﹂"},
            {"﹃", "﹄"},
            {"＂", "＂"},
            {"＇", "＇"},
            {"｢", "｣"},
            {"《", "》"},
            {"〈", "〉"}
    };

    // ---------------------------------------------------------------------
    // E-mail addresses
    // ---------------------------------------------------------------------

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,7}");

    // ---------------------------------------------------------------------
    // Brackets
    // ---------------------------------------------------------------------

    private static final String PAREN_OPENERS = "(（<{[";
    private static final String PAREN_CLOSERS = ")]}）";

    /**
     * Computes all skip ranges of a paragraph.
     *
     * @param text the paragraph
     * @return unmerged ranges in category order
     */
    public static List<SkipRange> compute(String text) {
        List<SkipRange> ranges = new ArrayList<>();
        quotes(text, ranges);
        if (text.indexOf('@') >= 0) {
            collect(EMAIL_PATTERN, text, SkipRange.Kind.EMAIL, ranges);
        }
        parentheses(text, ranges);
        return ranges;
    }

    private static void collect(Pattern pattern, String text, SkipRange.Kind kind, List<SkipRange> out) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            out.add(new SkipRange(m.start(), m.end(), kind));
        }
    }

    /**
     * Finds non-overlapping quoted spans, leftmost first. At each offset the pairs are tried
     * in table order; a span runs from the opener to the nearest closer of the same pair,
     * across newlines. Each pair remembers its next closer, so the text is scanned once per
     * pair.
     */
    static void quotes(String text, List<SkipRange> out) {
        final int n = text.length();
        int[] nextClose = new int[QUOTE_PAIRS.length];
        Arrays.fill(nextClose, Integer.MIN_VALUE);

        int i = 0;
        while (i < n) {
            int end = -1;
            for (int k = 0; k < QUOTE_PAIRS.length && end < 0; k++) {
                String open = QUOTE_PAIRS[k][0];
                if (!text.startsWith(open, i)) {
                    continue;
                }
                String close = QUOTE_PAIRS[k][1];
                int from = i + open.length();
                if (nextClose[k] != -1 && nextClose[k] < from) {
                    nextClose[k] = text.indexOf(close, from);
                }
                if (nextClose[k] >= 0) {
                    end = nextClose[k] + close.length();
                }
            }
            if (end < 0) {
                i++;
                continue;
            }
            out.add(new SkipRange(i, end, SkipRange.Kind.QUOTE));
            i = end;
        }
    }

    /**
     * Finds non-overlapping bracketed spans, leftmost first. A span starts at any opener
     * and ends at the first closer of any family; a backslash followed by the opener is
     * consumed as ordinary text. A span never crosses a newline, and an opener without a
     * closer on its line is treated as ordinary text.
     */
    static void parentheses(String text, List<SkipRange> out) {
        final int n = text.length();
        int i = 0;
        while (i < n) {
            char open = text.charAt(i);
            if (PAREN_OPENERS.indexOf(open) < 0) {
                i++;
                continue;
            }
            int end = findCloser(text, i + 1, open);
            if (end < 0) {
                // no closer up to the end of this line, so no later opener on it matches
                int newline = text.indexOf('\n', i + 1);
                if (newline < 0) {
                    break;
                }
                i = newline + 1;
                continue;
            }
            out.add(new SkipRange(i, end, SkipRange.Kind.PARENTHESIS));
            i = end;
        }
    }

    /**
     * @return the offset just past the closing bracket, or -1 if none before a newline
     */
    private static int findCloser(String text, int from, char open) {
        final int n = text.length();
        int j = from;
        while (j < n) {
            char ch = text.charAt(j);
            if (PAREN_CLOSERS.indexOf(ch) >= 0) {
                return j + 1;
            }
            if (ch == '\\' && j + 1 < n && text.charAt(j + 1) == open) {
                j += 2;
                continue;
            }
            if (ch == '\n') {
                return -1;
            }
            j++;
        }
        return -1;
    }
}
