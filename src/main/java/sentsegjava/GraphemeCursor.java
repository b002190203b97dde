package sentsegjava;

import com.ibm.icu.text.BreakIterator;

import java.util.Arrays;

/**
 * Navigation over the grapheme-cluster starts of one paragraph.
 *
 * <p>Offsets are UTF-16 indices into the paragraph. They are computed once with an ICU
 * character break iterator (extended grapheme clusters), so stepping through them never
 * lands inside a surrogate pair or between a base character and its combining marks.</p>
 */
public final class GraphemeCursor {

    /**
     * Returned by the navigation methods when no offset qualifies.
     */
    public static final int NONE = -1;

    private final String text;
    private final int[] offsets;

    private GraphemeCursor(String text, int[] offsets) {
        this.text = text;
        this.offsets = offsets;
    }

    /**
     * Builds a cursor over the given text.
     *
     * @param text the paragraph
     * @return a cursor holding one offset per grapheme-cluster start
     */
    public static GraphemeCursor of(String text) {
        BreakIterator it = BreakIterator.getCharacterInstance();
        it.setText(text);

        int[] buf = new int[text.length()];
        int n = 0;
        int start = it.first();
        for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
            buf[n++] = start;
        }
        return new GraphemeCursor(text, Arrays.copyOf(buf, n));
    }

    /**
     * Smallest recorded offset strictly greater than {@code offset}.
     *
     * @param offset reference offset
     * @return the next grapheme start, or {@link #NONE}
     */
    public int nextGrapheme(int offset) {
        int i = Arrays.binarySearch(offsets, offset);
        int idx = i >= 0 ? i + 1 : -i - 1;
        return idx < offsets.length ? offsets[idx] : NONE;
    }

    /**
     * Largest recorded offset strictly less than {@code offset}.
     *
     * @param offset reference offset
     * @return the previous grapheme start, or {@link #NONE}
     */
    public int prevGrapheme(int offset) {
        int i = Arrays.binarySearch(offsets, offset);
        int idx = (i >= 0 ? i : -i - 1) - 1;
        return idx >= 0 ? offsets[idx] : NONE;
    }

    /**
     * Smallest recorded offset greater than or equal to {@code offset}, or the text length
     * when {@code offset} lies in the last cluster.
     *
     * @param offset reference offset
     * @return an aligned offset
     */
    public int ceilGrapheme(int offset) {
        if (isGraphemeStart(offset)) {
            return offset;
        }
        int next = nextGrapheme(offset);
        return next == NONE ? text.length() : next;
    }

    /**
     * Returns whether {@code offset} starts a grapheme cluster.
     *
     * @param offset the offset to check
     * @return {@code true} if recorded
     */
    public boolean isGraphemeStart(int offset) {
        return Arrays.binarySearch(offsets, offset) >= 0;
    }

    /**
     * Returns the text from {@code offset} to the end of the cluster containing it. For a
     * recorded start this is the whole cluster; inside a cluster, such as a terminator
     * following a prepended mark, it is the remainder of that cluster.
     *
     * @param offset any offset inside the text
     * @return the cluster text from {@code offset}
     */
    public String graphemeAt(int offset) {
        return text.substring(offset, ceilGrapheme(offset + 1));
    }

    /**
     * @return a copy of the recorded offsets, ascending
     */
    public int[] offsets() {
        return offsets.clone();
    }

    /**
     * @return number of grapheme clusters
     */
    public int size() {
        return offsets.length;
    }
}
