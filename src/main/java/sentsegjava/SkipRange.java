package sentsegjava;

/**
 * Half-open interval {@code [start, end)} of a paragraph inside which sentence boundaries
 * are suppressed or moved to {@code end}.
 */
public final class SkipRange {

    /**
     * Kind of span a range was computed from.
     */
    public enum Kind {
        QUOTE, EMAIL, PARENTHESIS
    }

    private final int start;
    private final int end;
    private final Kind kind;

    public SkipRange(int start, int end, Kind kind) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.kind = kind;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns whether {@code offset} lies strictly inside this range,
     * i.e. {@code start < offset < end}.
     *
     * @param offset a boundary offset
     * @return {@code true} if strictly inside
     */
    public boolean strictlyContains(int offset) {
        return offset > start && offset < end;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SkipRange)) return false;
        SkipRange r = (SkipRange) o;
        return r.start == start && r.end == end && r.kind == kind;
    }

    @Override
    public int hashCode() {
        return (start * 397 + end) * 31 + kind.ordinal();
    }

    @Override
    public String toString() {
        return kind + "[" + start + ", " + end + ")";
    }
}
