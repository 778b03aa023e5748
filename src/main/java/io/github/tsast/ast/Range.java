package io.github.tsast.ast;

/** A half-open source range {@code [start, end)} ordered by byte offset. */
public record Range(Position start, Position end) {

    public Range {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
        }
    }

    public int startOffset() {
        return start.offset();
    }

    public int endOffset() {
        return end.offset();
    }

    /** Length in bytes. */
    public int length() {
        return end.offset() - start.offset();
    }

    public boolean contains(Range other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }
}
