package io.github.tsast.ast;

/**
 * A location in the source buffer. Row and column are zero-based; {@code offset} is the absolute UTF-8 byte offset.
 * Columns are byte columns, as reported by tree-sitter.
 */
public record Position(int row, int column, int offset) {

    public static final Position ORIGIN = new Position(0, 0, 0);

    public Position {
        if (row < 0 || column < 0 || offset < 0) {
            throw new IllegalArgumentException(
                    "Position components must be non-negative: row=%d column=%d offset=%d"
                            .formatted(row, column, offset));
        }
    }
}
