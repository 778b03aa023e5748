package io.github.tsast.parser;

/** Thrown when asked to parse a zero-length source. */
public class EmptySourceException extends SourceParseException {

    public EmptySourceException(String source, String operation) {
        super("source is empty", source, operation);
    }
}
