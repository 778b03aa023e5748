package io.github.tsast.parser;

/**
 * Base class for failures to turn source into a syntax tree. Carries a label for the source (a file path, or
 * {@code <memory>}) and the operation that failed.
 */
public abstract class SourceParseException extends Exception {
    private final String source;
    private final String operation;

    protected SourceParseException(String message, String source, String operation) {
        super(message);
        this.source = source;
        this.operation = operation;
    }

    protected SourceParseException(String message, Throwable cause, String source, String operation) {
        super(message, cause);
        this.source = source;
        this.operation = operation;
    }

    public String getSource() {
        return source;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        return String.format("Parsing failed during %s for %s: %s", operation, source, super.getMessage());
    }
}
