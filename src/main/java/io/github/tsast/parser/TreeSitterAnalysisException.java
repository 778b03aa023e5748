package io.github.tsast.parser;

/**
 * Thrown when the tree-sitter engine cannot be initialised or does not produce a tree. Malformed source is not a
 * failure: the grammar recovers and yields a best-effort tree.
 */
public class TreeSitterAnalysisException extends SourceParseException {

    public TreeSitterAnalysisException(String message, String source, String operation) {
        super(message, source, operation);
    }

    public TreeSitterAnalysisException(String message, Throwable cause, String source, String operation) {
        super(message, cause, source, operation);
    }
}
