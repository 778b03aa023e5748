package io.github.tsast.ast;

/**
 * Coarse semantic bucket assigned to every {@link GenericNode}. The set is closed; anything the classifier does not
 * recognise is {@link #UNKNOWN}.
 */
public enum NodeType {
    FUNCTION,
    ARROW_FUNCTION,
    METHOD,
    INTERFACE,
    TYPE_ALIAS,
    EXPRESSION,
    IDENTIFIER,
    LITERAL,
    PROPERTY,
    PARAMETER,
    UNKNOWN;

    public boolean isFunctionLike() {
        return this == FUNCTION || this == ARROW_FUNCTION || this == METHOD;
    }
}
