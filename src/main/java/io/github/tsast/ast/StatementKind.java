package io.github.tsast.ast;

/** Discriminator for the {@link Statement} variants. */
public enum StatementKind {
    VARIABLE,
    FUNCTION,
    CLASS,
    IF,
    WHILE,
    FOR,
    FOR_IN,
    FOR_OF,
    SWITCH,
    TRY,
    RETURN,
    THROW,
    BREAK,
    CONTINUE,
    BLOCK,
    EMPTY,
    LABELED,
    WITH,
    DEBUGGER,
    IMPORT,
    EXPORT,
    ENUM,
    NAMESPACE,
    EXPRESSION
}
