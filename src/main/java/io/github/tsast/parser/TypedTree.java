package io.github.tsast.parser;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.Statement;
import java.util.List;

/**
 * A parsed program together with the statements reconstructed from the root's direct children. The statement list is
 * computed once, when the tree is built.
 */
public record TypedTree(GenericNode root, List<Statement> statements) {

    public TypedTree {
        statements = List.copyOf(statements);
    }

    /** Statements of one variant, in source order. */
    public <T extends Statement> List<T> statements(Class<T> type) {
        return statements.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
