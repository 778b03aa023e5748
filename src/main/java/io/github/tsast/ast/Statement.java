package io.github.tsast.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A top-level statement or declaration reconstructed from one direct child of the program node. Each variant keeps the
 * originating {@link GenericNode} plus whatever semantic fields could be recovered from its text.
 */
public sealed interface Statement
        permits Statement.VariableStatement,
                Statement.FunctionDeclaration,
                Statement.ClassDeclaration,
                Statement.IfStatement,
                Statement.WhileStatement,
                Statement.ForStatement,
                Statement.ForInStatement,
                Statement.ForOfStatement,
                Statement.SwitchStatement,
                Statement.TryStatement,
                Statement.ReturnStatement,
                Statement.ThrowStatement,
                Statement.BreakStatement,
                Statement.ContinueStatement,
                Statement.BlockStatement,
                Statement.EmptyStatement,
                Statement.LabeledStatement,
                Statement.WithStatement,
                Statement.DebuggerStatement,
                Statement.ImportDeclaration,
                Statement.ExportDeclaration,
                Statement.EnumDeclaration,
                Statement.NamespaceDeclaration,
                Statement.ExpressionStatement {

    GenericNode node();

    StatementKind kind();

    enum VariableKind {
        VAR,
        LET,
        CONST
    }

    /** {@code var}, {@code let} or {@code const}; {@code names} holds the plain identifiers being declared. */
    record VariableStatement(GenericNode node, VariableKind variableKind, List<String> names) implements Statement {
        public VariableStatement {
            names = List.copyOf(names);
        }

        @Override
        public StatementKind kind() {
            return StatementKind.VARIABLE;
        }
    }

    record FunctionDeclaration(GenericNode node, String name, boolean isAsync, boolean isExported, boolean isGenerator)
            implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.FUNCTION;
        }
    }

    record ClassDeclaration(GenericNode node, String name, boolean isAbstract, boolean isExported) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.CLASS;
        }
    }

    record IfStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.IF;
        }
    }

    record WhileStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.WHILE;
        }
    }

    record ForStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.FOR;
        }
    }

    record ForInStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.FOR_IN;
        }
    }

    record ForOfStatement(GenericNode node, boolean isAwait) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.FOR_OF;
        }
    }

    record SwitchStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.SWITCH;
        }
    }

    record TryStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.TRY;
        }
    }

    record ReturnStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.RETURN;
        }
    }

    record ThrowStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.THROW;
        }
    }

    record BreakStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.BREAK;
        }
    }

    record ContinueStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.CONTINUE;
        }
    }

    record BlockStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.BLOCK;
        }
    }

    record EmptyStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.EMPTY;
        }
    }

    record LabeledStatement(GenericNode node, String label) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.LABELED;
        }
    }

    record WithStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.WITH;
        }
    }

    record DebuggerStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.DEBUGGER;
        }
    }

    /** {@code source} is the module specifier without its quotes, or empty when none could be found. */
    record ImportDeclaration(GenericNode node, String source) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.IMPORT;
        }
    }

    /**
     * An export that is not itself a function, class, enum or namespace declaration. {@code declaration} is the
     * statement rebuilt from the exported child (e.g. the variable statement of {@code export const x = 1}), if any.
     */
    record ExportDeclaration(GenericNode node, boolean isDefault, @Nullable Statement declaration)
            implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.EXPORT;
        }
    }

    record EnumDeclaration(GenericNode node, String name, boolean isConst, boolean isExported) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.ENUM;
        }
    }

    record NamespaceDeclaration(GenericNode node, String name, boolean isExported) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.NAMESPACE;
        }
    }

    record ExpressionStatement(GenericNode node) implements Statement {
        @Override
        public StatementKind kind() {
            return StatementKind.EXPRESSION;
        }
    }
}
