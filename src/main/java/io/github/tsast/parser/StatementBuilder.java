package io.github.tsast.parser;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import io.github.tsast.ast.Statement;
import io.github.tsast.ast.Statement.BlockStatement;
import io.github.tsast.ast.Statement.BreakStatement;
import io.github.tsast.ast.Statement.ClassDeclaration;
import io.github.tsast.ast.Statement.ContinueStatement;
import io.github.tsast.ast.Statement.DebuggerStatement;
import io.github.tsast.ast.Statement.EmptyStatement;
import io.github.tsast.ast.Statement.EnumDeclaration;
import io.github.tsast.ast.Statement.ExportDeclaration;
import io.github.tsast.ast.Statement.ExpressionStatement;
import io.github.tsast.ast.Statement.ForInStatement;
import io.github.tsast.ast.Statement.ForOfStatement;
import io.github.tsast.ast.Statement.ForStatement;
import io.github.tsast.ast.Statement.FunctionDeclaration;
import io.github.tsast.ast.Statement.IfStatement;
import io.github.tsast.ast.Statement.ImportDeclaration;
import io.github.tsast.ast.Statement.LabeledStatement;
import io.github.tsast.ast.Statement.NamespaceDeclaration;
import io.github.tsast.ast.Statement.ReturnStatement;
import io.github.tsast.ast.Statement.SwitchStatement;
import io.github.tsast.ast.Statement.ThrowStatement;
import io.github.tsast.ast.Statement.TryStatement;
import io.github.tsast.ast.Statement.VariableKind;
import io.github.tsast.ast.Statement.VariableStatement;
import io.github.tsast.ast.Statement.WhileStatement;
import io.github.tsast.ast.Statement.WithStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Rebuilds typed statements from the direct children of a program node.
 *
 * <p>The generic tree keeps no grammar fields, so every statement is recognised from its text. Rules are tried in a
 * fixed order and the first match wins:
 *
 * <ol>
 *   <li>{@code const }/{@code let }/{@code var } prefix: variable statement
 *   <li>{@code function }/{@code async function} prefix: function declaration
 *   <li>{@code class }/{@code abstract class} prefix: class declaration
 *   <li>{@code if}, {@code while}, {@code for} (then {@code " of "}, {@code " in "}), {@code switch}, {@code try}
 *   <li>{@code return}, {@code throw}, {@code break}, {@code continue}
 *   <li>{@code import }, then {@code export }
 *   <li>text containing {@code "enum "}, then text containing {@code "namespace "}
 *   <li>block, empty, {@code debugger}, {@code with} and labeled statements
 *   <li>anything else that is neither blank nor a comment: expression statement
 * </ol>
 *
 * Matching is on raw text, so a string literal that happens to contain a keyword can steer a statement into the wrong
 * variant. Nothing here throws; names that cannot be recovered are empty.
 */
public final class StatementBuilder {
    private static final Logger logger = LogManager.getLogger(StatementBuilder.class);

    private static final String EXPORT_PREFIX = "export ";
    private static final String DEFAULT_PREFIX = "default ";
    private static final String[] CLASS_NAME_DELIMITERS = {"{", " extends", " implements", "<"};
    private static final Pattern LABEL = Pattern.compile("^([A-Za-z_$][A-Za-z0-9_$]*)\\s*:(?!:)");

    private StatementBuilder() {}

    /** Statements for the direct children of {@code root}, skipping children no rule accepts. */
    public static List<Statement> extractStatements(@Nullable GenericNode root) {
        if (root == null) {
            return List.of();
        }

        var statements = new ArrayList<Statement>();
        for (var child : root.getChildren()) {
            var statement = buildStatement(child);
            if (statement != null) {
                logger.trace("{} from {}", statement.kind(), child);
                statements.add(statement);
            } else {
                logger.trace("No statement for {}", child);
            }
        }
        return statements;
    }

    /** The statement for one node, or null when it is blank or a comment. */
    public static @Nullable Statement buildStatement(GenericNode node) {
        return buildStatement(node, false);
    }

    private static @Nullable Statement buildStatement(GenericNode node, boolean exported) {
        var text = node.getText();
        var trimmed = text.strip();

        if (startsWithAny(trimmed, "const ", "let ", "var ")) {
            return buildVariableStatement(node, trimmed);
        }
        if (isFunctionDeclarationText(trimmed)) {
            return buildFunctionDeclaration(node, node, trimmed, exported);
        }
        if (isClassDeclarationText(trimmed)) {
            return buildClassDeclaration(node, node, trimmed, exported);
        }
        if (startsWithAny(trimmed, "if ", "if(")) {
            return new IfStatement(node);
        }
        if (startsWithAny(trimmed, "while ", "while(")) {
            return new WhileStatement(node);
        }
        if (startsWithAny(trimmed, "for ", "for(")) {
            return buildForStatement(node, text);
        }
        if (startsWithAny(trimmed, "switch ", "switch(")) {
            return new SwitchStatement(node);
        }
        if (startsWithAny(trimmed, "try ", "try{")) {
            return new TryStatement(node);
        }
        if (trimmed.startsWith("return")) {
            return new ReturnStatement(node);
        }
        if (trimmed.startsWith("throw ")) {
            return new ThrowStatement(node);
        }
        if (trimmed.startsWith("break")) {
            return new BreakStatement(node);
        }
        if (trimmed.startsWith("continue")) {
            return new ContinueStatement(node);
        }
        if (trimmed.startsWith("import ")) {
            return new ImportDeclaration(node, importSource(node));
        }
        if (trimmed.startsWith(EXPORT_PREFIX)) {
            return buildExport(node, text, trimmed);
        }
        if (text.contains("enum ")) {
            return buildEnumDeclaration(node, node, text, exported);
        }
        if (text.contains("namespace ")) {
            return buildNamespaceDeclaration(node, node, text, exported);
        }
        return buildRemaining(node, trimmed);
    }

    private static @Nullable Statement buildRemaining(GenericNode node, String trimmed) {
        if (trimmed.isEmpty() || isComment(trimmed)) {
            return null;
        }
        if (trimmed.startsWith("{")) {
            return new BlockStatement(node);
        }
        if (trimmed.equals(";")) {
            return new EmptyStatement(node);
        }
        if (trimmed.equals("debugger") || startsWithAny(trimmed, "debugger;", "debugger ")) {
            return new DebuggerStatement(node);
        }
        if (startsWithAny(trimmed, "with ", "with(")) {
            return new WithStatement(node);
        }
        var label = LABEL.matcher(trimmed);
        if (label.find()) {
            return new LabeledStatement(node, label.group(1));
        }
        return new ExpressionStatement(node);
    }

    private static VariableStatement buildVariableStatement(GenericNode node, String trimmed) {
        VariableKind kind;
        if (trimmed.startsWith("const ")) {
            kind = VariableKind.CONST;
        } else if (trimmed.startsWith("let ")) {
            kind = VariableKind.LET;
        } else {
            kind = VariableKind.VAR;
        }

        // declarators are the children that open with their own name
        var names = new ArrayList<String>();
        for (var child : node.getChildren()) {
            if (child.getChildCount() == 0) {
                continue;
            }
            var first = child.getChild(0);
            if (first.getType() == NodeType.IDENTIFIER && child.getText().startsWith(first.getText())) {
                names.add(first.getText());
            }
        }
        return new VariableStatement(node, kind, names);
    }

    private static FunctionDeclaration buildFunctionDeclaration(
            GenericNode node, GenericNode declaration, String declarationText, boolean exported) {
        var text = node.getText();
        var name = identifierChildText(declaration);
        if (name.isEmpty()) {
            name = functionNameFromText(declarationText);
        }
        return new FunctionDeclaration(
                node,
                name,
                text.contains("async "),
                exported || text.strip().startsWith(EXPORT_PREFIX),
                text.contains("function*"));
    }

    private static ClassDeclaration buildClassDeclaration(
            GenericNode node, GenericNode declaration, String declarationText, boolean exported) {
        var text = node.getText();
        var name = identifierChildText(declaration);
        if (name.isEmpty()) {
            name = classNameFromText(declarationText);
        }
        return new ClassDeclaration(
                node, name, text.contains("abstract "), exported || text.strip().startsWith(EXPORT_PREFIX));
    }

    private static Statement buildForStatement(GenericNode node, String text) {
        if (text.contains(" of ")) {
            return new ForOfStatement(node, text.contains("await "));
        }
        if (text.contains(" in ")) {
            return new ForInStatement(node);
        }
        return new ForStatement(node);
    }

    /**
     * {@code export function|class|enum|namespace} yields the declaration itself, flagged as exported. Any other export
     * becomes an {@link ExportDeclaration} carrying the statement rebuilt from the exported child, when there is one.
     */
    private static Statement buildExport(GenericNode node, String text, String trimmed) {
        var rest = trimmed.substring(EXPORT_PREFIX.length()).strip();
        var declaration = childWithText(node, rest);
        var target = declaration != null ? declaration : node;

        if (isFunctionDeclarationText(rest)) {
            return buildFunctionDeclaration(node, target, rest, true);
        }
        if (isClassDeclarationText(rest)) {
            return buildClassDeclaration(node, target, rest, true);
        }
        if (startsWithAny(rest, "enum ", "const enum ")) {
            return buildEnumDeclaration(node, target, rest, true);
        }
        if (rest.startsWith("namespace ")) {
            return buildNamespaceDeclaration(node, target, rest, true);
        }

        var exportedText = rest.startsWith(DEFAULT_PREFIX) ? rest.substring(DEFAULT_PREFIX.length()).strip() : rest;
        var exportedChild = childWithText(node, exportedText);
        Statement inner = exportedChild == null ? null : buildStatement(exportedChild, true);
        if (inner instanceof ExpressionStatement) {
            inner = null;
        }
        return new ExportDeclaration(node, text.contains("export default"), inner);
    }

    private static EnumDeclaration buildEnumDeclaration(
            GenericNode node, GenericNode declaration, String declarationText, boolean exported) {
        var name = identifierChildText(declaration);
        if (name.isEmpty()) {
            name = nameAfterKeyword(declarationText, "enum ");
        }
        return new EnumDeclaration(node, name, node.getText().contains("const enum"), exported);
    }

    private static NamespaceDeclaration buildNamespaceDeclaration(
            GenericNode node, GenericNode declaration, String declarationText, boolean exported) {
        var name = identifierChildText(declaration);
        if (name.isEmpty()) {
            name = nameAfterKeyword(declarationText, "namespace ");
        }
        return new NamespaceDeclaration(node, name, exported);
    }

    private static String importSource(GenericNode node) {
        String source = "";
        for (var child : node.getChildren()) {
            if (child.getType() == NodeType.LITERAL) {
                source = unquote(child.getText());
            }
        }
        return source;
    }

    // ---------- name recovery ----------

    private static String identifierChildText(GenericNode node) {
        return node.findFirstChild(NodeType.IDENTIFIER).map(GenericNode::getText).orElse("");
    }

    /** {@code [async] function[*] name(...)}: the text between the keyword and the first parenthesis. */
    static String functionNameFromText(String declarationText) {
        var text = declarationText.strip();
        if (text.startsWith("async ")) {
            text = text.substring("async ".length()).strip();
        }
        if (text.startsWith("function ")) {
            text = text.substring("function ".length());
        } else if (text.startsWith("function*")) {
            text = text.substring("function*".length());
        }
        text = text.strip();

        int paren = text.indexOf('(');
        return paren > 0 ? text.substring(0, paren).strip() : "";
    }

    /**
     * {@code [abstract] class Name ...}: the text up to the earliest of an opening brace, {@code " extends"},
     * {@code " implements"} or {@code <}.
     */
    static String classNameFromText(String declarationText) {
        var text = declarationText.strip();
        if (text.startsWith("abstract ")) {
            text = text.substring("abstract ".length()).strip();
        }
        if (text.startsWith("class ")) {
            text = text.substring("class ".length());
        }
        text = text.strip();

        int end = -1;
        for (var delimiter : CLASS_NAME_DELIMITERS) {
            int index = text.indexOf(delimiter);
            if (index >= 0 && (end < 0 || index < end)) {
                end = index;
            }
        }
        return end < 0 ? text : text.substring(0, end).strip();
    }

    /** The word following {@code keyword}, ending at whitespace or an opening brace. */
    private static String nameAfterKeyword(String text, String keyword) {
        int start = text.indexOf(keyword);
        if (start < 0) {
            return "";
        }
        var rest = text.substring(start + keyword.length()).stripLeading();
        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end)) && rest.charAt(end) != '{') {
            end++;
        }
        return rest.substring(0, end);
    }

    // ---------- text helpers ----------

    private static boolean isFunctionDeclarationText(String trimmed) {
        return startsWithAny(trimmed, "function ", "async function");
    }

    private static boolean isClassDeclarationText(String trimmed) {
        return startsWithAny(trimmed, "class ", "abstract class");
    }

    private static boolean isComment(String trimmed) {
        return trimmed.startsWith("//") || (trimmed.startsWith("/*") && trimmed.endsWith("*/"));
    }

    private static @Nullable GenericNode childWithText(GenericNode node, String text) {
        for (var child : node.getChildren()) {
            if (child.getText().strip().equals(text)) {
                return child;
            }
        }
        return null;
    }

    private static String unquote(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            char last = literal.charAt(literal.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && last == first) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }

    private static boolean startsWithAny(String text, String... prefixes) {
        for (var prefix : prefixes) {
            if (text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
