package io.github.tsast.parser;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.Position;
import io.github.tsast.ast.Range;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSInputEncoding;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSReader;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

/**
 * Parses TypeScript with tree-sitter and copies the result into an immutable {@link GenericNode} tree.
 *
 * <p>A parser owns one native {@link TSParser}. TSParser is not threadsafe, so neither is this class: use one instance
 * per thread. {@link #close()} may be called any number of times; parsing after close fails with
 * {@link IllegalStateException}.
 */
public class TypeScriptParser implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TypeScriptParser.class);
    // Native library loading is assumed automatic by the io.github.bonede.tree_sitter library.

    static final String IN_MEMORY_SOURCE = "<memory>";
    private static final int READ_CHUNK_BYTES = 64 * 1024;

    private final ParserOptions options;
    private @Nullable TSParser parser;

    public TypeScriptParser() throws TreeSitterAnalysisException {
        this(ParserOptions.defaults());
    }

    public TypeScriptParser(ParserOptions options) throws TreeSitterAnalysisException {
        this.options = options;
        TSParser tsParser;
        boolean languageSet;
        try {
            tsParser = new TSParser();
            languageSet = tsParser.setLanguage(new TreeSitterTypescript());
        } catch (LinkageError | RuntimeException e) {
            logger.error("Failed to initialise tree-sitter", e);
            throw new TreeSitterAnalysisException(
                    "tree-sitter could not be initialised", e, IN_MEMORY_SOURCE, "initialisation");
        }
        if (!languageSet) {
            logger.error("Failed to set TypeScript language on TSParser");
            throw new TreeSitterAnalysisException(
                    "TypeScript grammar rejected by tree-sitter", IN_MEMORY_SOURCE, "initialisation");
        }
        this.parser = tsParser;
    }

    public ParserOptions getOptions() {
        return options;
    }

    /** Parses UTF-8 encoded source and returns the root node, which always spans the whole buffer. */
    public GenericNode parse(byte[] source) throws SourceParseException {
        return parse(source, IN_MEMORY_SOURCE);
    }

    public GenericNode parse(String source) throws SourceParseException {
        return parse(source.getBytes(StandardCharsets.UTF_8), IN_MEMORY_SOURCE);
    }

    /**
     * Reads and parses a file decoded with {@link ParserOptions#fileCharset()}.
     *
     * @throws IOException if the file cannot be read or is larger than {@link ParserOptions#maxFileBytes()}
     */
    public GenericNode parseFile(Path path) throws IOException, SourceParseException {
        return parse(readSource(path), path.toString());
    }

    /** Parses source and reconstructs the statements of its top level. */
    public TypedTree buildTypedTree(byte[] source) throws SourceParseException {
        return toTypedTree(parse(source, IN_MEMORY_SOURCE));
    }

    public TypedTree buildTypedTree(String source) throws SourceParseException {
        return buildTypedTree(source.getBytes(StandardCharsets.UTF_8));
    }

    public TypedTree buildTypedTreeFromFile(Path path) throws IOException, SourceParseException {
        return toTypedTree(parseFile(path));
    }

    /** Releases the native parser. Idempotent. */
    @Override
    public void close() {
        if (parser != null) {
            logger.trace("Releasing TSParser");
            // TSParser frees its native memory once unreachable
            parser = null;
        }
    }

    public boolean isClosed() {
        return parser == null;
    }

    private TypedTree toTypedTree(GenericNode root) {
        var statements = StatementBuilder.extractStatements(root);
        logger.debug("Reconstructed {} top-level statements from {} children", statements.size(), root.getChildCount());
        return new TypedTree(root, statements);
    }

    private GenericNode parse(byte[] source, String sourceLabel) throws SourceParseException {
        var tsParser = parser;
        if (tsParser == null) {
            throw new IllegalStateException("TypeScriptParser is closed");
        }
        if (source.length == 0) {
            throw new EmptySourceException(sourceLabel, "parse");
        }

        // node offsets index the bytes the engine reads, so it reads exactly the buffer we slice from
        var buffer = new String(source, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);

        TSTree tree;
        try {
            tree = tsParser.parse(
                    new byte[Math.min(buffer.length, READ_CHUNK_BYTES)],
                    null,
                    bufferReader(buffer),
                    TSInputEncoding.TSInputEncodingUTF8);
        } catch (RuntimeException e) {
            logger.warn("tree-sitter failed on {}", sourceLabel, e);
            throw new TreeSitterAnalysisException("tree-sitter failed to parse source", e, sourceLabel, "parse");
        }
        if (tree == null) {
            throw new TreeSitterAnalysisException("tree-sitter returned no tree", sourceLabel, "parse");
        }
        var rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            throw new TreeSitterAnalysisException("tree-sitter returned no root node", sourceLabel, "parse");
        }

        var root = convertRoot(rootNode, buffer);
        logger.debug("Parsed {} ({} bytes) into a tree with {} top-level children",
                sourceLabel, buffer.length, root.getChildCount());
        return root;
    }

    private static TSReader bufferReader(byte[] buffer) {
        return (chunk, offset, position) -> {
            if (offset >= buffer.length) {
                return 0;
            }
            int length = Math.min(chunk.length, buffer.length - offset);
            System.arraycopy(buffer, offset, chunk, 0, length);
            return length;
        };
    }

    private byte[] readSource(Path path) throws IOException {
        long size = Files.size(path);
        if (size > options.maxFileBytes()) {
            throw new IOException("File %s is %d bytes, above the %d byte limit"
                    .formatted(path, size, options.maxFileBytes()));
        }
        var bytes = Files.readAllBytes(path);
        if (StandardCharsets.UTF_8.equals(options.fileCharset())) {
            return bytes;
        }
        return new String(bytes, options.fileCharset()).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * The program node omits leading whitespace, so the root is widened to cover the whole buffer; every other node
     * keeps the range tree-sitter reports.
     */
    private static GenericNode convertRoot(TSNode rootNode, byte[] source) {
        var range = new Range(Position.ORIGIN, endOfBuffer(source));
        var children = convertChildren(rootNode, source);
        return new GenericNode(
                NodeTypeClassifier.classify(rootNode.getType()),
                new String(source, StandardCharsets.UTF_8),
                range,
                children);
    }

    private static GenericNode convertNode(TSNode node, byte[] source) {
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        var range = new Range(
                new Position(start.getRow(), start.getColumn(), startByte),
                new Position(end.getRow(), end.getColumn(), endByte));

        return new GenericNode(
                NodeTypeClassifier.classify(node.getType()),
                new String(source, startByte, endByte - startByte, StandardCharsets.UTF_8),
                range,
                convertChildren(node, source));
    }

    private static ArrayList<GenericNode> convertChildren(TSNode node, byte[] source) {
        int childCount = node.getChildCount();
        var children = new ArrayList<GenericNode>(childCount);
        for (int i = 0; i < childCount; i++) {
            var child = node.getChild(i);
            if (child != null && !child.isNull()) {
                children.add(convertNode(child, source));
            }
        }
        return children;
    }

    private static Position endOfBuffer(byte[] source) {
        int row = 0;
        int lineStart = 0;
        for (int i = 0; i < source.length; i++) {
            if (source[i] == '\n') {
                row++;
                lineStart = i + 1;
            }
        }
        return new Position(row, source.length - lineStart, source.length);
    }
}
