package io.github.tsast.parser;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings for {@link TypeScriptParser}.
 *
 * @param fileCharset encoding used to decode files read by {@code parseFile}; the text is handed to tree-sitter as
 *     UTF-8 regardless
 * @param maxFileBytes files larger than this are rejected with an {@link java.io.IOException}
 */
public record ParserOptions(Charset fileCharset, long maxFileBytes) {
    private static final Logger logger = LogManager.getLogger(ParserOptions.class);

    public static final String FILE_CHARSET_PROPERTY = "tsast.file.charset";
    public static final String MAX_FILE_BYTES_PROPERTY = "tsast.file.maxBytes";
    public static final long DEFAULT_MAX_FILE_BYTES = 16L * 1024 * 1024;

    public ParserOptions {
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive: " + maxFileBytes);
        }
    }

    /**
     * Defaults, overridable with {@code -Dtsast.file.charset=<name>} and {@code -Dtsast.file.maxBytes=<n>}. Invalid
     * overrides are logged and ignored.
     */
    public static ParserOptions defaults() {
        return fromProperties(
                System.getProperty(FILE_CHARSET_PROPERTY), System.getProperty(MAX_FILE_BYTES_PROPERTY));
    }

    /** Package-private for testing without touching global system properties. */
    static ParserOptions fromProperties(@Nullable String charsetProp, @Nullable String maxBytesProp) {
        Charset charset = StandardCharsets.UTF_8;
        if (charsetProp != null) {
            try {
                charset = Charset.forName(charsetProp.trim());
                logger.info("Using file charset {} from system property {}", charset, FILE_CHARSET_PROPERTY);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                logger.warn("Invalid {} value '{}'; using UTF-8", FILE_CHARSET_PROPERTY, charsetProp);
            }
        }

        long maxBytes = DEFAULT_MAX_FILE_BYTES;
        if (maxBytesProp != null) {
            try {
                long parsed = Long.parseLong(maxBytesProp.trim());
                if (parsed > 0) {
                    maxBytes = parsed;
                } else {
                    logger.warn("Non-positive {} value '{}'; ignoring override", MAX_FILE_BYTES_PROPERTY, maxBytesProp);
                }
            } catch (NumberFormatException nfe) {
                logger.warn("Invalid {} value '{}'; ignoring override", MAX_FILE_BYTES_PROPERTY, maxBytesProp);
            }
        }
        return new ParserOptions(charset, maxBytes);
    }
}
