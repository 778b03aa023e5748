package io.github.tsast.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class ParserOptionsTest {

    @Test
    void testDefaultsWithoutOverrides() {
        var options = ParserOptions.fromProperties(null, null);

        assertEquals(StandardCharsets.UTF_8, options.fileCharset());
        assertEquals(ParserOptions.DEFAULT_MAX_FILE_BYTES, options.maxFileBytes());
    }

    @Test
    void testValidOverrides() {
        var options = ParserOptions.fromProperties(" ISO-8859-1 ", "4096");

        assertEquals(StandardCharsets.ISO_8859_1, options.fileCharset());
        assertEquals(4096, options.maxFileBytes());
    }

    @Test
    void testInvalidOverridesAreIgnored() {
        var unknown = ParserOptions.fromProperties("no-such-charset", "lots");
        assertEquals(StandardCharsets.UTF_8, unknown.fileCharset());
        assertEquals(ParserOptions.DEFAULT_MAX_FILE_BYTES, unknown.maxFileBytes());

        var illegal = ParserOptions.fromProperties("bad name!", "-5");
        assertEquals(StandardCharsets.UTF_8, illegal.fileCharset());
        assertEquals(ParserOptions.DEFAULT_MAX_FILE_BYTES, illegal.maxFileBytes());

        assertEquals(ParserOptions.DEFAULT_MAX_FILE_BYTES, ParserOptions.fromProperties(null, "0").maxFileBytes());
    }

    @Test
    void testRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ParserOptions(StandardCharsets.UTF_8, 0));
    }
}
