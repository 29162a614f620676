package co.fanki.sourcefacts.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SourceSanitizer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceSanitizerTest {

    private final SourceSanitizer sanitizer = SourceSanitizer.withDefaults();

    @Test
    void whenStrippingPragmas_givenTargetDirective_shouldKeepLineCount() {
        final String source = "#target photoshop\nvar a = 1;\n  #INCLUDE \"x.jsx\"\nfoo();";

        final String stripped = sanitizer.stripPragmas(source);

        assertEquals("\nvar a = 1;\n\nfoo();", stripped);
    }

    @Test
    void whenStrippingPragmas_givenUnknownDirective_shouldLeaveIt() {
        assertEquals("#!/usr/bin/env node", sanitizer.stripPragmas("#!/usr/bin/env node"));
    }

    @Test
    void whenStrippingComments_givenLineAndBlockComments_shouldDropThem() {
        final String code = "int a; // trailing\n/* one\r\ntwo */int b;";

        assertEquals("int a; \n\r\nint b;", sanitizer.stripComments(code, false));
    }

    @Test
    void whenStrippingComments_givenCommentMarkerInString_shouldKeepString() {
        final String code = "var url = \"http://x\"; // c";

        assertEquals("var url = \"http://x\"; ", sanitizer.stripComments(code, false));
    }

    @Test
    void whenStrippingComments_givenRemoveStrings_shouldBlankContentsKeepingLength() {
        final String code = "Call(\"a(b\", 'c');";

        final String result = sanitizer.stripComments(code, true);

        assertEquals(code.length(), result.length());
        assertFalse(result.contains("a(b"));
        assertTrue(result.startsWith("Call("));
        assertTrue(result.endsWith(");"));
    }

    @Test
    void whenStrippingComments_givenVerbatimStringWithBackslash_shouldEndAtQuote() {
        final String code = "var p = @\"C:\\dir\\\"; Foo();";

        final String result = sanitizer.stripComments(code, true);

        assertTrue(result.endsWith("Foo();"));
        assertFalse(result.contains("dir"));
    }

    @Test
    void whenStrippingComments_givenEscapedQuote_shouldStayInsideString() {
        final String code = "s = \"say \\\"hi\\\" // no\"; x();";

        assertEquals(code, sanitizer.stripComments(code, false));
    }

    @Test
    void whenCreating_givenNoKeywords_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new SourceSanitizer(List.of()));
    }

}
