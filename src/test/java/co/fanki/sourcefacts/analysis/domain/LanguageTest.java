package co.fanki.sourcefacts.analysis.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Language}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LanguageTest {

    @Test
    void whenResolvingTag_givenExtensionsAndNames_shouldRoute() {
        assertEquals(Language.ECMASCRIPT, Language.fromTag(".mjs"));
        assertEquals(Language.ECMASCRIPT, Language.fromTag("JavaScript"));
        assertEquals(Language.CSHARP, Language.fromTag("cs"));
        assertEquals(Language.PYTHON, Language.fromTag("python"));
        assertEquals(Language.HTML, Language.fromTag("htm"));
    }

    @Test
    void whenResolvingTag_givenUnknownOrBlank_shouldReturnUnsupported() {
        assertEquals(Language.UNSUPPORTED, Language.fromTag("rb"));
        assertEquals(Language.UNSUPPORTED, Language.fromTag(" "));
        assertEquals(Language.UNSUPPORTED, Language.fromTag(null));
    }

    @Test
    void whenResolvingPath_givenExtension_shouldUseIt() {
        assertEquals(Language.CSS, Language.fromPath("web/site.v2/main.CSS"));
        assertEquals(Language.UNSUPPORTED, Language.fromPath("dir.d/Makefile"));
        assertEquals(Language.UNSUPPORTED, Language.fromPath(".bashrc"));
    }

    @Test
    void whenCheckingMarkup_shouldOnlyFlagReferenceLanguages() {
        assertTrue(Language.JSON.isMarkup());
        assertTrue(Language.CSS.isMarkup());
        assertFalse(Language.PYTHON.isMarkup());
    }

    @Test
    void whenResolvingUnitLanguage_givenBlankTag_shouldFallBackToExtension() {
        assertEquals(Language.PYTHON, SourceUnit.of("a/b.py", "").language());
        assertEquals(Language.CSHARP,
                new SourceUnit("a/b.txt", "csharp", "").language());
    }

}
