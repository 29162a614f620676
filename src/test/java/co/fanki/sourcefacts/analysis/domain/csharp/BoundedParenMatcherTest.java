package co.fanki.sourcefacts.analysis.domain.csharp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link BoundedParenMatcher}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class BoundedParenMatcherTest {

    private final BoundedParenMatcher matcher = new BoundedParenMatcher(
            HeuristicLimits.defaults());

    @Test
    void whenClosingDeclaration_givenNestedParams_shouldReturnCloseIndex() {
        final String text = "Run(Func<int> f = (x) => (x))";

        assertEquals(text.length() - 1, matcher.closeDeclaration(text, 4));
    }

    @Test
    void whenClosingDeclaration_givenDepthAboveCap_shouldGiveUp() {
        final String text = "F" + "(".repeat(7) + ")".repeat(7);

        assertEquals(-1, matcher.closeDeclaration(text, 2));
    }

    @Test
    void whenClosingDeclaration_givenCloseOutsideWindow_shouldGiveUp() {
        final String text = "F(" + "a".repeat(250) + ")";

        assertEquals(-1, matcher.closeDeclaration(text, 2));
    }

    @Test
    void whenClosingCall_givenUnbalancedText_shouldGiveUp() {
        assertEquals(-1, matcher.closeCall("Go((((", 2));
    }

    @Test
    void whenClosingCall_givenDeepButBalancedArguments_shouldFindClose() {
        final String text = "Go" + "(".repeat(50) + ")".repeat(50) + ";";

        assertEquals(text.length() - 2, matcher.closeCall(text, 2));
    }

    @Test
    void whenLookingAround_shouldSkipWhitespace() {
        assertEquals(4, BoundedParenMatcher.skipWhitespace("a \n b", 1));
        assertEquals('[', BoundedParenMatcher.previousNonWhitespace("[  Obsolete", 3));
    }

}
