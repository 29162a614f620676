package co.fanki.sourcefacts.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link CategorySerializer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CategorySerializerTest {

    @Test
    void whenRenderingDataFlow_givenTwoCategories_shouldUseDeclarationOrder() {
        final DataFlowFacts facts = DataFlowFacts.builder()
                .storageOp("open")
                .globalWritten("y")
                .globalWritten("x")
                .globalWritten("x")
                .build();

        assertEquals("Globals{write=[x, y]} | Storage{open}",
                CategorySerializer.render(facts));
    }

    @Test
    void whenRenderingDataFlow_givenLabeledAndUnlabeledItems_shouldSortThemTogether() {
        final DataFlowFacts facts = DataFlowFacts.builder()
                .add(FactCategory.CSS, "rules=2")
                .add(FactCategory.CSS, "imports", "b.css")
                .add(FactCategory.CSS, "imports", "a.css")
                .build();

        assertEquals("CSS{imports=[a.css, b.css]; rules=2}",
                CategorySerializer.render(facts));
    }

    @Test
    void whenRenderingDataFlow_givenNoFacts_shouldReturnEmptyString() {
        assertEquals("", CategorySerializer.render(DataFlowFacts.empty()));
    }

    @Test
    void whenRenderingIo_givenOnlyOutputs_shouldOmitInputs() {
        final IoFacts io = IoFacts.of(List.of(), List.of("LOG:print", "FILE:open()"));

        assertEquals("Outputs{FILE:open(); LOG:print}", CategorySerializer.render(io));
    }

    @Test
    void whenRenderingSideEffects_givenAnalyzedAndEmpty_shouldReturnPure() {
        assertEquals("PURE", CategorySerializer.render(SideEffectTags.of(List.of())));
    }

    @Test
    void whenRenderingSideEffects_givenNotAnalyzed_shouldReturnEmptyString() {
        assertEquals("", CategorySerializer.render(SideEffectTags.notAnalyzed()));
    }

    @Test
    void whenRenderingSideEffects_givenOneFileWrite_shouldWrapIt() {
        assertEquals("SideEffects{FILE:write}",
                CategorySerializer.render(SideEffectTags.of(List.of("FILE:write"))));
    }

    @Test
    void whenRenderingSideEffects_givenDuplicates_shouldDeduplicateAndSort() {
        assertEquals("SideEffects{FILE:write; LOG:print}", CategorySerializer.render(
                SideEffectTags.of(List.of("LOG:print", "FILE:write", "LOG:print"))));
    }

    @Test
    void whenRenderingSequence_givenRepeatedCalls_shouldKeepOrderAndDuplicates() {
        assertEquals("b -> a -> b",
                CategorySerializer.renderSequence(List.of("b", "a", "b")));
    }

}
