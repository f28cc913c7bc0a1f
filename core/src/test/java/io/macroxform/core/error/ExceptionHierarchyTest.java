package io.macroxform.core.error;

import static io.macroxform.core.testkit.FormReader.read;
import static org.assertj.core.api.Assertions.assertThat;

import io.macroxform.core.form.Form;
import io.macroxform.core.form.Symbol;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the exception tiers: phases, locations, and URN constants. */
@DisplayName("ExceptionHierarchyTest")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("Load errors carry their source and the LOAD phase")
    void loadTier() {
        MacroLoadException e = new InvalidMacroDefinitionException("bad", "m", "lib.yaml");

        assertThat(e).isInstanceOf(MacroXformException.class);
        assertThat(e.phase()).isEqualTo(MacroXformException.Phase.LOAD);
        assertThat(e.source()).isEqualTo("lib.yaml");
        assertThat(e.form()).isNull();
        assertThat(e.location()).isNull();
    }

    @Test
    @DisplayName("Expansion errors carry the macro name and the call's location")
    void expansionTier() {
        Form call = read("(m 1 2)", "unit.clj");

        MacroExpansionException e = new ArityMismatchException("m", "[x]", 2, call);

        assertThat(e.phase()).isEqualTo(MacroXformException.Phase.EXPANSION);
        assertThat(e.macroName()).isEqualTo("m");
        assertThat(e.location().toString()).isEqualTo("unit.clj:1:1");
        assertThat(e.detail()).isEqualTo(e.getMessage()).contains("Wrong number of args (2)", "(m 1 2)");
    }

    @Test
    @DisplayName("Evaluation errors use the EVALUATION phase")
    void evaluationTier() {
        UnboundSymbolException e = new UnboundSymbolException("zzz", Symbol.of("zzz"));

        assertThat(e).isInstanceOf(FormEvalException.class);
        assertThat(e.phase()).isEqualTo(MacroXformException.Phase.EVALUATION);
        assertThat(e.symbol()).isEqualTo("zzz");
        assertThat(e.location()).isNull();
    }

    @Test
    @DisplayName("Macro used as value message")
    void macroUsedAsValueMessage() {
        assertThat(new MacroUsedAsValueException("when", Symbol.of("when")).getMessage())
                .startsWith("Can't take value of a macro: 'when'");
    }

    @Test
    @DisplayName("URNs are unique and namespaced")
    void urns() {
        List<String> urns = List.of(
                MacroLibraryParseException.URN,
                InvalidMacroDefinitionException.URN,
                ConfigLoadException.URN,
                UnknownMacroException.URN,
                ArityMismatchException.URN,
                IllegalSpliceException.URN,
                IllegalUnquoteException.URN,
                ExpansionDepthExceededException.URN,
                MacroUsedAsValueException.URN,
                TransformerFailedException.URN,
                UnboundSymbolException.URN,
                EvaluationException.URN);

        assertThat(urns).doesNotHaveDuplicates().allSatisfy(urn -> assertThat(urn).startsWith("urn:macro-xform:error:"));
    }
}
