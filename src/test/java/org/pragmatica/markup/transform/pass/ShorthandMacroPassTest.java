package org.pragmatica.markup.transform.pass;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;

import static org.junit.jupiter.api.Assertions.*;

class ShorthandMacroPassTest {

    private final ShorthandMacroPass pass = new ShorthandMacroPass(PassConfig.DEFAULT);

    @Test
    void attachedShorthand_isRewritten() {
        assertEquals("x \\texttt{a_b} y", rewrite(ParserConfig.DEFAULT, "x \\passthrough{\\lstinline!a_b!} y"));
    }

    @Test
    void anyDelimiterAndStar_areAccepted() {
        assertEquals("\\texttt{f(x)}", rewrite(ParserConfig.DEFAULT, "\\passthrough{\\lstinline*|f(x)|}"));
        assertEquals("\\texttt{v}", rewrite(ParserConfig.DEFAULT, "\\passthrough{\\verb+v+}"));
    }

    @Test
    void shorthandWithoutBackslash_isRewritten() {
        assertEquals("\\texttt{code}", rewrite(ParserConfig.DEFAULT, "\\passthrough{lstinline!code!}"));
    }

    @Test
    void followingGroup_isAbsorbedWhenWrapperHasNoSignature() {
        var config = ParserConfig.DEFAULT.withMacroSignatures(ParserConfig.DEFAULT.macroSignatures().without("passthrough"));

        assertEquals("\\texttt{x} tail", rewrite(config, "\\passthrough{\\lstinline!x!} tail"));
    }

    @Test
    void plainArgument_isLeftAlone() {
        var input = "\\passthrough{plain text}";
        var document = DocumentParser.forDialect(Dialect.MARKUP).parse(input).unwrap();

        assertFalse(pass.apply(document).changed());
        assertFalse(document.isTouched());
    }

    @Test
    void rewrittenNode_remembersOriginalName() {
        var document = DocumentParser.forDialect(Dialect.MARKUP).parse("\\passthrough{\\lstinline!q!}").unwrap();

        pass.apply(document);

        var node = document.nodes().get(0);
        assertEquals("texttt", node.content());
        assertEquals("passthrough", node.get(Attribute.ORIGINAL_CONTENT).orElseThrow());
    }

    private String rewrite(ParserConfig config, String input) {
        var document = DocumentParser.forDialect(Dialect.MARKUP, config).parse(input).unwrap();
        assertEquals(1, pass.apply(document).fixes().size());
        return Reconstructor.reconstruct(document);
    }
}
