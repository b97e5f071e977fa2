package org.pragmatica.markup.transform.pass;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.tree.Dialect;

import static org.junit.jupiter.api.Assertions.*;

class NestedEmphasisPassTest {

    private final NestedEmphasisPass pass = new NestedEmphasisPass(PassConfig.DEFAULT);

    @Test
    void everyInnerLevel_isDemoted() {
        var document = parse(ParserConfig.DEFAULT, "\\emph{a \\emph{b \\emph{c}}}");

        assertEquals(2, pass.apply(document).fixes().size());
        assertEquals("\\emph{a {b {c}}}", Reconstructor.reconstruct(document));
    }

    @Test
    void siblingEmphasis_isNotNested() {
        var document = parse(ParserConfig.DEFAULT, "\\emph{a} \\emph{b} \\textbf{\\emph{c}}");

        assertFalse(pass.apply(document).changed());
    }

    @Test
    void unattachedArguments_areFollowed() {
        var config = ParserConfig.DEFAULT.withMacroSignatures(ParserConfig.DEFAULT.macroSignatures().without("emph"));
        var document = parse(config, "\\emph{\\emph{x}}");

        assertEquals(1, pass.apply(document).fixes().size());
        assertEquals("\\emph{{x}}", Reconstructor.reconstruct(document));
    }

    private static org.pragmatica.markup.tree.Document parse(ParserConfig config, String input) {
        return DocumentParser.forDialect(Dialect.MARKUP, config).parse(input).unwrap();
    }
}
