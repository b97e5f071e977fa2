package org.pragmatica.markup.transform.pass;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.NodeKind;

import static org.junit.jupiter.api.Assertions.*;

class EmptyCaptionPassTest {

    private final EmptyCaptionPass pass = new EmptyCaptionPass(PassConfig.DEFAULT);

    @Test
    void whitespaceCaption_becomesComment() {
        var document = parse("\\caption{  }\nnext");

        assertTrue(pass.apply(document).changed());
        var comment = document.nodes().get(0);
        assertEquals(NodeKind.COMMENT, comment.kind());
        assertEquals("caption", comment.get(Attribute.ORIGINAL_CONTENT).orElseThrow());
        assertEquals("% Empty caption removed\nnext", Reconstructor.reconstruct(document));
    }

    @Test
    void emptyOptionalAndMandatory_becomeComment() {
        var document = parse("a \\caption[]{} b");

        pass.apply(document);

        assertEquals("a % Empty caption removed\n b", Reconstructor.reconstruct(document));
    }

    @Test
    void captionWithText_isKept() {
        var document = parse("\\caption[short]{ }\\caption{Real}");

        assertFalse(pass.apply(document).changed());
    }

    @Test
    void bareCaption_becomesComment() {
        var document = parse("\\caption");

        pass.apply(document);

        assertEquals("% Empty caption removed", Reconstructor.reconstruct(document));
    }

    private static Document parse(String input) {
        return DocumentParser.forDialect(Dialect.MARKUP).parse(input).unwrap();
    }
}
