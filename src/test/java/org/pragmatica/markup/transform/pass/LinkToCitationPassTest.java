package org.pragmatica.markup.transform.pass;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.transform.PassConfig;
import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Dialect;
import org.pragmatica.markup.tree.NodeKind;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LinkToCitationPassTest {

    private final LinkToCitationPass pass = new LinkToCitationPass(PassConfig.DEFAULT);

    @ParameterizedTest
    @CsvSource({
        "https://doi.org/10.1/x, true",
        "https://www.nature.com/articles/1, true",
        "http://pubmed.ncbi.nlm.nih.gov/1, true",
        "https://user@arxiv.org:443/abs/1, true",
        "https://notdoi.org/x, false",
        "https://example.com/doi.org, false",
        "not a url, false"
    })
    void academicHosts_areRecognized(String url, boolean academic) {
        assertEquals(academic, pass.isAcademic(url));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Smith 2020|Smith2020",
        "(Smith, 2020)|Smith2020",
        "see Jones et al. 1999|Jones1999",
        "2020 results|unknown",
        "NASA 2020|unknown"
    })
    void citationKey_joinsAuthorAndYear(String text, String key) {
        assertEquals(key, LinkToCitationPass.citationKey(text));
    }

    @Test
    void year_mustBeInRange() {
        assertEquals(Optional.empty(), LinkToCitationPass.year("Darwin 1859"));
        assertEquals(Optional.of("1900"), LinkToCitationPass.year("Planck 1900"));
    }

    @Test
    void academicLinkWithYear_becomesCitation() {
        var document = DocumentParser.forDialect(Dialect.MARKUP).parse("See \\href{https://arxiv.org/abs/1}{Lee 2011}.").unwrap();

        var fixes = pass.apply(document).fixes();

        assertEquals(1, fixes.size());
        var citation = document.nodes().get(1);
        assertEquals(NodeKind.CITATION, citation.kind());
        assertEquals(List.of("Lee2011"), citation.get(Attribute.CITATION_KEYS).orElseThrow());
        assertEquals("See \\citep{Lee2011}.", Reconstructor.reconstruct(document));
    }

    @Test
    void otherLinks_areKept() {
        var document = DocumentParser.forDialect(Dialect.MARKUP)
                                     .parse("\\href{https://example.com}{Lee 2011} \\href{https://doi.org/1}{no year}")
                                     .unwrap();

        assertFalse(pass.apply(document).changed());
    }
}
