package org.pragmatica.markup.transform.pass;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.markup.parser.DocumentParser;
import org.pragmatica.markup.reconstruct.Reconstructor;
import org.pragmatica.markup.tree.Dialect;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeadingCleanupPassTest {

    private final HeadingCleanupPass pass = new HeadingCleanupPass();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "## **1. Introduction**|## Introduction",
        "##   1.  Introduction|##   Introduction",
        "# 3\\.2\\.1 Methods|# Methods",
        "### 2.1 Setup ###|### Setup ###",
        "## **Summary**|## Summary"
    })
    void headings_areCleaned(String input, String expected) {
        var document = DocumentParser.forDialect(Dialect.BLOCK_MARKUP).parse(input).unwrap();

        assertEquals(1, pass.apply(document).fixes().size());
        assertEquals(expected, Reconstructor.reconstruct(document));
    }

    @Test
    void numberOnlyHeading_keepsMarker() {
        var document = DocumentParser.forDialect(Dialect.BLOCK_MARKUP).parse("## 1.").unwrap();

        pass.apply(document);

        assertEquals("## ", Reconstructor.reconstruct(document));
    }

    @Test
    void cleanHeadingsAndBody_areUntouched() {
        var input = "# Plain title\n\n1. a list item\n\n**1. not a heading**\n";
        var document = DocumentParser.forDialect(Dialect.BLOCK_MARKUP).parse(input).unwrap();

        assertFalse(pass.apply(document).changed());
        assertEquals(input, Reconstructor.reconstruct(document));
    }

    @Test
    void fixDescription_namesCleanedText() {
        var document = DocumentParser.forDialect(Dialect.BLOCK_MARKUP).parse("# 4. Results and *Discussion*").unwrap();

        var fixes = pass.apply(document).fixes();

        assertEquals(List.of("Cleaned heading: Results and Discussion"),
                     fixes.stream().map(fix -> fix.description()).toList());
    }

    @Test
    void stripSectionNumber_leavesUnnumberedText() {
        assertEquals("Intro", HeadingCleanupPass.stripSectionNumber("1.2. Intro"));
        assertEquals("Intro 1", HeadingCleanupPass.stripSectionNumber("Intro 1"));
    }
}
