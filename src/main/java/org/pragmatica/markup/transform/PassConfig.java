package org.pragmatica.markup.transform;

import java.util.List;
import java.util.Set;

/**
 * Vocabulary the passes match against.
 *
 * @param academicDomains     hosts whose links are promoted to citations
 * @param emphasisMacros      macros treated as emphasis when flattening
 * @param captionMacros       macros checked for empty arguments
 * @param linkMacros          link macros taking {@code {url}{text}}
 * @param shorthandWrappers   macros wrapping an inline-verbatim shorthand
 * @param verbatimShorthands  inline-verbatim macros ({@code \lstinline!x!})
 * @param typewriterMacro     canonical macro shorthand code is rewritten to
 * @param citationMacro       macro used for promoted citations
 * @param collapseBlankLines  squeeze runs of blank lines after reconstruction
 */
public record PassConfig(
    Set<String> academicDomains,
    Set<String> emphasisMacros,
    Set<String> captionMacros,
    Set<String> linkMacros,
    Set<String> shorthandWrappers,
    Set<String> verbatimShorthands,
    String typewriterMacro,
    String citationMacro,
    boolean collapseBlankLines
) {
    public static final List<String> ACADEMIC_DOMAINS = List.of(
        "doi.org", "arxiv.org", "sciencedirect.com", "springer.com", "wiley.com", "nature.com",
        "science.org", "plos.org", "ieee.org", "acm.org", "jstor.org", "pubmed", "ncbi.nlm.nih.gov",
        "researchgate.net", "academia.edu", "scholar.google", "ssrn.com", "elsevier.com",
        "tandfonline.com", "sagepub.com", "oup.com", "cambridge.org");

    public static final PassConfig DEFAULT = new PassConfig(
        Set.copyOf(ACADEMIC_DOMAINS),
        Set.of("emph"),
        Set.of("caption"),
        Set.of("href"),
        Set.of("passthrough"),
        Set.of("lstinline", "verb"),
        "texttt",
        "citep",
        true
    );

    public PassConfig {
        academicDomains = Set.copyOf(academicDomains);
        emphasisMacros = Set.copyOf(emphasisMacros);
        captionMacros = Set.copyOf(captionMacros);
        linkMacros = Set.copyOf(linkMacros);
        shorthandWrappers = Set.copyOf(shorthandWrappers);
        verbatimShorthands = Set.copyOf(verbatimShorthands);
    }

    public PassConfig withCollapseBlankLines(boolean collapse) {
        return new PassConfig(academicDomains, emphasisMacros, captionMacros, linkMacros, shorthandWrappers,
                              verbatimShorthands, typewriterMacro, citationMacro, collapse);
    }

    public PassConfig withAcademicDomains(Set<String> domains) {
        return new PassConfig(domains, emphasisMacros, captionMacros, linkMacros, shorthandWrappers,
                              verbatimShorthands, typewriterMacro, citationMacro, collapseBlankLines);
    }
}
