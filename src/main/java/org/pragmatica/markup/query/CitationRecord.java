package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.List;

/**
 * A citation found in a document.
 *
 * @param command macro name for markup ({@code cite}, {@code citep}), {@code citation} for block markup
 * @param keys    cited keys in source order
 * @param rawText source text of the citation
 * @param span    where it occurs
 */
public record CitationRecord(String command, List<String> keys, String rawText, SourceSpan span) {
    public CitationRecord {
        keys = List.copyOf(keys);
    }
}
