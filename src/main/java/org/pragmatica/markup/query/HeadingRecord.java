package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

/**
 * A heading or sectioning command.
 *
 * @param type  sectioning macro name, or {@code heading} for block markup
 * @param level nesting level; block headings use their marker count, sectioning macros
 *              follow the usual numbering ({@code part} -1, {@code chapter} 0, {@code section} 1, ...)
 * @param text  heading text with markup removed
 * @param span  where it occurs
 */
public record HeadingRecord(String type, int level, String text, SourceSpan span) {}
