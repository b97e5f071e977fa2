package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

/**
 * A fenced or indented code block. {@code language} is empty when the fence names none.
 */
public record CodeBlockRecord(String language, String content, SourceSpan span) {}
