package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

public record LinkRecord(String text, String href, String title, SourceSpan span) {}
