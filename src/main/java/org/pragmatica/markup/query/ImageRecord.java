package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

public record ImageRecord(String src, String alt, SourceSpan span) {}
