package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

public record LabelRecord(String label, SourceSpan span) {}
