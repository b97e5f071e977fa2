package org.pragmatica.markup.query;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A bibliographic entry with its fields in source order.
 */
public record EntryRecord(String key, String type, Map<String, String> fields, SourceSpan span) {
    public EntryRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
