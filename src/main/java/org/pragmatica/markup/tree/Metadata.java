package org.pragmatica.markup.tree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Document-wide facts collected by the parser ("contains math", entry counts, ...).
 */
public final class Metadata {
    public static final String TOTAL_LENGTH = "total_length";
    public static final String NUM_NODES = "num_nodes";
    public static final String HAS_MATH = "has_math";
    public static final String HAS_CITATIONS = "has_citations";
    public static final String HAS_ENVIRONMENTS = "has_environments";
    public static final String NUM_BLOCKS = "num_blocks";
    public static final String HAS_HEADINGS = "has_headings";
    public static final String HAS_LINKS = "has_links";
    public static final String HAS_IMAGES = "has_images";
    public static final String HAS_CODE = "has_code";
    public static final String NUM_ENTRIES = "num_entries";
    public static final String NUM_COMMENTS = "num_comments";
    public static final String NUM_STRINGS = "num_strings";
    public static final String ENTRY_TYPES = "entry_types";
    public static final String HAS_EMPTY_IDS = "has_empty_ids";
    public static final String EMPTY_ID_COUNT = "empty_id_count";

    private final Map<String, Object> values = new LinkedHashMap<>();

    public Metadata put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean flag(String key) {
        return values.get(key) instanceof Boolean bool && bool;
    }

    public int count(String key) {
        return values.get(key) instanceof Integer number ? number : 0;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
