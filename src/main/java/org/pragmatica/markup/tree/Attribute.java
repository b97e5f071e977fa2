package org.pragmatica.markup.tree;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.pragmatica.markup.tree.NodeKind.*;

/**
 * Typed attribute key. Each key declares the node kinds it may be attached to.
 *
 * @param <T> value type
 */
public final class Attribute<T> {
    /**
     * Transformation marker: what the node was before a pass rewrote it.
     */
    public static final Attribute<String> ORIGINAL_CONTENT = of("original_content", String.class, EnumSet.allOf(NodeKind.class));

    // Markup
    public static final Attribute<List<String>> ARGUMENTS = strings("arguments", EnumSet.of(MACRO));
    public static final Attribute<String> VERBATIM = of("verbatim", String.class, EnumSet.of(MACRO));
    public static final Attribute<Boolean> STARRED = of("starred", Boolean.class, EnumSet.of(MACRO, CITATION));
    public static final Attribute<List<String>> CITATION_KEYS = strings("citation_keys", EnumSet.of(CITATION));
    public static final Attribute<Boolean> OPTIONAL = of("optional", Boolean.class, EnumSet.of(GROUP));
    public static final Attribute<String> ENVIRONMENT_NAME = of("environment_name", String.class, EnumSet.of(ENVIRONMENT));
    public static final Attribute<SourceSpan> BODY_SPAN = of("body_span", SourceSpan.class, EnumSet.of(ENVIRONMENT));
    public static final Attribute<Boolean> DISPLAY = of("display", Boolean.class, EnumSet.of(MATH));
    public static final Attribute<String> DELIMITER = of("delimiter", String.class,
                                                           EnumSet.of(MACRO, MATH, CODE_INLINE, CODE_BLOCK,
                                                                      EMPHASIS, STRONG));

    // Block markup
    public static final Attribute<Integer> LEVEL = of("level", Integer.class, EnumSet.of(HEADING));
    public static final Attribute<String> HREF = of("href", String.class, EnumSet.of(LINK));
    public static final Attribute<String> SRC = of("src", String.class, EnumSet.of(IMAGE));
    public static final Attribute<String> ALT = of("alt", String.class, EnumSet.of(IMAGE));
    public static final Attribute<String> TITLE = of("title", String.class, EnumSet.of(LINK, IMAGE));
    public static final Attribute<String> LANGUAGE = of("language", String.class, EnumSet.of(CODE_BLOCK));
    public static final Attribute<Boolean> LIST_ORDERED = of("ordered", Boolean.class, EnumSet.of(LIST));
    public static final Attribute<Integer> LIST_START = of("start", Integer.class, EnumSet.of(LIST));
    public static final Attribute<String> MARKER = of("marker", String.class, EnumSet.of(LIST_ITEM, BLOCKQUOTE));
    public static final Attribute<List<String>> TABLE_ALIGNMENTS = strings("alignments", EnumSet.of(TABLE));
    public static final Attribute<Boolean> HEADER = of("header", Boolean.class, EnumSet.of(TABLE_ROW));

    // Bib entries
    public static final Attribute<String> ENTRY_KEY = of("entry_key", String.class, EnumSet.of(ENTRY));
    public static final Attribute<String> ENTRY_TYPE = of("entry_type", String.class, EnumSet.of(ENTRY));
    public static final Attribute<Map<String, String>> FIELDS = stringMap("fields", EnumSet.of(ENTRY));
    public static final Attribute<String> FIELD_NAME = of("field_name", String.class, EnumSet.of(FIELD, STRING_DEFINITION));

    // Recovery
    public static final Attribute<String> EXPECTED = of("expected", String.class, EnumSet.of(ERROR));

    private final String name;
    private final Function<Object, T> reader;
    private final Set<NodeKind> kinds;

    private Attribute(String name, Function<Object, T> reader, Set<NodeKind> kinds) {
        this.name = name;
        this.reader = reader;
        this.kinds = kinds;
    }

    private static <T> Attribute<T> of(String name, Class<T> type, Set<NodeKind> kinds) {
        return new Attribute<>(name, type::cast, kinds);
    }

    private static Attribute<List<String>> strings(String name, Set<NodeKind> kinds) {
        return new Attribute<>(name, Attribute::copyStrings, kinds);
    }

    private static Attribute<Map<String, String>> stringMap(String name, Set<NodeKind> kinds) {
        return new Attribute<>(name, Attribute::copyStringMap, kinds);
    }

    private static List<String> copyStrings(Object value) {
        return ((List<?>) value).stream()
                                .map(String.class::cast)
                                .toList();
    }

    private static Map<String, String> copyStringMap(Object value) {
        var copy = new LinkedHashMap<String, String>();
        ((Map<?, ?>) value).forEach((key, entry) -> copy.put((String) key, (String) entry));
        return Collections.unmodifiableMap(copy);
    }

    public String name() {
        return name;
    }

    public boolean validFor(NodeKind kind) {
        return kinds.contains(kind);
    }

    /**
     * Typed view of a stored value.
     *
     * @throws IllegalArgumentException when the value is not of this key's type
     */
    T read(Object value) {
        try {
            return reader.apply(value);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("Attribute '" + name + "' cannot hold a "
                                               + value.getClass().getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
