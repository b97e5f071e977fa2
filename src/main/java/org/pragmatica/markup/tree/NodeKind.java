package org.pragmatica.markup.tree;

/**
 * Syntactic category of a node. Each {@link Dialect} permits a closed subset.
 */
public enum NodeKind {
    TEXT("text"),
    MACRO("macro"),
    CITATION("citation"),
    ENVIRONMENT("environment"),
    MATH("math"),
    COMMENT("comment"),
    GROUP("group"),
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    LINK("link"),
    IMAGE("image"),
    CODE_INLINE("code_inline"),
    CODE_BLOCK("code_block"),
    EMPHASIS("emphasis"),
    STRONG("strong"),
    BLOCKQUOTE("blockquote"),
    LIST("list"),
    LIST_ITEM("list_item"),
    TABLE("table"),
    TABLE_ROW("table_row"),
    TABLE_CELL("table_cell"),
    THEMATIC_BREAK("thematic_break"),
    HTML("html"),
    ENTRY("entry"),
    FIELD("field"),
    STRING_DEFINITION("string"),
    PREAMBLE("preamble"),
    ERROR("error");

    private final String display;

    NodeKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
