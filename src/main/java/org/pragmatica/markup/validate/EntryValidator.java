package org.pragmatica.markup.validate;

import org.pragmatica.markup.tree.Attribute;
import org.pragmatica.markup.tree.Document;
import org.pragmatica.markup.tree.Metadata;
import org.pragmatica.markup.tree.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Field-completeness checks over parsed bibliographic records. Kept apart from the parser
 * so that parsing stays total.
 */
public final class EntryValidator {
    private static final List<String> DEFAULT_REQUIRED = List.of("author", "title", "year");
    private static final Map<String, List<String>> REQUIRED = Map.of(
        "article", List.of("author", "title", "journal", "year"),
        "book", List.of("author", "title", "publisher", "year"),
        "inproceedings", List.of("author", "title", "booktitle", "year"),
        "incollection", List.of("author", "title", "booktitle", "year"),
        "phdthesis", List.of("author", "title", "school", "year"),
        "mastersthesis", List.of("author", "title", "school", "year"),
        "techreport", List.of("author", "title", "institution", "year"),
        "unpublished", List.of("author", "title", "note"));

    private EntryValidator() {}

    /**
     * Fields an entry of the given type must carry.
     */
    public static List<String> requiredFields(String entryType) {
        return REQUIRED.getOrDefault(entryType.toLowerCase(Locale.ROOT), DEFAULT_REQUIRED);
    }

    public static List<ValidationIssue> validate(Document document) {
        var issues = new ArrayList<ValidationIssue>();
        var seen = new HashSet<String>();

        if (document.metadata().flag(Metadata.HAS_EMPTY_IDS)) {
            issues.add(ValidationIssue.error("Found " + document.metadata().count(Metadata.EMPTY_ID_COUNT)
                                             + " entries with empty ID", null));
        }

        for (var node : document.nodes()) {
            if (!node.is(NodeKind.ENTRY)) {
                continue;
            }
            var key = node.getOrDefault(Attribute.ENTRY_KEY, "");
            var fields = node.getOrDefault(Attribute.FIELDS, Map.of());

            if (key.isBlank()) {
                issues.add(ValidationIssue.error("Entry at line " + node.line() + " has empty ID", node));
            }
            for (var field : requiredFields(node.getOrDefault(Attribute.ENTRY_TYPE, ""))) {
                if (!fields.containsKey(field)) {
                    issues.add(ValidationIssue.warning("Entry '" + key + "' missing required field: " + field, node));
                }
            }
            if (!key.isBlank() && !seen.add(key)) {
                issues.add(ValidationIssue.error("Duplicate entry ID: " + key, node));
            }
        }
        return issues;
    }
}
