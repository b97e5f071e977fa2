package org.pragmatica.markup.validate;

import org.pragmatica.markup.error.Diagnostic.Severity;
import org.pragmatica.markup.tree.Node;

/**
 * Semantic defect found in an otherwise well-formed tree, such as a missing required field.
 */
public record ValidationIssue(Severity severity, String message, Node node) {

    public static ValidationIssue error(String message, Node node) {
        return new ValidationIssue(Severity.ERROR, message, node);
    }

    public static ValidationIssue warning(String message, Node node) {
        return new ValidationIssue(Severity.WARNING, message, node);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
