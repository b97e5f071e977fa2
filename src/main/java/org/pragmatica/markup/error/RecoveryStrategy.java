package org.pragmatica.markup.error;

/**
 * Error recovery strategy configuration.
 */
public enum RecoveryStrategy {
    /**
     * Report the first syntax error as a parse failure.
     */
    FAIL_FAST,

    /**
     * Keep the best-effort partial tree and report errors as diagnostics.
     */
    PARTIAL_TREE
}
