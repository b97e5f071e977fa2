package org.pragmatica.markup.fallback;

import java.util.List;

/**
 * Per-document result of {@link FallbackController#process}.
 *
 * @param status   how the text was produced
 * @param text     output text; the input itself when nothing could be done
 * @param fixes    descriptions of the fixes applied, in order
 * @param warnings non-fatal problems met along the way
 * @param message  human-readable summary, such as the parse error that forced degraded mode
 */
public record ProcessingOutcome(Status status, String text, List<String> fixes, List<String> warnings, String message) {
    public enum Status {
        /**
         * Parsed, rewritten on the tree and reconstructed.
         */
        SUCCESS,
        /**
         * Parsing failed; textual cleanup was used instead.
         */
        DEGRADED,
        /**
         * Neither path produced output; {@code text} is the unchanged input.
         */
        FAILED
    }

    public ProcessingOutcome {
        fixes = List.copyOf(fixes);
        warnings = List.copyOf(warnings);
    }

    public static ProcessingOutcome success(String text, List<String> fixes, List<String> warnings) {
        return new ProcessingOutcome(Status.SUCCESS, text, fixes, warnings, "Applied " + fixes.size() + " fixes");
    }

    public static ProcessingOutcome degraded(String text, List<String> fixes, List<String> warnings, String message) {
        return new ProcessingOutcome(Status.DEGRADED, text, fixes, warnings, message);
    }

    public static ProcessingOutcome failed(String input, String message) {
        return new ProcessingOutcome(Status.FAILED, input, List.of(), List.of(), message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean changed(String input) {
        return !text.equals(input);
    }
}
