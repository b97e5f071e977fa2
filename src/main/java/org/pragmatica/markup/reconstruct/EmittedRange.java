package org.pragmatica.markup.reconstruct;

/**
 * A top-level range of the original input and how the reconstructor produced its text.
 */
public record EmittedRange(int start, int end, Origin origin) {

    public enum Origin {
        /**
         * Copied byte for byte.
         */
        VERBATIM,
        /**
         * Original frame kept, rewritten descendants spliced in.
         */
        REBUILT,
        /**
         * Generated from the node's kind, content and attributes.
         */
        SYNTHESIZED
    }

    public int length() {
        return end - start;
    }
}
