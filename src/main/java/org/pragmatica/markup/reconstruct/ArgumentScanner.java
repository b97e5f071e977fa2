package org.pragmatica.markup.reconstruct;

/**
 * Rescans the raw input for the true extent of a macro and its argument groups.
 *
 * <p>A rewritten macro's recorded span may not cover the arguments it consumed, so the
 * reconstructor asks for the end of the macro name plus every adjacent balanced
 * {@code {...}} or {@code [...]} group, until at least the recorded end is covered.
 */
final class ArgumentScanner {
    private ArgumentScanner() {}

    /**
     * End offset of the macro starting at {@code start}, never before {@code recordedEnd}
     * unless the input itself ends first. Returns {@code recordedEnd} for non-macro text.
     */
    static int macroEnd(String raw, int start, int recordedEnd) {
        if (start >= raw.length() || raw.charAt(start) != '\\') {
            return recordedEnd;
        }
        int pos = start + 1;
        if (pos < raw.length() && isLetter(raw.charAt(pos))) {
            while (pos < raw.length() && isLetter(raw.charAt(pos))) {
                pos++;
            }
            if (pos < raw.length() && raw.charAt(pos) == '*') {
                pos++;
            }
        } else {
            pos = Math.min(raw.length(), pos + 1);
        }

        while (pos < recordedEnd) {
            int next = skipArgumentSpace(raw, pos);
            if (next >= raw.length() || (raw.charAt(next) != '{' && raw.charAt(next) != '[')) {
                break;
            }
            pos = balancedEnd(raw, next);
        }
        return pos;
    }

    /**
     * Offset after the group opened at {@code open}, or the input length when it never closes.
     */
    static int balancedEnd(String raw, int open) {
        char opener = raw.charAt(open);
        char closer = opener == '{' ? '}' : ']';
        int depth = 0;
        for (int at = open; at < raw.length(); at++) {
            char c = raw.charAt(at);
            if (c == '\\') {
                at++;
                continue;
            }
            if (c == opener) {
                depth++;
            } else if (c == closer) {
                depth--;
                if (depth == 0) {
                    return at + 1;
                }
            }
        }
        return raw.length();
    }

    /**
     * Offset just past a block heading's marker run and following spaces.
     */
    static int headingPrefixEnd(String raw, int start, int end) {
        int pos = start;
        while (pos < end && raw.charAt(pos) == ' ') {
            pos++;
        }
        while (pos < end && raw.charAt(pos) == '#') {
            pos++;
        }
        while (pos < end && (raw.charAt(pos) == ' ' || raw.charAt(pos) == '\t')) {
            pos++;
        }
        return pos;
    }

    /**
     * Offset where a block heading's trailing whitespace and closing {@code #} run begin.
     */
    static int headingSuffixStart(String raw, int start, int end) {
        int pos = skipBackBlank(raw, start, end);
        int hashes = pos;
        while (hashes > start && raw.charAt(hashes - 1) == '#') {
            hashes--;
        }
        if (hashes < pos && hashes > start && isBlank(raw.charAt(hashes - 1))) {
            pos = skipBackBlank(raw, start, hashes);
        }
        return pos;
    }

    private static int skipBackBlank(String raw, int start, int end) {
        int pos = end;
        while (pos > start && isBlank(raw.charAt(pos - 1))) {
            pos--;
        }
        return pos;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    private static int skipArgumentSpace(String raw, int from) {
        int pos = from;
        boolean newline = false;
        while (pos < raw.length()) {
            char c = raw.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '\n' && !newline) {
                newline = true;
                pos++;
            } else {
                break;
            }
        }
        return pos;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
