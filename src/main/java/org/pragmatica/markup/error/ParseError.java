package org.pragmatica.markup.error;

import org.pragmatica.markup.tree.SourceLocation;

/**
 * Unrecoverable syntax problem with the offset of the offending opener or closer.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    default int offset() {
        return location().offset();
    }

    /**
     * Short machine-friendly code used in diagnostics.
     */
    String code();

    /**
     * What to do about it, empty when there is no obvious fix.
     */
    default String suggestion() {
        return "";
    }

    /**
     * Label placed under the offending position.
     */
    default String label() {
        return "";
    }

    /**
     * A {@code {} or {@code [} that is never closed.
     */
    record UnclosedGroup(SourceLocation location, char opener) implements ParseError {
        @Override
        public String message() {
            return "Unclosed '" + opener + "' at " + location + ", expected '" + (opener == '[' ? ']' : '}') + "'";
        }

        @Override
        public String code() {
            return "E001";
        }

        @Override
        public String suggestion() {
            return "add the missing '" + (opener == '[' ? ']' : '}') + "'";
        }

        @Override
        public String label() {
            return "opened here";
        }
    }

    /**
     * A closing delimiter without a matching opener.
     */
    record UnexpectedCloser(SourceLocation location, char closer) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + closer + "' at " + location + " without matching opener";
        }

        @Override
        public String code() {
            return "E002";
        }

        @Override
        public String suggestion() {
            return "remove the stray '" + closer + "'";
        }
    }

    /**
     * Math span opened but never closed.
     */
    record UnterminatedMath(SourceLocation location, String delimiter) implements ParseError {
        @Override
        public String message() {
            return "Unterminated math span opened with '" + delimiter + "' at " + location;
        }

        @Override
        public String code() {
            return "E003";
        }

        @Override
        public String suggestion() {
            return "close the math span with the matching '" + delimiter + "'";
        }

        @Override
        public String label() {
            return "opened here";
        }
    }

    /**
     * {@code \begin{name}} without {@code \end{name}}.
     */
    record UnterminatedEnvironment(SourceLocation location, String name) implements ParseError {
        @Override
        public String message() {
            return "Environment '" + name + "' opened at " + location + " is never closed";
        }

        @Override
        public String code() {
            return "E004";
        }

        @Override
        public String suggestion() {
            return "add \\end{" + name + "}";
        }

        @Override
        public String label() {
            return "opened here";
        }
    }

    /**
     * {@code \end{other}} closing a different environment, or with no environment open.
     */
    record MismatchedEnvironment(SourceLocation location, String expected, String found) implements ParseError {
        @Override
        public String message() {
            return expected.isEmpty()
                   ? "Unexpected \\end{" + found + "} at " + location + " with no open environment"
                   : "Mismatched \\end{" + found + "} at " + location + ", expected \\end{" + expected + "}";
        }

        @Override
        public String code() {
            return "E005";
        }

        @Override
        public String label() {
            return expected.isEmpty() ? "" : "expected \\end{" + expected + "}";
        }
    }

    /**
     * Inline verbatim shorthand whose closing delimiter is missing.
     */
    record UnterminatedVerbatim(SourceLocation location, String macro, char delimiter) implements ParseError {
        @Override
        public String message() {
            return "Unterminated \\" + macro + " at " + location + ", expected closing '" + delimiter + "'";
        }

        @Override
        public String code() {
            return "E006";
        }

        @Override
        public String suggestion() {
            return "close the verbatim text with '" + delimiter + "'";
        }
    }

    /**
     * Bibliographic record whose body is never closed.
     */
    record UnterminatedEntry(SourceLocation location, String entryType) implements ParseError {
        @Override
        public String message() {
            return "Unterminated @" + entryType + " record at " + location;
        }

        @Override
        public String code() {
            return "E007";
        }

        @Override
        public String label() {
            return "record starts here";
        }
    }

    /**
     * Bibliographic record with unexpected content where a field was expected.
     */
    record MalformedEntry(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }

        @Override
        public String code() {
            return "E008";
        }
    }
}
