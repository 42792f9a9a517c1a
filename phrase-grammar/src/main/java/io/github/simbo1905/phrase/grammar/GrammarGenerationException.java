package io.github.simbo1905.phrase.grammar;

import java.util.Objects;

/// Exception thrown when a phrase cannot be generated from a parsed grammar.
/// Failures inside nested `{reference}` expansions are rethrown with the reference appended to the
/// message; the reason of the innermost failure is kept and the original exception is the cause.
public final class GrammarGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Reason reason;
    private final String identifier;

    GrammarGenerationException(Reason reason, String identifier, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.identifier = identifier;
    }

    GrammarGenerationException(Reason reason, String identifier, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.identifier = identifier;
    }

    /// Returns what kind of failure occurred.
    public Reason reason() {
        return reason;
    }

    /// Returns the identifier being generated when the failure surfaced, or null if none applies.
    public String identifier() {
        return identifier;
    }

    public enum Reason {
        EMPTY_TREE,
        UNKNOWN_IDENTIFIER,
        MISSING_BODY,
        OPTIONS_EXHAUSTED,
        EXPANSION_TOO_DEEP
    }
}
