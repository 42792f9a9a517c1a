package io.github.simbo1905.phrase.grammar;

import java.util.Objects;

/// Exception thrown when grammar source text is syntactically invalid.
/// This is a runtime exception as a broken grammar is an authoring error, not a recoverable condition.
public final class GrammarParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Reason reason;
    private final String source;
    private final String token;

    GrammarParseException(Reason reason, String message, String source, String token) {
        super(formatMessage(message, source));
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.source = source;
        this.token = token;
    }

    GrammarParseException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    /// Returns what kind of syntax error was found.
    public Reason reason() {
        return reason;
    }

    /// Returns the location tag (`name:line`) of the offending token, or null if there is none.
    public String source() {
        return source;
    }

    /// Returns the offending token text, or null if the error is not tied to one token.
    public String token() {
        return token;
    }

    private static String formatMessage(String message, String source) {
        if (source == null) {
            return message;
        }
        return message + " at " + source;
    }

    public enum Reason {
        EMPTY_INPUT,
        EMPTY_TOKEN,
        MISSING_IDENTIFIER,
        DUPLICATE_IDENTIFIER,
        INVALID_IDENTIFIER_CHARACTER,
        EXPECTED_GROUP,
        STRAY_ALTERNATION,
        STRAY_CLOSE,
        EMPTY_GROUP,
        UNTERMINATED_SUBSTITUTION,
        STRAY_SUBSTITUTION_CLOSE,
        UNTERMINATED_GROUP,
        NESTING_TOO_DEEP
    }
}
