package io.github.simbo1905.phrase.grammar;

/// Display flags for `PhraseGrammar.format(FormatOption...)`.
public enum FormatOption {
    /// Append each node's source location (`name:line`) in a right-hand column
    DISPLAY_SOURCE,
    /// Show groups by their unique label (`[23`) instead of a bare `[`
    DISPLAY_GROUP_NUMBERS
}
