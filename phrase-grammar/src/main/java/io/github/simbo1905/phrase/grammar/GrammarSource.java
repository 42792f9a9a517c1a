package io.github.simbo1905.phrase.grammar;

import java.util.Objects;

/// Grammar text together with the name used in its location tags (typically a file name).
/// Each source is tokenized on its own and must be syntactically complete.
/// @param name label prefixed to line numbers in diagnostics, may be empty
/// @param text the grammar text
public record GrammarSource(String name, String text) {
    public GrammarSource {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /// An unnamed source, as used by `PhraseGrammar.parse(String)`.
    public static GrammarSource of(String text) {
        return new GrammarSource("", text);
    }
}
