package io.github.simbo1905.phrase.grammar;

import java.util.Objects;

/// A single word or syntax character from grammar source text.
/// @param text the raw token text, never empty once produced by the tokenizer
/// @param source location tag (`name:line`) used only for diagnostics
record GrammarToken(String text, String source) {
    GrammarToken {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
