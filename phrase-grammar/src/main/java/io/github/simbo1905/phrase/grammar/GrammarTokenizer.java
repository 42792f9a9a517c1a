package io.github.simbo1905.phrase.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits grammar source text into tokens.
///
/// Syntax characters `[ ] | //` become standalone tokens, `{` is glued to the following word and `}` to
/// the preceding one, so `{weekday}` stays a single token. Anything after `//` on a line is a comment.
/// No meaning is assigned here; malformed markers are left for the parser to reject.
final class GrammarTokenizer {

    private static final Logger LOG = Logger.getLogger(GrammarTokenizer.class.getName());

    static final String COMMENT = "//";

    private GrammarTokenizer() {}

    /// Tokenizes one source, tagging each token with `name:line` (1-based).
    static List<GrammarToken> tokenize(String text, String name) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(name, "name must not be null");

        final var tokens = new ArrayList<GrammarToken>();
        final String[] lines = text.split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            final String source = name + ":" + (i + 1);
            tokenizeLine(lines[i], source, tokens);
        }

        LOG.finer(() -> "Tokenized " + tokens.size() + " tokens from '" + name + "'");
        return tokens;
    }

    private static void tokenizeLine(String line, String source, List<GrammarToken> tokens) {
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        line = line.replace("\t", "").strip();

        line = line.replace(COMMENT, " " + COMMENT + " ")
            .replace("[", " [ ")
            .replace("]", " ] ")
            .replace("|", " | ")
            .replace("{", " {")
            .replace("}", "} ");

        for (final String word : line.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (COMMENT.equals(word)) {
                return;
            }
            tokens.add(new GrammarToken(word, source));
        }
    }
}
