package io.github.simbo1905.phrase.grammar;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Clean-up applied once to a fully composed phrase, in this order:
/// 1. `<<` forces concatenation, eating one adjacent space on each side
/// 2. spaces next to a newline are dropped
/// 3. `^` uppercases the following character and disappears
/// 4. the empty token `_` is removed and punctuation tightened
final class PhraseText {

    static final String CONCAT = "<<";

    static final char UPPERCASE = '^';

    private static final List<Map.Entry<String, String>> CONCATENATION = List.of(
        Map.entry(" " + CONCAT + " ", ""),
        Map.entry(" " + CONCAT, ""),
        Map.entry(CONCAT + " ", "")
    );

    private static final List<Map.Entry<String, String>> NEWLINES = List.of(
        Map.entry(" \n ", "\n"),
        Map.entry(" \n", "\n"),
        Map.entry("\n ", "\n")
    );

    /// The empty token goes first so tightening cannot take the space it is removed with
    private static final List<Map.Entry<String, String>> PUNCTUATION = List.of(
        Map.entry(" _ ", " "),
        Map.entry(" _", ""),
        Map.entry("_ ", ""),
        Map.entry(" )", ")"),
        Map.entry("( ", "("),
        Map.entry(" ,", ","),
        Map.entry(" .", "."),
        Map.entry(" ?", "?"),
        Map.entry(" !", "!"),
        Map.entry(" :", ":"),
        Map.entry(" ;", ";")
    );

    private PhraseText() {}

    static String normalize(String phrase) {
        Objects.requireNonNull(phrase, "phrase must not be null");
        String result = replaceAll(phrase, CONCATENATION);
        result = replaceAll(result, NEWLINES);
        result = uppercaseMarked(result);
        return replaceAll(result, PUNCTUATION);
    }

    /// Each `^` uppercases the next character; a space straight after `^` is skipped, so `^ here` gives
    /// `Here`. A trailing `^` is dropped along with the space that joined it.
    static String uppercaseMarked(String phrase) {
        final String flush = phrase.replace(UPPERCASE + " ", String.valueOf(UPPERCASE));
        if (flush.indexOf(UPPERCASE) < 0) {
            return flush;
        }
        final var sb = new StringBuilder(flush.length());
        int i = 0;
        while (i < flush.length()) {
            final int cp = flush.codePointAt(i);
            i += Character.charCount(cp);
            if (cp != UPPERCASE) {
                sb.appendCodePoint(cp);
                continue;
            }
            // Skip any run of markers; the character after them is uppercased once
            while (i < flush.length() && flush.charAt(i) == UPPERCASE) {
                i++;
            }
            if (i < flush.length()) {
                final int next = flush.codePointAt(i);
                i += Character.charCount(next);
                sb.appendCodePoint(Character.toUpperCase(next));
            } else if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
                sb.setLength(sb.length() - 1);
            }
        }
        return sb.toString();
    }

    private static String replaceAll(String s, List<Map.Entry<String, String>> table) {
        String result = s;
        for (final var entry : table) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }
}
