package io.github.simbo1905.phrase.grammar;

import java.util.Objects;
import java.util.regex.Pattern;

/// The content of one `{...}` marker in a Text node, classified in precedence order:
/// `{\n}`, then a numeric range `{low-high}`, then an identifier reference (`*` prefix for exclusive).
sealed interface Substitution {

    /// Bounds are limited to 18 digits so the inclusive span always fits in a long
    Pattern RANGE = Pattern.compile("([+-]?\\d{1,18})-([+-]?\\d{1,18})");

    String NEWLINE_ESCAPE = "\\n";

    String EXCLUSIVE_PREFIX = "*";

    /// `{\n}`
    record Newline() implements Substitution {}

    /// `{low-high}`; bounds given in reverse order are swapped on construction.
    record NumericRange(long low, long high) implements Substitution {
        public NumericRange {
            if (low > high) {
                final long swap = low;
                low = high;
                high = swap;
            }
        }
    }

    /// `{name}` or `{*name}`
    record Reference(String identifier, boolean exclusive) implements Substitution {
        public Reference {
            Objects.requireNonNull(identifier, "identifier must not be null");
        }

        /// The form accepted by `PhraseGenerator.generate`, prefix included.
        String request() {
            return exclusive ? EXCLUSIVE_PREFIX + identifier : identifier;
        }
    }

    /// Content the parser could not reject but that names nothing, e.g. `{}` or `{*}`.
    record Malformed(String content) implements Substitution {}

    /// Classifies marker content (the text between the braces).
    static Substitution parse(String content) {
        Objects.requireNonNull(content, "content must not be null");
        if (NEWLINE_ESCAPE.equals(content)) {
            return new Newline();
        }
        final var range = RANGE.matcher(content);
        if (range.matches()) {
            return new NumericRange(Long.parseLong(range.group(1)), Long.parseLong(range.group(2)));
        }
        if (content.isEmpty() || EXCLUSIVE_PREFIX.equals(content)) {
            return new Malformed(content);
        }
        if (content.startsWith(EXCLUSIVE_PREFIX)) {
            return new Reference(content.substring(1), true);
        }
        return new Reference(content, false);
    }
}
