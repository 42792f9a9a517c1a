package io.github.simbo1905.phrase.grammar;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import static io.github.simbo1905.phrase.grammar.GrammarGenerationException.Reason.*;

/// Composes random phrases from a parsed tree.
///
/// A Group picks one branch starting at a random offset and scanning circularly. Text contributes its
/// inflated text followed by its children's output, joined by single spaces. Tag, Dummy and Group never
/// emit text of their own.
///
/// Exclusive (`*`) requests skip branches already used. Used branches are remembered by node index until
/// `reset()`, and marks made before a failure stay in place.
///
/// Nested `{reference}` expansions are limited by `GrammarOptions.maxExpansionDepth`, and groups open at
/// once across those expansions by `MAX_OPEN_GROUPS`; both fail with `EXPANSION_TOO_DEEP`.
///
/// Not thread-safe: callers sharing one instance must synchronize externally.
final class PhraseGenerator {

    private static final Logger LOG = Logger.getLogger(PhraseGenerator.class.getName());

    static final String ERROR_PLACEHOLDER = "(ERROR)";

    /// Groups open at once across every nested reference of one `generate` call
    static final int MAX_OPEN_GROUPS = 2 * GrammarParser.MAX_GROUP_NESTING;

    private final GrammarTree tree;
    private final GrammarOptions options;
    private final Set<Integer> exclusiveUsed = new HashSet<>();
    private int openGroups;

    PhraseGenerator(GrammarTree tree, GrammarOptions options) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Generates a phrase for `identifier`; empty selects the last definition, a leading `*` asks for
    /// a branch of that definition's body not used since the last reset.
    String generate(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return generate(identifier, 0);
    }

    void reset() {
        LOG.fine(() -> "Resetting " + exclusiveUsed.size() + " exclusive marks");
        exclusiveUsed.clear();
    }

    int exclusiveUsedCount() {
        return exclusiveUsed.size();
    }

    private String generate(String identifier, int depth) {
        if (depth > options.maxExpansionDepth()) {
            throw new GrammarGenerationException(EXPANSION_TOO_DEEP, identifier,
                "expansion deeper than " + options.maxExpansionDepth() + " levels");
        }

        final var tags = tree.root().children();
        if (tags.isEmpty()) {
            throw new GrammarGenerationException(EMPTY_TREE, identifier, "empty tree");
        }

        final GrammarNode.Tag tag;
        boolean exclusive = false;
        if (identifier.isEmpty()) {
            tag = (GrammarNode.Tag) tree.node(tags.get(tags.size() - 1));
        } else {
            String name = identifier;
            if (name.startsWith(Substitution.EXCLUSIVE_PREFIX)) {
                name = name.substring(1);
                exclusive = true;
            }
            final String wanted = name;
            tag = tree.findTag(wanted).orElseThrow(() ->
                new GrammarGenerationException(UNKNOWN_IDENTIFIER, wanted, "no such definition: " + wanted));
        }

        if (tag.children().isEmpty()) {
            throw new GrammarGenerationException(MISSING_BODY, tag.text(),
                "root identifier " + tag.text() + " lacks children");
        }

        final boolean requestExclusive = exclusive;
        LOG.fine(() -> "Generating '" + tag.text() + "' depth=" + depth + (requestExclusive ? " exclusive" : ""));

        final var body = tree.node(tag.children().get(0));
        return PhraseText.normalize(compose(body, exclusive, depth, tag.text()));
    }

    private String compose(GrammarNode node, boolean exclusive, int depth, String owner) {
        if (node instanceof GrammarNode.Group group) {
            return composeGroup(group, exclusive, depth, owner);
        }

        final var parts = new ArrayList<String>();

        if (node instanceof GrammarNode.Text text) {
            try {
                parts.add(inflate(text.text(), depth));
            } catch (GrammarGenerationException e) {
                throw new GrammarGenerationException(e.reason(), e.identifier(),
                    "from " + text.source() + ": " + e.getMessage(), e);
            }
        }

        for (final var child : tree.children(node)) {
            parts.add(compose(child, false, depth, owner));
        }

        return String.join(" ", parts);
    }

    private String composeGroup(GrammarNode.Group group, boolean exclusive, int depth, String owner) {
        if (openGroups >= MAX_OPEN_GROUPS) {
            throw new GrammarGenerationException(EXPANSION_TOO_DEEP, owner,
                "groups nested deeper than " + MAX_OPEN_GROUPS + " levels");
        }
        openGroups++;
        try {
            return chooseBranch(group, exclusive, depth, owner);
        } finally {
            openGroups--;
        }
    }

    private String chooseBranch(GrammarNode.Group group, boolean exclusive, int depth, String owner) {
        final List<Integer> branches = group.children();
        final int count = branches.size();
        final int pick = options.random().nextInt(count);

        for (int i = 0; i < count; i++) {
            final int branch = branches.get((pick + i) % count);

            if (exclusive && !exclusiveUsed.add(branch)) {
                continue;
            }

            LOG.finer(() -> "Group " + group.text() + " chose branch node " + branch);
            return compose(tree.node(branch), false, depth, owner);
        }

        throw new GrammarGenerationException(OPTIONS_EXHAUSTED, owner, "all options exhausted");
    }

    /// Expands every `{...}` marker in `text`. Markers are innermost-first: a `}` closes the nearest
    /// preceding `{`. Replacements are fully expanded phrases and are not scanned again.
    private String inflate(String text, int depth) {
        if (text.indexOf('{') < 0) {
            return text;
        }

        final var sb = new StringBuilder(text.length());
        int copied = 0;
        int open = -1;

        for (int p = 0; p < text.length(); p++) {
            final char c = text.charAt(p);
            if (c == '{') {
                open = p;
            } else if (c == '}' && open >= 0) {
                final String content = text.substring(open + 1, p);
                sb.append(text, copied, open);
                sb.append(expand(Substitution.parse(content), depth));
                copied = p + 1;
                open = -1;
            }
        }
        sb.append(text, copied, text.length());

        final String result = sb.toString();
        LOG.finest(() -> "Inflated '" + text + "' -> '" + result + "'");
        return result;
    }

    private String expand(Substitution substitution, int depth) {
        if (substitution instanceof Substitution.Newline) {
            return "\n";
        }
        if (substitution instanceof Substitution.NumericRange range) {
            final long value = range.low() + options.random().nextLong(range.high() - range.low() + 1);
            return Long.toString(value);
        }
        if (substitution instanceof Substitution.Reference reference) {
            try {
                return generate(reference.request(), depth + 1);
            } catch (GrammarGenerationException e) {
                throw new GrammarGenerationException(e.reason(), e.identifier(),
                    e.getMessage() + " (" + reference.request() + ")", e);
            }
        }
        final var malformed = (Substitution.Malformed) substitution;
        LOG.warning(() -> "Malformed substitution {" + malformed.content() + "}, rendering " + ERROR_PLACEHOLDER);
        return ERROR_PLACEHOLDER;
    }
}
