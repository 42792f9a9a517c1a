package io.github.simbo1905.phrase.grammar;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static io.github.simbo1905.phrase.grammar.GrammarParseException.Reason.*;

/// Builds a `GrammarTree` from a token stream in a single left-to-right pass.
///
/// The parser keeps a stack of frames mirroring the current depth in the tree; each frame holds the arena
/// index of a node, so insertion never searches the tree. Words between control tokens `[ | ]` are
/// collected and flushed as one Text node when the next control token arrives.
///
/// A Dummy node is inserted whenever a group opens directly inside another group, e.g. `[[a|b]c]`, so the
/// following text (`c`) has an anchor other than the outer group. It is also added where it is not
/// strictly needed, as in `[[a|b]]`.
final class GrammarParser {

    private static final Logger LOG = Logger.getLogger(GrammarParser.class.getName());

    /// Characters that may not appear in a top-level identifier, checked in this order
    private static final List<String> INVALID_IN_IDENTIFIER = List.of("{", "}", "<", "*", "^");

    /// Deepest `[` nesting accepted within one definition
    static final int MAX_GROUP_NESTING = 256;

    private record Frame(int node, boolean group) {}

    private final GrammarTree.Builder tree = new GrammarTree.Builder();
    private final Deque<Frame> stack = new ArrayDeque<>();
    private String collect = "";
    private String collectSource = "";
    private String previousSource = "";

    private GrammarParser() {}

    /// Parses a single token stream.
    /// @throws GrammarParseException on any syntax error
    static GrammarTree parse(List<GrammarToken> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        return parseSources(List.of(tokens));
    }

    /// Parses the token streams of several sources in one pass, building a single tree. Every stream must
    /// be complete: a group left open or an identifier left dangling at the end of a source is an error
    /// even if a later source would close it.
    /// @throws GrammarParseException on any syntax error
    static GrammarTree parseSources(List<List<GrammarToken>> sources) {
        Objects.requireNonNull(sources, "sources must not be null");
        if (sources.stream().allMatch(List::isEmpty)) {
            throw new GrammarParseException(EMPTY_INPUT, "empty input");
        }
        final var parser = new GrammarParser();
        for (final var tokens : sources) {
            for (final var token : tokens) {
                parser.accept(token);
            }
            parser.endOfSource();
        }
        final var built = parser.tree.build();
        LOG.fine(() -> "Parsed " + built.tags().size() + " definitions, " + built.count() + " nodes");
        return built;
    }

    private void accept(GrammarToken token) {
        final String text = token.text();
        if (text.isEmpty()) {
            throw new GrammarParseException(EMPTY_TOKEN, "empty token", token.source(), text);
        }
        LOG.finer(() -> "Token '" + text + "' at " + token.source() + ", depth " + stack.size());

        switch (text) {
            case "[" -> openGroup(token);
            case "|" -> alternate(token);
            case "]" -> closeGroup(token);
            default -> word(token);
        }
        previousSource = token.source();
    }

    private void openGroup(GrammarToken token) {
        if (collect.isEmpty() && stack.isEmpty()) {
            throw error(MISSING_IDENTIFIER, "missing definition identifier", token);
        }
        if (openGroups() >= MAX_GROUP_NESTING) {
            throw error(NESTING_TOO_DEEP, "groups nested deeper than " + MAX_GROUP_NESTING + " levels", token);
        }

        if (collect.isEmpty() && stack.size() > 1 && top().group()) {
            final int dummy = tree.addDummy(top().node(), token.source());
            stack.push(new Frame(dummy, false));
        } else if (!collect.isEmpty()) {
            final int node;
            if (stack.isEmpty()) {
                final String name = collect;
                tree.tagSource(name).ifPresent(first -> {
                    throw new GrammarParseException(DUPLICATE_IDENTIFIER,
                        "duplicate identifier \"" + name + "\" (first declared at " + first + ")",
                        collectSource, name);
                });
                // Tag text is a label only and is never emitted
                node = tree.addTag(name, collectSource);
            } else {
                node = tree.addText(top().node(), collect, collectSource);
            }
            stack.push(new Frame(node, false));
            collect = "";
        }

        final int group = tree.addGroup(top().node(), token.source());
        stack.push(new Frame(group, true));
    }

    private void alternate(GrammarToken token) {
        if (stack.isEmpty()) {
            throw error(STRAY_ALTERNATION, "stray | at root level", token);
        }
        if (collect.isEmpty() && top().group()) {
            throw error(STRAY_ALTERNATION, "stray | in group", token);
        }

        // Text trailing a nested group belongs to that branch, not to the enclosing group
        if (!top().group() && !collect.isEmpty()) {
            tree.addText(top().node(), collect, collectSource);
            collect = "";
        }

        while (!stack.isEmpty() && !top().group()) {
            stack.pop();
        }
        if (stack.isEmpty()) {
            throw error(STRAY_ALTERNATION, "stray | outside any group", token);
        }

        if (!collect.isEmpty()) {
            tree.addText(top().node(), collect, collectSource);
            collect = "";
        }
    }

    private void closeGroup(GrammarToken token) {
        if (stack.isEmpty()) {
            throw error(STRAY_CLOSE, "stray ]", token);
        }
        if (collect.isEmpty() && top().group()) {
            throw error(EMPTY_GROUP, "empty group", token);
        }

        if (!collect.isEmpty()) {
            tree.addText(top().node(), collect, collectSource);
            collect = "";
        }

        while (!stack.isEmpty()) {
            if (stack.pop().group()) {
                break;
            }
        }

        // Back at the top-level identifier: the definition is complete
        if (stack.size() == 1) {
            stack.clear();
        }
    }

    private void word(GrammarToken token) {
        final String text = token.text();

        if (collect.isEmpty()) {
            if (stack.isEmpty()) {
                for (final String invalid : INVALID_IN_IDENTIFIER) {
                    if (text.contains(invalid)) {
                        throw error(INVALID_IDENTIFIER_CHARACTER, "invalid character " + invalid + " in identifier", token);
                    }
                }
            }
            collect = text;
            collectSource = token.source();
        } else if (stack.isEmpty()) {
            throw error(EXPECTED_GROUP, "expecting [ after identifier \"" + collect + "\"", token);
        } else {
            collect = collect + " " + text;
        }

        final boolean opens = text.charAt(0) == '{';
        final boolean closes = text.charAt(text.length() - 1) == '}';
        if (opens && !closes) {
            throw error(UNTERMINATED_SUBSTITUTION, "unterminated substitution \"" + text + "\"", token);
        } else if (!opens && closes) {
            throw error(STRAY_SUBSTITUTION_CLOSE, "stray } (substitution missing { ?)", token);
        }
    }

    private void endOfSource() {
        if (!stack.isEmpty()) {
            throw new GrammarParseException(UNTERMINATED_GROUP, "unterminated [", previousSource, null);
        }
        if (!collect.isEmpty()) {
            throw new GrammarParseException(EXPECTED_GROUP,
                "expecting [ after identifier \"" + collect + "\"", collectSource, collect);
        }
    }

    private long openGroups() {
        return stack.stream().filter(Frame::group).count();
    }

    private Frame top() {
        return stack.peek();
    }

    private static GrammarParseException error(GrammarParseException.Reason reason, String message, GrammarToken token) {
        return new GrammarParseException(reason, message, token.source(), token.text());
    }
}
