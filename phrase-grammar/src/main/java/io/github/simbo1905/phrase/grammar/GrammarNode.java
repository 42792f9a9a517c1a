package io.github.simbo1905.phrase.grammar;

import java.util.List;
import java.util.Objects;

/// Nodes of a grammar syntax tree.
///
/// Nodes live in the arena owned by `GrammarTree` and refer to their children by arena index. The index
/// is also the node's identity, which stays stable for the lifetime of the tree.
///
/// - Root: the single tree root; children are the top-level tags in declaration order
/// - Tag: a top-level identifier; its name is never emitted; exactly one child holds the body
/// - Group: a `[...]` construct; each child is one `|` branch
/// - Text: a literal fragment, possibly with `{...}` markers, followed by any structural children
/// - Dummy: zero-width anchor between back-to-back groups
sealed interface GrammarNode {

    int id();

    String text();

    String source();

    List<Integer> children();

    record Root(List<Integer> children) implements GrammarNode {
        public Root {
            children = List.copyOf(children);
        }

        @Override
        public int id() {
            return 0;
        }

        @Override
        public String text() {
            return "";
        }

        @Override
        public String source() {
            return "";
        }
    }

    record Tag(int id, String text, String source, List<Integer> children) implements GrammarNode {
        public Tag {
            Objects.requireNonNull(text, "text must not be null");
            children = List.copyOf(children);
        }
    }

    /// The text is a label unique within one parse (`[1`, `[2`, ...) used only for display.
    record Group(int id, String text, String source, List<Integer> children) implements GrammarNode {
        public Group {
            Objects.requireNonNull(text, "text must not be null");
            children = List.copyOf(children);
        }
    }

    record Text(int id, String text, String source, List<Integer> children) implements GrammarNode {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
            children = List.copyOf(children);
        }
    }

    /// Carries the comment marker as text; tokenization removes every `//` so it cannot clash with input.
    record Dummy(int id, String source, List<Integer> children) implements GrammarNode {
        public Dummy {
            children = List.copyOf(children);
        }

        @Override
        public String text() {
            return GrammarTokenizer.COMMENT;
        }
    }
}
