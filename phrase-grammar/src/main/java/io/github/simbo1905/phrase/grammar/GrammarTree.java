package io.github.simbo1905.phrase.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Immutable arena of grammar nodes. Index 0 is the root; every other index is a node attached exactly
/// once under a parent with a lower index.
final class GrammarTree {

    private final List<GrammarNode> nodes;

    private GrammarTree(List<GrammarNode> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    GrammarNode.Root root() {
        return (GrammarNode.Root) nodes.get(0);
    }

    GrammarNode node(int id) {
        return nodes.get(id);
    }

    List<GrammarNode> children(GrammarNode parent) {
        final var ids = parent.children();
        final var result = new ArrayList<GrammarNode>(ids.size());
        for (final int id : ids) {
            result.add(nodes.get(id));
        }
        return result;
    }

    /// Top-level definitions in declaration order.
    List<GrammarNode.Tag> tags() {
        final var result = new ArrayList<GrammarNode.Tag>();
        for (final var node : children(root())) {
            result.add((GrammarNode.Tag) node);
        }
        return Collections.unmodifiableList(result);
    }

    Optional<GrammarNode.Tag> findTag(String name) {
        final var ids = root().children();
        for (int i = ids.size() - 1; i >= 0; i--) {
            final var tag = (GrammarNode.Tag) nodes.get(ids.get(i));
            if (tag.text().equals(name)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    /// Number of nodes of every kind, not counting the root.
    int count() {
        return nodes.size() - 1;
    }

    /// Mutable side of the arena used while parsing. Each `add` returns the new node's index, which the
    /// parser keeps as its insertion cursor.
    static final class Builder {

        private enum Kind { ROOT, TAG, GROUP, TEXT, DUMMY }

        private static final class Draft {
            final Kind kind;
            final String text;
            final String source;
            final List<Integer> children = new ArrayList<>();

            Draft(Kind kind, String text, String source) {
                this.kind = kind;
                this.text = text;
                this.source = source;
            }
        }

        private final List<Draft> drafts = new ArrayList<>();
        private int groupId;

        Builder() {
            drafts.add(new Draft(Kind.ROOT, "", ""));
        }

        int addTag(String name, String source) {
            return add(0, Kind.TAG, name, source);
        }

        int addGroup(int parent, String source) {
            groupId++;
            return add(parent, Kind.GROUP, "[" + groupId, source);
        }

        int addText(int parent, String text, String source) {
            return add(parent, Kind.TEXT, text, source);
        }

        int addDummy(int parent, String source) {
            return add(parent, Kind.DUMMY, GrammarTokenizer.COMMENT, source);
        }

        /// Source tag of an already declared top-level identifier.
        Optional<String> tagSource(String name) {
            for (final int id : drafts.get(0).children) {
                final var draft = drafts.get(id);
                if (draft.text.equals(name)) {
                    return Optional.of(draft.source);
                }
            }
            return Optional.empty();
        }

        private int add(int parent, Kind kind, String text, String source) {
            Objects.checkIndex(parent, drafts.size());
            final int id = drafts.size();
            drafts.add(new Draft(kind, text, source));
            drafts.get(parent).children.add(id);
            return id;
        }

        GrammarTree build() {
            final var nodes = new ArrayList<GrammarNode>(drafts.size());
            for (int id = 0; id < drafts.size(); id++) {
                final var d = drafts.get(id);
                switch (d.kind) {
                    case ROOT -> nodes.add(new GrammarNode.Root(d.children));
                    case TAG -> nodes.add(new GrammarNode.Tag(id, d.text, d.source, d.children));
                    case GROUP -> nodes.add(new GrammarNode.Group(id, d.text, d.source, d.children));
                    case TEXT -> nodes.add(new GrammarNode.Text(id, d.text, d.source, d.children));
                    case DUMMY -> nodes.add(new GrammarNode.Dummy(id, d.source, d.children));
                }
            }
            return new GrammarTree(nodes);
        }
    }
}
