package io.github.simbo1905.phrase.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Renders a grammar tree as indented text with box-drawing connectors:
/// ```
/// greeting
/// └─ [
///    ├─ hello there
///    └─ good
///       └─ [
///          ├─ morning
///          └─ evening
/// ```
final class GrammarTreeFormatter {

    private static final String BRANCH = "└─ ";
    private static final String INDENT = "   ";

    private static final int CORNER = '└';
    private static final int TEE = '├';
    private static final int VERTICAL = '│';
    private static final int SPACE = ' ';

    /// Left column is the indented label, right column the source tag
    private record Line(String left, String right) {}

    private GrammarTreeFormatter() {}

    static String format(GrammarTree tree, Set<FormatOption> options) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(options, "options must not be null");

        final var lines = new ArrayList<Line>();
        collect(tree, tree.root(), "", options, lines);
        return String.join("\n", connect(lines, options));
    }

    private static void collect(GrammarTree tree, GrammarNode parent, String prefix,
                                Set<FormatOption> options, List<Line> lines) {
        for (final var child : tree.children(parent)) {
            lines.add(new Line(prefix + BRANCH + label(child, options), child.source()));
            collect(tree, child, prefix + INDENT, options, lines);
        }
    }

    static String label(GrammarNode node, Set<FormatOption> options) {
        if (node instanceof GrammarNode.Group) {
            return options.contains(FormatOption.DISPLAY_GROUP_NUMBERS) ? node.text() : "[";
        }
        if (node instanceof GrammarNode.Dummy) {
            return "*";
        }
        return node.text();
    }

    /// Scans lines bottom-up, columns left to right. A corner marks its column as connected to something
    /// below; a corner in a connected column becomes a tee and a space becomes a vertical bar. Any other
    /// character ends the connection. The root's own three columns are then dropped.
    private static List<String> connect(List<Line> input, Set<FormatOption> options) {
        final int count = input.size();
        final int[][] rows = new int[count][];
        int maxWidth = 0;

        for (int i = 0; i < count; i++) {
            rows[i] = input.get(i).left().codePoints().toArray();
            maxWidth = Math.max(maxWidth, rows[i].length);
        }

        final boolean[] connected = new boolean[maxWidth];

        for (int i = count - 1; i >= 0; i--) {
            final int[] row = rows[i];
            for (int j = 0; j < maxWidth; j++) {
                if (j >= row.length) {
                    connected[j] = false;
                    continue;
                }
                final int c = row[j];
                if (c != CORNER && c != SPACE) {
                    connected[j] = false;
                } else if (c == CORNER && connected[j]) {
                    row[j] = TEE;
                } else if (c == SPACE && connected[j]) {
                    row[j] = VERTICAL;
                } else if (c == CORNER) {
                    connected[j] = true;
                }
            }
        }

        final boolean withSource = options.contains(FormatOption.DISPLAY_SOURCE);
        final var result = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            final int[] row = rows[i];
            final var sb = new StringBuilder();
            sb.append(new String(row, BRANCH.length(), row.length - BRANCH.length()));
            if (withSource) {
                // Padded to the full width, stripped columns included
                for (int pad = row.length - BRANCH.length(); pad < maxWidth; pad++) {
                    sb.append(' ');
                }
                sb.append(input.get(i).right());
            }
            result.add(sb.toString());
        }
        return result;
    }
}
