package io.github.simbo1905.phrase.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static io.github.simbo1905.phrase.grammar.GrammarParseException.Reason.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for GrammarParser - token stream to syntax tree, and syntax errors
class GrammarParserTest extends PhraseGrammarLoggingConfig {

    private static final Logger LOG = Logger.getLogger(GrammarParserTest.class.getName());

    private static GrammarTree parse(String grammar) {
        return GrammarParser.parse(GrammarTokenizer.tokenize(grammar, ""));
    }

    // ========== Tree shape ==========

    @ParameterizedTest
    @CsvSource({
        "a[b], 3",
        "a[[b]], 5",
        "a[[b]c], 6",
        "a[b|c|d], 5",
        "a[x [b|c] d], 7",
        "a[hello there|b] c[d], 7"
    })
    void testNodeCount(String grammar, int expected) {
        LOG.info(() -> "TEST: testNodeCount - " + grammar);
        assertThat(parse(grammar).count()).isEqualTo(expected);
    }

    @Test
    void testTextBetweenGroupsHangsUnderPrecedingText() {
        LOG.info(() -> "TEST: testTextBetweenGroupsHangsUnderPrecedingText");
        final var tree = parse("a[x [b|c] d]");

        final var tag = (GrammarNode.Tag) tree.node(1);
        assertThat(tag.text()).isEqualTo("a");
        assertThat(tag.children()).containsExactly(2);

        assertThat(tree.node(2)).isInstanceOf(GrammarNode.Group.class);
        assertThat(tree.node(2).children()).containsExactly(3);

        final var x = tree.node(3);
        assertThat(x).isInstanceOf(GrammarNode.Text.class);
        assertThat(x.text()).isEqualTo("x");
        assertThat(x.children()).containsExactly(4, 7);

        assertThat(tree.children(tree.node(4))).extracting(GrammarNode::text).containsExactly("b", "c");
        assertThat(tree.node(7).text()).isEqualTo("d");
    }

    @Test
    void testDummyAnchorsTextAfterLeadingGroup() {
        LOG.info(() -> "TEST: testDummyAnchorsTextAfterLeadingGroup");
        final var tree = parse("a[[b]c]");

        final var outer = tree.node(2);
        assertThat(outer.children()).hasSize(1);
        final var dummy = tree.node(outer.children().get(0));
        assertThat(dummy).isInstanceOf(GrammarNode.Dummy.class);
        assertThat(dummy.text()).isEqualTo("//");

        final var anchored = tree.children(dummy);
        assertThat(anchored).hasSize(2);
        assertThat(anchored.get(0)).isInstanceOf(GrammarNode.Group.class);
        assertThat(anchored.get(1)).isInstanceOf(GrammarNode.Text.class);
        assertThat(anchored.get(1).text()).isEqualTo("c");
    }

    @Test
    void testDummyAfterAlternation() {
        LOG.info(() -> "TEST: testDummyAfterAlternation");
        final var tree = parse("a[b|[c|d] e]");
        final var branches = tree.children(tree.node(2));
        assertThat(branches).hasSize(2);
        assertThat(branches.get(0).text()).isEqualTo("b");
        assertThat(branches.get(1)).isInstanceOf(GrammarNode.Dummy.class);
    }

    @Test
    void testTextAfterNestedGroupStaysInBranch() {
        LOG.info(() -> "TEST: testTextAfterNestedGroupStaysInBranch");
        final var tree = parse("a[[b] c | d]");
        final var branches = tree.children(tree.node(2));
        assertThat(branches).hasSize(2);
        assertThat(branches.get(0)).isInstanceOf(GrammarNode.Dummy.class);
        assertThat(tree.children(branches.get(0))).extracting(GrammarNode::text).endsWith("c");
        assertThat(branches.get(1).text()).isEqualTo("d");
    }

    @Test
    void testMultiWordBranchIsOneTextNode() {
        LOG.info(() -> "TEST: testMultiWordBranchIsOneTextNode");
        final var tree = parse("greeting [ hi | hello there | good morning to thee ]");
        assertThat(tree.children(tree.node(2))).extracting(GrammarNode::text)
            .containsExactly("hi", "hello there", "good morning to thee");
    }

    @Test
    void testGroupLabelsAreUniqueWithinParse() {
        LOG.info(() -> "TEST: testGroupLabelsAreUniqueWithinParse");
        final var tree = parse("a[b [c|d] [e]] f[g]");
        final var labels = new java.util.ArrayList<String>();
        for (int id = 1; id <= tree.count(); id++) {
            if (tree.node(id) instanceof GrammarNode.Group group) {
                labels.add(group.text());
            }
        }
        assertThat(labels).containsExactly("[1", "[2", "[3", "[4");
    }

    @Test
    void testTagsKeepDeclarationOrder() {
        LOG.info(() -> "TEST: testTagsKeepDeclarationOrder");
        final var tree = parse("zeta [ z ]\nalpha [ a ]\nmid [ m ]");
        assertThat(tree.tags()).extracting(GrammarNode.Tag::text).containsExactly("zeta", "alpha", "mid");
        assertThat(tree.findTag("alpha")).isPresent();
        assertThat(tree.findTag("missing")).isEmpty();
    }

    @Test
    void testDeeplyNestedGroups() {
        LOG.info(() -> "TEST: testDeeplyNestedGroups");
        final var tree = parse("a[[[[[[[[[[[[[[[[[[[[b]]]]]]]]]]]]]]]]]]]]");
        assertThat(tree.tags()).hasSize(1);
        // tag + 20 groups + 19 dummies + text
        assertThat(tree.count()).isEqualTo(41);
    }

    private static String nested(int levels) {
        return "a" + "[x ".repeat(levels) + "]".repeat(levels);
    }

    @Test
    void testNestingUpToLimitIsAccepted() {
        LOG.info(() -> "TEST: testNestingUpToLimitIsAccepted");
        final int levels = GrammarParser.MAX_GROUP_NESTING;
        final var grammar = PhraseGrammar.parse(nested(levels));
        assertThat(grammar.count()).isEqualTo(1 + 2 * levels);
        assertThat(grammar.generate()).isEqualTo(String.join(" ", java.util.Collections.nCopies(levels, "x")));
        assertThat(grammar.format()).startsWith("a\n└─ [\n   └─ x");
    }

    @Test
    void testNestingBeyondLimitIsRejected() {
        LOG.info(() -> "TEST: testNestingBeyondLimitIsRejected");
        assertThatThrownBy(() -> parse(nested(GrammarParser.MAX_GROUP_NESTING + 1)))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> {
                final var ex = (GrammarParseException) e;
                assertThat(ex.reason()).isEqualTo(NESTING_TOO_DEEP);
                assertThat(ex.token()).isEqualTo("[");
            });
        assertThatThrownBy(() -> PhraseGrammar.parse(nested(5000)))
            .isInstanceOf(GrammarParseException.class)
            .hasMessage("groups nested deeper than 256 levels at :1");
    }

    @Test
    void testNodesRecordSourceLine() {
        LOG.info(() -> "TEST: testNodesRecordSourceLine");
        final var tree = GrammarParser.parse(GrammarTokenizer.tokenize("first [ one ]\nsecond\n[\n  two\n]", "g"));
        assertThat(tree.findTag("second").orElseThrow().source()).isEqualTo("g:2");
        final var body = tree.node(tree.findTag("second").orElseThrow().children().get(0));
        assertThat(body.source()).isEqualTo("g:3");
        assertThat(tree.children(body).get(0).source()).isEqualTo("g:4");
    }

    // ========== Syntax errors ==========

    static Stream<Arguments> malformedGrammars() {
        return Stream.of(
            Arguments.of("[a|b]", MISSING_IDENTIFIER),
            Arguments.of("a[b] [c]", MISSING_IDENTIFIER),
            Arguments.of("a[]", EMPTY_GROUP),
            Arguments.of("a[b|[]]", EMPTY_GROUP),
            Arguments.of("]", STRAY_CLOSE),
            Arguments.of("a[a]]", STRAY_CLOSE),
            Arguments.of("b]", STRAY_CLOSE),
            Arguments.of("a[", UNTERMINATED_GROUP),
            Arguments.of("a[a|b", UNTERMINATED_GROUP),
            Arguments.of("a[a|", UNTERMINATED_GROUP),
            Arguments.of("a[b", UNTERMINATED_GROUP),
            Arguments.of("a[|a]", STRAY_ALTERNATION),
            Arguments.of("a[a||a]", STRAY_ALTERNATION),
            Arguments.of("|", STRAY_ALTERNATION),
            Arguments.of("a|[a]", STRAY_ALTERNATION),
            Arguments.of("a[a]|", STRAY_ALTERNATION),
            Arguments.of("{a[a]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("a}[a]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("<a[b]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("a<[b]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("*a[b]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("a*[b]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("a*b[c]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("a^[b]", INVALID_IDENTIFIER_CHARACTER),
            Arguments.of("a b[c]", EXPECTED_GROUP),
            Arguments.of("a {b", EXPECTED_GROUP),
            Arguments.of("a[b] c", EXPECTED_GROUP),
            Arguments.of("a[{b]", UNTERMINATED_SUBSTITUTION),
            Arguments.of("a[{a b}]", UNTERMINATED_SUBSTITUTION),
            Arguments.of("a[{b", UNTERMINATED_SUBSTITUTION),
            Arguments.of("a[{b|c]", UNTERMINATED_SUBSTITUTION),
            Arguments.of("a[b}]", STRAY_SUBSTITUTION_CLOSE),
            Arguments.of("a[b] a[c]", DUPLICATE_IDENTIFIER),
            Arguments.of("//a[b]", EMPTY_INPUT),
            Arguments.of("", EMPTY_INPUT)
        );
    }

    @ParameterizedTest
    @MethodSource("malformedGrammars")
    void testMalformedGrammarIsRejected(String grammar, GrammarParseException.Reason reason) {
        LOG.info(() -> "TEST: testMalformedGrammarIsRejected - " + grammar + " => " + reason);
        assertThatThrownBy(() -> parse(grammar))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> assertThat(((GrammarParseException) e).reason()).isEqualTo(reason));
    }

    @Test
    void testInvalidIdentifierNamesTheCharacter() {
        LOG.info(() -> "TEST: testInvalidIdentifierNamesTheCharacter");
        assertThatThrownBy(() -> parse("a^b[c]"))
            .hasMessage("invalid character ^ in identifier at :1");
        assertThatThrownBy(() -> parse("a<*[c]"))
            .hasMessageStartingWith("invalid character < in identifier");
    }

    @Test
    void testUnterminatedGroupReportsLastToken() {
        LOG.info(() -> "TEST: testUnterminatedGroupReportsLastToken");
        assertThatThrownBy(() -> parse("a[b]\nc[\n  d\n\n"))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> {
                final var ex = (GrammarParseException) e;
                assertThat(ex.reason()).isEqualTo(UNTERMINATED_GROUP);
                assertThat(ex.source()).isEqualTo(":3");
                assertThat(ex.getMessage()).isEqualTo("unterminated [ at :3");
            });
    }

    @Test
    void testDuplicateIdentifierReportsBothLocations() {
        LOG.info(() -> "TEST: testDuplicateIdentifierReportsBothLocations");
        assertThatThrownBy(() -> parse("a[b]\n\na[c]"))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> {
                final var ex = (GrammarParseException) e;
                assertThat(ex.reason()).isEqualTo(DUPLICATE_IDENTIFIER);
                assertThat(ex.source()).isEqualTo(":3");
                assertThat(ex.token()).isEqualTo("a");
                assertThat(ex.getMessage()).contains("first declared at :1");
            });
    }

    @Test
    void testUnterminatedSubstitutionCarriesToken() {
        LOG.info(() -> "TEST: testUnterminatedSubstitutionCarriesToken");
        assertThatThrownBy(() -> parse("x[ok]\ny[{oops]"))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> {
                final var ex = (GrammarParseException) e;
                assertThat(ex.token()).isEqualTo("{oops");
                assertThat(ex.getMessage()).isEqualTo("unterminated substitution \"{oops\" at :2");
            });
    }

    @Test
    void testEmptyInputHasNoLocation() {
        LOG.info(() -> "TEST: testEmptyInputHasNoLocation");
        assertThatThrownBy(() -> parse("   \n// nothing"))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> {
                final var ex = (GrammarParseException) e;
                assertThat(ex.source()).isNull();
                assertThat(ex.getMessage()).isEqualTo("empty input");
            });
    }

    @Test
    void testEmptyTokenIsInternalError() {
        LOG.info(() -> "TEST: testEmptyTokenIsInternalError");
        final var tokens = List.of(new GrammarToken("a", ":1"), new GrammarToken("", ":1"));
        assertThatThrownBy(() -> GrammarParser.parse(tokens))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> assertThat(((GrammarParseException) e).reason()).isEqualTo(EMPTY_TOKEN));
    }

    // ========== Multiple sources ==========

    @Test
    void testSourcesBuildOneTree() {
        LOG.info(() -> "TEST: testSourcesBuildOneTree");
        final var tree = GrammarParser.parseSources(List.of(
            GrammarTokenizer.tokenize("weekday [ Monday | Tuesday ]", "days.grammar"),
            GrammarTokenizer.tokenize("// only a comment", "empty.grammar"),
            GrammarTokenizer.tokenize("diary [ It was {weekday}. ]", "diary.grammar")));
        assertThat(tree.tags()).extracting(GrammarNode.Tag::text).containsExactly("weekday", "diary");
        assertThat(tree.findTag("diary").orElseThrow().source()).isEqualTo("diary.grammar:1");
    }

    @Test
    void testGroupMayNotSpanSources() {
        LOG.info(() -> "TEST: testGroupMayNotSpanSources");
        assertThatThrownBy(() -> GrammarParser.parseSources(List.of(
            GrammarTokenizer.tokenize("a [ b", "one.grammar"),
            GrammarTokenizer.tokenize("]", "two.grammar"))))
            .isInstanceOf(GrammarParseException.class)
            .satisfies(e -> {
                final var ex = (GrammarParseException) e;
                assertThat(ex.reason()).isEqualTo(UNTERMINATED_GROUP);
                assertThat(ex.source()).isEqualTo("one.grammar:1");
            });
    }

    @Test
    void testDuplicateAcrossSources() {
        LOG.info(() -> "TEST: testDuplicateAcrossSources");
        assertThatThrownBy(() -> GrammarParser.parseSources(List.of(
            GrammarTokenizer.tokenize("a [ b ]", "one.grammar"),
            GrammarTokenizer.tokenize("a [ c ]", "two.grammar"))))
            .isInstanceOf(GrammarParseException.class)
            .hasMessageContaining("first declared at one.grammar:1")
            .hasMessageEndingWith("at two.grammar:1");
    }
}
