package io.github.simbo1905.phrase.grammar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A parsed phrase grammar, ready to generate random phrases.
///
/// Usage examples:
/// ```java
/// // Parse once, generate many times
/// PhraseGrammar grammar = PhraseGrammar.parse("greeting [ hello there | good [morning | evening] ]");
/// String phrase = grammar.generate("greeting");
///
/// // One-off, errors ignored
/// String quick = PhraseGrammar.quick("excuse [ My [dog | cat] ate my homework. ]");
/// ```
///
/// The tree is immutable once parsed. The only mutable state is the set of branches already used by
/// exclusive (`*`) requests, which persists across `generate` calls until `reset()`. Instances are not
/// thread-safe.
public final class PhraseGrammar {

    private static final Logger LOG = Logger.getLogger(PhraseGrammar.class.getName());

    private final GrammarTree tree;
    private final GrammarOptions options;
    private final PhraseGenerator generator;

    private PhraseGrammar(GrammarTree tree, GrammarOptions options) {
        this.tree = tree;
        this.options = options;
        this.generator = new PhraseGenerator(tree, options);
    }

    /// Parses grammar text with default options.
    /// @throws GrammarParseException if the grammar is invalid
    public static PhraseGrammar parse(String grammar) {
        return parse(grammar, GrammarOptions.DEFAULT);
    }

    /// Parses grammar text.
    /// @throws GrammarParseException if the grammar is invalid
    public static PhraseGrammar parse(String grammar, GrammarOptions options) {
        Objects.requireNonNull(grammar, "grammar must not be null");
        return parseSources(List.of(GrammarSource.of(grammar)), options);
    }

    /// Parses several sources as one grammar with default options.
    /// @throws GrammarParseException if any source is invalid
    public static PhraseGrammar parseSources(List<GrammarSource> sources) {
        return parseSources(sources, GrammarOptions.DEFAULT);
    }

    /// Parses several sources as one grammar. Each source is tokenized separately, keeping its own
    /// location tags, so each must be complete on its own; an error in any of them fails the whole parse.
    /// @throws GrammarParseException if any source is invalid
    public static PhraseGrammar parseSources(List<GrammarSource> sources, GrammarOptions options) {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Parsing " + sources.size() + " source(s) with " + options.summary());

        final var tokenized = new ArrayList<List<GrammarToken>>(sources.size());
        for (final var source : sources) {
            Objects.requireNonNull(source, "source must not be null");
            tokenized.add(GrammarTokenizer.tokenize(source.text(), source.name()));
        }
        return new PhraseGrammar(GrammarParser.parseSources(tokenized), options);
    }

    /// Reads and parses a UTF-8 grammar file with default options.
    public static PhraseGrammar parseFile(Path file) throws IOException {
        return parseFiles(List.of(file), GrammarOptions.DEFAULT);
    }

    /// Reads and parses a UTF-8 grammar file.
    public static PhraseGrammar parseFile(Path file, GrammarOptions options) throws IOException {
        return parseFiles(List.of(file), options);
    }

    /// Reads and parses several UTF-8 grammar files as one grammar with default options.
    public static PhraseGrammar parseFiles(List<Path> files) throws IOException {
        return parseFiles(files, GrammarOptions.DEFAULT);
    }

    /// Reads and parses several UTF-8 grammar files as one grammar. Locations are tagged with the path.
    /// @throws IOException if a file cannot be read
    /// @throws GrammarParseException if any file is invalid
    public static PhraseGrammar parseFiles(List<Path> files, GrammarOptions options) throws IOException {
        Objects.requireNonNull(files, "files must not be null");
        final var sources = new ArrayList<GrammarSource>(files.size());
        for (final var file : files) {
            Objects.requireNonNull(file, "file must not be null");
            LOG.fine(() -> "Reading grammar file " + file);
            sources.add(new GrammarSource(file.toString(), Files.readString(file, StandardCharsets.UTF_8)));
        }
        return parseSources(sources, options);
    }

    /// Parses `grammar` and generates its last definition, returning an empty string on any error.
    public static String quick(String grammar) {
        try {
            return parse(grammar).generate();
        } catch (GrammarParseException | GrammarGenerationException e) {
            LOG.fine(() -> "quick() failed: " + e.getMessage());
            return "";
        }
    }

    /// Generates a random phrase.
    /// @param identifier the definition to generate; empty selects the last one declared, and a leading
    ///                   `*` asks for a top-level branch not used since the last `reset()`
    /// @throws GrammarGenerationException if the phrase cannot be generated
    public String generate(String identifier) {
        return generator.generate(Objects.requireNonNull(identifier, "identifier must not be null"));
    }

    /// Generates a random phrase for the last definition declared.
    public String generate() {
        return generate("");
    }

    /// Forgets every branch used by exclusive requests.
    public void reset() {
        generator.reset();
    }

    /// Number of nodes in the syntax tree, not counting the root.
    public int count() {
        return tree.count();
    }

    /// Top-level identifiers in declaration order.
    public List<String> identifiers() {
        final var names = new ArrayList<String>();
        for (final var tag : tree.tags()) {
            names.add(tag.text());
        }
        return List.copyOf(names);
    }

    /// Renders the syntax tree for inspection.
    public String format(FormatOption... formatOptions) {
        Objects.requireNonNull(formatOptions, "formatOptions must not be null");
        final var set = EnumSet.noneOf(FormatOption.class);
        for (final var option : formatOptions) {
            set.add(Objects.requireNonNull(option, "option must not be null"));
        }
        return GrammarTreeFormatter.format(tree, set);
    }

    /// The options this grammar generates with, as passed to `parse`.
    public GrammarOptions options() {
        return options;
    }

    GrammarTree tree() {
        return tree;
    }

    PhraseGenerator generator() {
        return generator;
    }

    @Override
    public String toString() {
        return "PhraseGrammar[definitions=" + identifiers() + ", nodes=" + count() + "]";
    }
}
