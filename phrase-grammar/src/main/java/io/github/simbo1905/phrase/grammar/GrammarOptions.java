package io.github.simbo1905.phrase.grammar;

import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;
import java.util.logging.Logger;

/// Options controlling phrase generation.
///
/// The default expansion depth can be configured via the system property `phrase.grammar.max.depth`;
/// it is read once when this class is initialized.
///
/// @param maxExpansionDepth maximum nesting of `{reference}` expansions before generation fails
/// @param random source of every random choice; inject a seeded one for reproducible output
public record GrammarOptions(int maxExpansionDepth, RandomGenerator random) {

    private static final Logger LOG = Logger.getLogger(GrammarOptions.class.getName());

    /// System property key for the default maximum expansion depth
    public static final String MAX_DEPTH_PROPERTY = "phrase.grammar.max.depth";

    static final int FALLBACK_MAX_DEPTH = 128;

    /// Process-wide generator, seeded once
    private static final class SharedRandom {
        static final Random RANDOM = new Random();
    }

    /// Default options: configured depth and the shared random source
    public static final GrammarOptions DEFAULT = new GrammarOptions(configuredMaxDepth(), SharedRandom.RANDOM);

    public GrammarOptions {
        Objects.requireNonNull(random, "random must not be null");
        if (maxExpansionDepth < 1) {
            throw new IllegalArgumentException("maxExpansionDepth must be at least 1: " + maxExpansionDepth);
        }
    }

    public GrammarOptions withRandom(RandomGenerator random) {
        return new GrammarOptions(maxExpansionDepth, random);
    }

    public GrammarOptions withMaxExpansionDepth(int maxExpansionDepth) {
        return new GrammarOptions(maxExpansionDepth, random);
    }

    String summary() {
        return "maxExpansionDepth=" + maxExpansionDepth + ", random=" + random.getClass().getSimpleName();
    }

    static int configuredMaxDepth() {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        if (propertyValue == null) {
            return FALLBACK_MAX_DEPTH;
        }
        try {
            final int depth = Integer.parseInt(propertyValue.trim());
            if (depth >= 1) {
                LOG.fine(() -> "Max expansion depth set to " + depth + " via system property");
                return depth;
            }
        } catch (NumberFormatException e) {
            LOG.finest(() -> "Unparseable " + MAX_DEPTH_PROPERTY + ": " + e.getMessage());
        }
        LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
            + ". Using default: " + FALLBACK_MAX_DEPTH);
        return FALLBACK_MAX_DEPTH;
    }
}
