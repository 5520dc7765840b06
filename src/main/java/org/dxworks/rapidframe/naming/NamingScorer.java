package org.dxworks.rapidframe.naming;

import org.dxworks.rapidframe.model.FlaggedToken;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.TokenClass;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Scores variable names by how many of their sub-words are real words.
 *
 * Each sub-word is VALID (allow-listed or known to the oracle), SHORT (under the
 * minimum length) or UNKNOWN. A variable scores the mean weight of its
 * sub-words; the file scores 100 times the mean over its variables. SHORT and
 * UNKNOWN sub-words are reported together with the variable they came from.
 */
public class NamingScorer {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    static final double VALID_WEIGHT = 1.0;
    static final double SHORT_WEIGHT = 0.5;
    static final double UNKNOWN_WEIGHT = 0.0;

    /** Common RAPID abbreviations: IO prefixes, axes, loop counters. */
    public static final Set<String> DEFAULT_ALLOWED_TOKENS = Set.of(
        "di", "do", "gi", "go", "ai", "ao",
        "in", "on", "p", "t", "w", "l", "n", "s",
        "via", "m", "bool", "plc", "pre", "off",
        "with", "from", "x", "y", "z", "ry", "rz", "rx",
        "dir", "calc", "prog", "pers", "i", "j", "k", "a",
        "b", "ok", "at", "for", "over", "under", "front", "back", "cc", "ct", "v");

    private static final String VOWELS = "aeiouy";

    private final WordOracle oracle;
    private final IdentifierSplitter splitter = new IdentifierSplitter();
    private final Set<String> allowedTokens;
    private final int minTokenLength;

    public NamingScorer(WordOracle oracle) {
        this(oracle, DEFAULT_ALLOWED_TOKENS, DEFAULT_MIN_TOKEN_LENGTH);
    }

    public NamingScorer(WordOracle oracle, Collection<String> allowedTokens, int minTokenLength) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        Set<String> allowed = new HashSet<>();
        for (String token : allowedTokens) {
            allowed.add(token.toLowerCase(Locale.ROOT));
        }
        this.allowedTokens = Set.copyOf(allowed);
        this.minTokenLength = minTokenLength;
    }

    public NamingScore score(Collection<String> variableNames) {
        boolean oracleAvailable = oracle.isAvailable();
        Set<String> variables = new LinkedHashSet<>(variableNames);
        if (variables.isEmpty()) {
            return NamingScore.neutral(oracleAvailable);
        }

        Set<FlaggedToken> flagged = new LinkedHashSet<>();
        double sum = 0.0;
        for (String variable : variables) {
            sum += scoreVariable(variable, oracleAvailable, flagged);
        }
        return new NamingScore(100.0 * sum / variables.size(), variables.size(), oracleAvailable,
                List.copyOf(flagged));
    }

    public TokenClass classify(String token, boolean oracleAvailable) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (allowedTokens.contains(lower)) {
            return TokenClass.VALID;
        }
        if (lower.length() < minTokenLength) {
            return TokenClass.SHORT;
        }
        if (oracleAvailable) {
            return oracle.isWord(lower) ? TokenClass.VALID : TokenClass.UNKNOWN;
        }
        return looksPronounceable(lower) ? TokenClass.VALID : TokenClass.UNKNOWN;
    }

    private double scoreVariable(String variable, boolean oracleAvailable, Set<FlaggedToken> flagged) {
        List<String> tokens = splitter.split(variable);
        if (tokens.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (String token : tokens) {
            TokenClass tokenClass = classify(token, oracleAvailable);
            sum += weight(tokenClass);
            if (tokenClass != TokenClass.VALID) {
                flagged.add(new FlaggedToken(token, variable, tokenClass));
            }
        }
        return sum / tokens.size();
    }

    private static double weight(TokenClass tokenClass) {
        return switch (tokenClass) {
            case VALID -> VALID_WEIGHT;
            case SHORT -> SHORT_WEIGHT;
            case UNKNOWN -> UNKNOWN_WEIGHT;
        };
    }

    // Fallback when no dictionary can be consulted.
    private static boolean looksPronounceable(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (VOWELS.indexOf(token.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
