package org.dxworks.rapidframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

public final class NamingScore {
    public final double score;
    public final int variableCount;
    public final boolean oracleAvailable;
    public final List<String> badWords;
    public final List<FlaggedToken> flaggedTokens;

    public NamingScore(double score, int variableCount, boolean oracleAvailable, List<FlaggedToken> flaggedTokens) {
        this.score = score;
        this.variableCount = variableCount;
        this.oracleAvailable = oracleAvailable;
        this.flaggedTokens = Collections.unmodifiableList(new ArrayList<>(flaggedTokens));
        TreeSet<String> words = new TreeSet<>();
        for (FlaggedToken flagged : flaggedTokens) {
            words.add(flagged.token);
        }
        this.badWords = List.copyOf(words);
    }

    /**
     * Score for a file without variables: nothing to judge.
     */
    public static NamingScore neutral(boolean oracleAvailable) {
        return new NamingScore(100.0, 0, oracleAvailable, List.of());
    }
}
