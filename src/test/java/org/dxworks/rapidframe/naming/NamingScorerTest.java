package org.dxworks.rapidframe.naming;

import org.dxworks.rapidframe.model.FlaggedToken;
import org.dxworks.rapidframe.model.NamingScore;
import org.dxworks.rapidframe.model.TokenClass;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.dxworks.rapidframe.TestUtils.unavailableOracle;
import static org.dxworks.rapidframe.TestUtils.words;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NamingScorerTest {

    private final NamingScorer scorer = new NamingScorer(words("part", "count", "door", "closed"));

    @Test
    void realWordsScoreFull() {
        NamingScore score = scorer.score(List.of("partCount", "doorClosed"));

        assertEquals(100.0, score.score, 1e-9);
        assertEquals(2, score.variableCount);
        assertTrue(score.badWords.isEmpty());
        assertTrue(score.oracleAvailable);
    }

    @Test
    void unknownAbbreviationIsReportedAsBadWord() {
        NamingScore score = scorer.score(List.of("cnt1"));

        assertEquals(0.0, score.score, 1e-9);
        assertEquals(List.of("cnt"), score.badWords);
        assertEquals(List.of(new FlaggedToken("cnt", "cnt1", TokenClass.UNKNOWN)), score.flaggedTokens);
    }

    @Test
    void fileScoreIsMeanOverVariables() {
        assertEquals(50.0, scorer.score(List.of("partCount", "cnt1")).score, 1e-9);
    }

    @Test
    void shortTokensCountHalf() {
        NamingScore score = scorer.score(List.of("abPart"));

        assertEquals(75.0, score.score, 1e-9);
        assertEquals(List.of(new FlaggedToken("ab", "abPart", TokenClass.SHORT)), score.flaggedTokens);
    }

    @Test
    void allowListedAbbreviationsAreValid() {
        assertEquals(100.0, scorer.score(List.of("diPart", "nCount", "x_y")).score, 1e-9);
        assertEquals(TokenClass.VALID, scorer.classify("DI", true));
    }

    @Test
    void extraAllowedTokensAndMinimumLength() {
        NamingScorer custom = new NamingScorer(words("part"), Set.of("cnt"), 5);

        assertEquals(100.0, custom.score(List.of("cnt1")).score, 1e-9);
        assertEquals(TokenClass.SHORT, custom.classify("part", true));
    }

    @Test
    void replacingUnknownTokenByWordNeverLowersScore() {
        double before = scorer.score(List.of("cntPart")).score;
        double after = scorer.score(List.of("countPart")).score;

        assertTrue(after >= before);
    }

    @Test
    void duplicateNamesAreScoredOnce() {
        assertEquals(1, scorer.score(List.of("partCount", "partCount")).variableCount);
    }

    @Test
    void noVariablesScoresHundred() {
        NamingScore score = scorer.score(List.of());

        assertEquals(100.0, score.score, 1e-9);
        assertEquals(0, score.variableCount);
    }

    @Test
    void unavailableOracleFallsBackToVowelHeuristic() {
        NamingScore score = new NamingScorer(unavailableOracle()).score(List.of("partCount", "cnt1"));

        assertFalse(score.oracleAvailable);
        assertEquals(50.0, score.score, 1e-9);
        assertEquals(List.of("cnt"), score.badWords);
    }
}
