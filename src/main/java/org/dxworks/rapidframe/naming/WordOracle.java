package org.dxworks.rapidframe.naming;

/**
 * Word-validity check over a natural-language reference.
 */
public interface WordOracle {

    /**
     * False when the reference cannot be consulted; callers then fall back to
     * heuristics instead of calling {@link #isWord(String)}.
     */
    boolean isAvailable();

    /**
     * @param lowercaseToken a single lowercase sub-word
     */
    boolean isWord(String lowercaseToken);
}
