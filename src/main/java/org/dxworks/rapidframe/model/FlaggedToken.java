package org.dxworks.rapidframe.model;

import java.util.Objects;

/**
 * A naming sub-word that lowered a score, with the variable it came from.
 */
public final class FlaggedToken {
    public final String token;
    public final String variable;
    public final TokenClass classification;

    public FlaggedToken(String token, String variable, TokenClass classification) {
        this.token = token;
        this.variable = variable;
        this.classification = classification;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlaggedToken)) return false;
        FlaggedToken other = (FlaggedToken) o;
        return token.equals(other.token) && variable.equals(other.variable) && classification == other.classification;
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, variable, classification);
    }

    @Override
    public String toString() {
        return token + " (" + variable + ", " + classification + ")";
    }
}
