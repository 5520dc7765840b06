package org.dxworks.rapidframe.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits identifiers into lowercase sub-words. Underscores and digit runs
 * separate words, lower-to-upper transitions start a new word, and an acronym
 * run ends before its last capital when a lowercase letter follows
 * ({@code XMLParser} gives {@code xml}, {@code parser}).
 */
public final class IdentifierSplitter {

    private static final Set<String> AXIS_WORDS = Set.of("xaxis", "yaxis", "zaxis");

    public List<String> split(String identifier) {
        List<String> tokens = new ArrayList<>();
        if (identifier == null) {
            return tokens;
        }
        for (String chunk : identifier.split("[_\\d]+")) {
            if (chunk.isEmpty()) {
                continue;
            }
            for (String word : splitCase(chunk)) {
                String lower = word.toLowerCase(Locale.ROOT);
                if (AXIS_WORDS.contains(lower)) {
                    tokens.add(lower.substring(0, 1));
                    tokens.add("axis");
                } else {
                    tokens.add(lower);
                }
            }
        }
        return tokens;
    }

    private static List<String> splitCase(String chunk) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder().append(chunk.charAt(0));
        for (int i = 1; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            char last = current.charAt(current.length() - 1);
            if (Character.isUpperCase(c)) {
                if (!Character.isUpperCase(last)) {
                    words.add(current.toString());
                    current.setLength(0);
                }
                current.append(c);
            } else if (Character.isUpperCase(last) && current.length() > 1) {
                words.add(current.substring(0, current.length() - 1));
                current.setLength(0);
                current.append(last).append(c);
            } else {
                current.append(c);
            }
        }
        words.add(current.toString());
        return words;
    }
}
