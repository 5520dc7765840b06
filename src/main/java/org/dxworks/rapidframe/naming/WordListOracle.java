package org.dxworks.rapidframe.naming;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Oracle backed by a newline-delimited word list, read on first use. Lines
 * starting with "#" are ignored. A list that cannot be read leaves the oracle
 * unavailable.
 */
public final class WordListOracle implements WordOracle {

    public static final String BUNDLED_RESOURCE = "words/english.txt";

    private final WordSource source;
    private final String description;
    private volatile Set<String> words;
    private volatile boolean loaded;

    private WordListOracle(WordSource source, String description) {
        this.source = source;
        this.description = description;
    }

    public static WordListOracle fromFile(Path path) {
        return new WordListOracle(() -> Files.newInputStream(path), path.toString());
    }

    public static WordListOracle bundled() {
        return fromResource(BUNDLED_RESOURCE);
    }

    public static WordListOracle fromResource(String resource) {
        return new WordListOracle(() -> {
            InputStream in = WordListOracle.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Resource not found: " + resource);
            }
            return in;
        }, "classpath:" + resource);
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean isAvailable() {
        return load() != null;
    }

    @Override
    public boolean isWord(String lowercaseToken) {
        Set<String> dictionary = load();
        if (dictionary == null) {
            throw new IllegalStateException("Word list is not available: " + description);
        }
        return dictionary.contains(lowercaseToken);
    }

    public int size() {
        Set<String> dictionary = load();
        return dictionary == null ? 0 : dictionary.size();
    }

    private Set<String> load() {
        if (!loaded) {
            synchronized (this) {
                if (!loaded) {
                    words = readWords();
                    loaded = true;
                }
            }
        }
        return words;
    }

    private Set<String> readWords() {
        try (InputStream in = source.open();
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            Set<String> result = new HashSet<>();
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim();
                if (!word.isEmpty() && !word.startsWith("#")) {
                    result.add(word.toLowerCase(Locale.ROOT));
                }
            }
            return result.isEmpty() ? null : Collections.unmodifiableSet(result);
        } catch (IOException | UncheckedIOException e) {
            // reported as an unavailable oracle
            return null;
        }
    }

    @FunctionalInterface
    private interface WordSource {
        InputStream open() throws IOException;
    }
}
