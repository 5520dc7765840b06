package org.dxworks.rapidframe;

import org.dxworks.rapidframe.analyzer.RapidModuleAnalyzer;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.SourceFile;
import org.dxworks.rapidframe.naming.WordOracle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class TestUtils {
    public static final Path RAPID_SAMPLES = Paths.get("src/test/resources/samples/rapid");

    /** Words the sample modules need to score as real words. */
    public static final String[] SAMPLE_WORDS = {
        "part", "count", "door", "closed", "unused", "text", "gripper", "close", "cycle", "time"
    };

    public static SourceFile sample(String fileName) throws IOException {
        String text = Files.readString(RAPID_SAMPLES.resolve(fileName), StandardCharsets.UTF_8);
        return SourceFile.of(fileName, text);
    }

    public static List<SourceFile> samples(String... fileNames) throws IOException {
        List<SourceFile> files = new ArrayList<>();
        for (String fileName : fileNames) {
            files.add(sample(fileName));
        }
        return files;
    }

    public static SourceFile source(String id, String... lines) {
        return SourceFile.of(id, String.join("\n", lines));
    }

    public static ParsedFile parse(SourceFile source) {
        return new RapidModuleAnalyzer().analyze(source);
    }

    public static ParsedFile parse(String id, String... lines) {
        return parse(source(id, lines));
    }

    public static WordOracle words(String... words) {
        return new InMemoryWordOracle(Arrays.asList(words));
    }

    public static WordOracle unavailableOracle() {
        return new WordOracle() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public boolean isWord(String lowercaseToken) {
                throw new IllegalStateException("not available");
            }
        };
    }

    public static final class InMemoryWordOracle implements WordOracle {
        private final Set<String> words = new HashSet<>();

        public InMemoryWordOracle(Iterable<String> words) {
            for (String word : words) {
                this.words.add(word.toLowerCase(Locale.ROOT));
            }
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public boolean isWord(String lowercaseToken) {
            return words.contains(lowercaseToken);
        }
    }
}
