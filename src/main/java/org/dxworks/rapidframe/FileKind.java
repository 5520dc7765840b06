package org.dxworks.rapidframe;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum FileKind {
    MODULE("module", List.of(".mod", ".modx")),
    PROGRAM("program", List.of(".prg")),
    SYSTEM("system", List.of(".sys", ".sysx")),
    CONFIG("config", List.of(".cfg"));

    private final String name;
    private final List<String> extensions;

    FileKind(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    public boolean isRapidCode() {
        return this != CONFIG;
    }

    public static Optional<FileKind> detect(String fileName) {
        for (FileKind kind : values()) {
            if (kind.matchesFileName(fileName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Kind for a file identity handed to the engine. Identities without a known
     * extension are treated as plain modules.
     */
    public static FileKind fromIdentity(String fileId) {
        return detect(fileId).orElse(MODULE);
    }
}
