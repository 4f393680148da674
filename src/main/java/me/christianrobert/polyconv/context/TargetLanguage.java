package me.christianrobert.polyconv.context;

/**
 * Languages the converter emits. The code matches the fixture keys of the polyglot corpus.
 */
public enum TargetLanguage {
    JAVA("java"),
    JAVASCRIPT("js"),
    RUBY("rb");

    private final String code;

    TargetLanguage(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a corpus code ("java", "js", "rb") or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static TargetLanguage fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Target language code cannot be null");
        }
        String normalized = code.trim();
        for (TargetLanguage language : values()) {
            if (language.code.equalsIgnoreCase(normalized) || language.name().equalsIgnoreCase(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown target language: " + code);
    }
}
