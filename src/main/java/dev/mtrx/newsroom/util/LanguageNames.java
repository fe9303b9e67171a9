package dev.mtrx.newsroom.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical names of the supported languages and their ISO 639-1 codes.
 * Feed configuration may use either form in any case ("French", "fr", "FR").
 */
public final class LanguageNames {

    public static final String ENGLISH = "english";
    public static final String SPANISH = "spanish";
    public static final String ARABIC = "arabic";
    public static final String PORTUGUESE = "portuguese";
    public static final String FRENCH = "french";
    public static final String CHINESE = "chinese";
    public static final String JAPANESE = "japanese";

    public static final List<String> SUPPORTED = List.of(
            ENGLISH, SPANISH, ARABIC, PORTUGUESE, FRENCH, CHINESE, JAPANESE);

    private static final Map<String, String> CODES = Map.of(
            "en", ENGLISH,
            "es", SPANISH,
            "ar", ARABIC,
            "pt", PORTUGUESE,
            "fr", FRENCH,
            "zh", CHINESE,
            "ja", JAPANESE);

    private LanguageNames() {}

    /**
     * Canonical name for a name or code; region suffixes ("pt-BR", "zh_CN") are ignored.
     */
    public static Optional<String> normalize(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String lower = value.trim().toLowerCase(Locale.ROOT);
        if (SUPPORTED.contains(lower)) return Optional.of(lower);
        String primary = lower.split("[-_]", 2)[0];
        return Optional.ofNullable(CODES.get(primary));
    }

    public static boolean isSupported(String value) {
        return normalize(value).isPresent();
    }

    /**
     * Display form for prompts: "french" -> "French".
     */
    public static String displayName(String canonical) {
        if (canonical == null || canonical.isEmpty()) return canonical;
        return Character.toUpperCase(canonical.charAt(0)) + canonical.substring(1);
    }
}
