package dev.mtrx.newsroom.dto;

/**
 * Result of classifying one article.
 *
 * @param language          canonical language name ("french"), or null when nothing could be determined
 * @param needsManualReview true when an editor has to confirm the language
 * @param confidence        0.0 - 1.0; 0 when the feed hint was used
 * @param method            how the language was obtained
 */
public record LanguageClassification(
        String language,
        boolean needsManualReview,
        double confidence,
        Method method
) {

    public enum Method {
        NONE,
        FEED_HINT,
        SCRIPT,
        STOP_WORDS
    }

    public static LanguageClassification undetermined() {
        return new LanguageClassification(null, true, 0.0, Method.NONE);
    }

    public static LanguageClassification fromHint(String hint) {
        return new LanguageClassification(hint, true, 0.0, hint != null ? Method.FEED_HINT : Method.NONE);
    }
}
