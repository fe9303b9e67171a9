package dev.mtrx.newsroom.util;

import org.jsoup.Jsoup;

/**
 * Shared HTML helpers for feed-sourced text.
 */
public final class HtmlUtils {

    private HtmlUtils() {}

    /**
     * Visible text of an HTML fragment: tags removed, entities decoded, whitespace collapsed.
     * Returns "" for null or blank input.
     */
    public static String toPlainText(String html) {
        if (html == null || html.isBlank()) return "";
        return Jsoup.parse(html).text().trim();
    }

    /**
     * Plain text of several fragments joined by a single space, skipping empty ones.
     */
    public static String joinPlainText(String... fragments) {
        StringBuilder sb = new StringBuilder();
        for (String fragment : fragments) {
            String text = toPlainText(fragment);
            if (text.isEmpty()) continue;
            if (!sb.isEmpty()) sb.append(' ');
            sb.append(text);
        }
        return sb.toString();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, maxLength);
    }
}
