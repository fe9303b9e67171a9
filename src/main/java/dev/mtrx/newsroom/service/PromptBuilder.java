package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.util.HtmlUtils;
import dev.mtrx.newsroom.util.LanguageNames;

/**
 * Prompt texts sent to the language model.
 */
public final class PromptBuilder {

    static final String SUMMARY_PREFIX = "You are an expert at creating concise, informative news summaries.";
    static final String TITLE_LABEL = "Title: ";
    static final String DESCRIPTION_LABEL = "Description: ";
    static final String CONTENT_LABEL = "Content: ";
    static final String RETURN_ONLY = "Return ONLY the requested text, no explanations or additional text.";

    // Bodies are cut before prompting to keep requests inside the model's context window
    static final int MAX_CONTENT_CHARS = 6000;

    private PromptBuilder() {}

    public static String buildSummaryPrompt(Article article, String language, int maxLength) {
        String languageName = LanguageNames.displayName(language);
        StringBuilder prompt = new StringBuilder(SUMMARY_PREFIX)
                .append(" Summarize the following article in ").append(languageName).append(".\n\n")
                .append("Requirements:\n")
                .append("- Maximum length: ").append(maxLength).append(" characters\n")
                .append("- Write in paragraph format\n")
                .append("- Focus on the most important information\n")
                .append("- ").append(RETURN_ONLY).append("\n\n");

        prompt.append(TITLE_LABEL).append(nullToEmpty(article.getTitle())).append('\n');
        String description = HtmlUtils.toPlainText(article.getDescription());
        if (!description.isEmpty()) {
            prompt.append(DESCRIPTION_LABEL).append(description).append('\n');
        }
        String content = HtmlUtils.toPlainText(article.getContent());
        if (!content.isEmpty()) {
            prompt.append(CONTENT_LABEL).append(HtmlUtils.truncate(content, MAX_CONTENT_CHARS)).append('\n');
        }
        return prompt.toString();
    }

    /**
     * @param sourceLanguage may be null when the article's language is unknown
     */
    public static String buildTranslationPrompt(String text, String sourceLanguage, String targetLanguage) {
        String source = sourceLanguage != null ? LanguageNames.displayName(sourceLanguage) : "source-language";
        return "You are a professional translator. Translate the following " + source + " text to "
                + LanguageNames.displayName(targetLanguage) + ".\n\n"
                + "Requirements:\n"
                + "- Maintain the original meaning and tone\n"
                + "- Keep proper nouns and technical terms accurate\n"
                + "- " + RETURN_ONLY + "\n\n"
                + "Text to translate:\n"
                + HtmlUtils.truncate(text, MAX_CONTENT_CHARS);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
