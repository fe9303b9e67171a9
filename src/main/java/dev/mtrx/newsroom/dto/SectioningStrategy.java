package dev.mtrx.newsroom.dto;

/**
 * How {@code assignArticles} groups the selected articles into sections.
 */
public enum SectioningStrategy {
    /** Everything in one "headlines" section. */
    SINGLE_SECTION,
    /** One section per feed category, in first-seen order. */
    BY_CATEGORY,
    /** One section per detected language, in first-seen order. */
    BY_LANGUAGE
}
