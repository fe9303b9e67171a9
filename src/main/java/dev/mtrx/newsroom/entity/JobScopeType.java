package dev.mtrx.newsroom.entity;

/**
 * What a translation job translates: a whole newsletter issue or a single article.
 */
public enum JobScopeType {
    ISSUE,
    ARTICLE;

    public boolean matches(String scopeType) {
        return this.name().equals(scopeType);
    }
}
