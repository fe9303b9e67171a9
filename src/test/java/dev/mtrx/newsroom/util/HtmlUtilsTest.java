package dev.mtrx.newsroom.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HtmlUtils")
class HtmlUtilsTest {

    @Nested
    @DisplayName("toPlainText")
    class ToPlainText {

        @Test
        @DisplayName("should strip tags and decode entities")
        void shouldStripTags() {
            assertThat(HtmlUtils.toPlainText("<p>Le <b>march&eacute;</b> &amp; la Bourse</p>"))
                    .isEqualTo("Le marché & la Bourse");
        }

        @Test
        @DisplayName("should collapse whitespace across block elements")
        void shouldCollapseWhitespace() {
            assertThat(HtmlUtils.toPlainText("<div>one</div>\n\n<div>  two  </div>")).isEqualTo("one two");
        }

        @Test
        @DisplayName("should return empty string for null or blank input")
        void shouldHandleNull() {
            assertThat(HtmlUtils.toPlainText(null)).isEmpty();
            assertThat(HtmlUtils.toPlainText("  ")).isEmpty();
        }
    }

    @Test
    @DisplayName("joinPlainText should skip empty fragments")
    void shouldJoinFragments() {
        assertThat(HtmlUtils.joinPlainText("<h1>Title</h1>", null, "", "<p>Body</p>")).isEqualTo("Title Body");
    }

    @Test
    @DisplayName("truncate should cut only over-long text")
    void shouldTruncate() {
        assertThat(HtmlUtils.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(HtmlUtils.truncate("abc", 3)).isEqualTo("abc");
        assertThat(HtmlUtils.truncate(null, 3)).isNull();
    }
}
