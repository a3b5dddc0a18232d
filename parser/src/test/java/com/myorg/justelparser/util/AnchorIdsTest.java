package com.myorg.justelparser.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AnchorIds Tests")
class AnchorIdsTest {

    @Test
    @DisplayName("should slug plain and suffixed article numbers")
    void shouldSlugArticleNumbers_whenPlainOrSuffixed() {
        assertThat(AnchorIds.forArticle("1er")).isEqualTo("art-1er");
        assertThat(AnchorIds.forArticle("2bis")).isEqualTo("art-2bis");
        assertThat(AnchorIds.forArticle("5/1")).isEqualTo("art-5-1");
    }

    @Test
    @DisplayName("should lowercase and dash multi-word labels")
    void shouldLowercaseAndDash_whenLabelHasWords() {
        assertThat(AnchorIds.forArticle("16 DROIT FUTUR")).isEqualTo("art-16-droit-futur");
        assertThat(AnchorIds.forArticle("  3  modifié ")).isEqualTo("art-3-modifie");
    }

    @Test
    @DisplayName("should drop a leading Art. prefix")
    void shouldDropPrefix_whenLabelStartsWithArt() {
        assertThat(AnchorIds.forArticle("Art. 3")).isEqualTo("art-3");
        assertThat(AnchorIds.forArticle("Article 12ter")).isEqualTo("art-12ter");
    }

    @Test
    @DisplayName("should build paragraph anchors under the article anchor")
    void shouldBuildParagraphAnchor() {
        assertThat(AnchorIds.forParagraph("art-4", "2")).isEqualTo("art-4-par-2");
    }

    @Test
    @DisplayName("should reject blank article numbers")
    void shouldReject_whenBlank() {
        assertThatThrownBy(() -> AnchorIds.forArticle(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
