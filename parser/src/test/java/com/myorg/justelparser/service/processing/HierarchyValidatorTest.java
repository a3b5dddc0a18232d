package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.ArticleContent;
import com.myorg.justelparser.model.DocumentNode;
import com.myorg.justelparser.model.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HierarchyValidator Tests")
class HierarchyValidatorTest {

    private final HierarchyValidator validator = new HierarchyValidator(new HeadingGrammar());

    @Test
    @DisplayName("should accept a well-formed tree")
    void shouldReturnNoViolations_whenTreeValid() {
        List<DocumentNode> roots = List.of(container(NodeType.CHAPITRE, "CHAPITRE I",
                container(NodeType.SECTION, "Section 1", article("1")), article("2")));

        assertThat(validator.findViolations(roots)).isEmpty();
    }

    @Test
    @DisplayName("should report duplicate siblings")
    void shouldReport_whenSiblingsDuplicate() {
        List<DocumentNode> roots = List.of(
                container(NodeType.CHAPITRE, "CHAPITRE I", article("1")),
                container(NodeType.CHAPITRE, "CHAPITRE I", article("2")));

        assertThat(validator.findViolations(roots)).singleElement().asString().startsWith("Duplicate sibling");
    }

    @Test
    @DisplayName("should report an anchor used twice anywhere in the document")
    void shouldReport_whenAnchorRepeatsAcrossContainers() {
        List<DocumentNode> roots = List.of(
                container(NodeType.CHAPITRE, "CHAPITRE I", article("1")),
                container(NodeType.CHAPITRE, "CHAPITRE II", article("1")));

        assertThat(validator.findViolations(roots)).singleElement().asString().contains("Duplicate anchor art-1");
    }

    @Test
    @DisplayName("should report containers placed under a lower level")
    void shouldReport_whenContainmentBroken() {
        List<DocumentNode> roots = List.of(container(NodeType.SECTION, "Section 1",
                container(NodeType.CHAPITRE, "CHAPITRE I", article("1"))));

        assertThat(validator.findViolations(roots)).singleElement().asString()
                .contains("chapitre not allowed under section");
    }

    @Test
    @DisplayName("should report articles with children or without content")
    void shouldReport_whenArticleMalformed() {
        DocumentNode withChildren = article("1").toBuilder().children(List.of(article("2"))).build();
        DocumentNode empty = DocumentNode.builder().type(NodeType.ARTICLE).label("Art. 3").build();

        List<String> violations = validator.findViolations(List.of(withChildren, empty));

        assertThat(violations).hasSize(2);
        assertThat(violations).anyMatch(v -> v.startsWith("Article with children"));
        assertThat(violations).anyMatch(v -> v.startsWith("Article without content"));
    }

    @Test
    @DisplayName("should throw with the dossier number when validating a broken tree")
    void shouldThrow_whenValidateFails() {
        List<DocumentNode> roots = List.of(article("1"), article("1"));

        assertThatThrownBy(() -> validator.validate("2001-01-01/10", roots))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("2001-01-01/10");
    }

    private static DocumentNode container(NodeType type, String label, DocumentNode... children) {
        return DocumentNode.builder().type(type).label(label).children(List.of(children)).build();
    }

    private static DocumentNode article(String number) {
        return DocumentNode.builder()
                .type(NodeType.ARTICLE)
                .label("Art. " + number)
                .articleContent(ArticleContent.builder().articleNumber(number).anchorId("art-" + number).build())
                .build();
    }
}
