package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * One node of the document hierarchy: a structural container (chapitre, section, ...)
 * or an article leaf carrying its {@link ArticleContent}.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentNode {

    @JsonProperty("type")
    private NodeType type;

    /** Raw heading text, e.g. "CHAPITRE V - Dispositions finales" or "Art. 2bis". */
    @JsonProperty("label")
    private String label;

    @JsonProperty("title_type")
    private String titleType;

    @JsonProperty("title_content")
    private String titleContent;

    /** Fixed per-type ordinal, not the depth in the tree. */
    @JsonProperty("rank")
    private Integer rank;

    @Builder.Default
    @JsonProperty("children")
    private List<DocumentNode> children = List.of();

    @JsonProperty("article_content")
    private ArticleContent articleContent;

    // index of the event this node came from; null for hand-corrected trees
    @JsonProperty("source_index")
    private Integer sourceIndex;

    public List<DocumentNode> getChildren() {
        return children == null ? List.of() : List.copyOf(children);
    }

    @JsonIgnore
    public boolean isArticle() {
        return type == NodeType.ARTICLE;
    }
}
