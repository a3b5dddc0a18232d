package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.ArticleContent;
import com.myorg.justelparser.model.DocumentNode;
import com.myorg.justelparser.model.ExtractionStatistics;

import java.util.List;

public final class DocumentStatistics {

    private DocumentStatistics() {}

    public static ExtractionStatistics of(List<DocumentNode> roots) {
        int[] counts = new int[4];
        walk(roots, counts);
        return ExtractionStatistics.builder()
                .totalArticles(counts[0])
                .totalFootnotes(counts[1])
                .totalFootnoteReferences(counts[2])
                .totalProvisions(counts[3])
                .build();
    }

    private static void walk(List<DocumentNode> nodes, int[] counts) {
        for (DocumentNode node : nodes) {
            ArticleContent c = node.getArticleContent();
            if (node.isArticle() && c != null) {
                counts[0]++;
                counts[1] += c.getFootnotes().size();
                counts[2] += c.getFootnoteReferences().size();
                counts[3] += c.getNumberedProvisions().size();
            }
            walk(node.getChildren(), counts);
        }
    }
}
