package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.StructuralConflictException;
import com.myorg.justelparser.model.ArticleContent;
import com.myorg.justelparser.model.DocumentNode;
import com.myorg.justelparser.model.NodeType;
import com.myorg.justelparser.model.source.EventKind;
import com.myorg.justelparser.model.source.SourceEvent;
import com.myorg.justelparser.service.processing.ArticleProcessor.ArticleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds the document tree from the flat event stream with an explicit container stack.
 *
 * <p>Duplicate sibling containers (same type and label) are merged: the existing node goes
 * back on the stack and later children append to it in source order. An article whose
 * anchor is already taken is dropped when it repeats the same body in the same container;
 * every other anchor collision is a {@link StructuralConflictException}.
 */
@Slf4j
@RequiredArgsConstructor
public class HierarchyBuilder {

    private final HeadingGrammar grammar;

    /**
     * @param events   the document's events in source order
     * @param articles processed articles keyed by event index
     */
    public List<DocumentNode> build(List<SourceEvent> events, Map<Integer, ArticleOutcome> articles)
            throws StructuralConflictException {
        Node root = new Node(null, null, null, null, 0, -1, null);
        Deque<Node> stack = new ArrayDeque<>();
        Map<String, Node> articlesByAnchor = new HashMap<>();

        for (int i = 0; i < events.size(); i++) {
            SourceEvent event = events.get(i);
            if (event.getKind() == EventKind.HEADING) {
                openHeading(event, i, root, stack);
            } else if (event.getKind() == EventKind.ARTICLE) {
                ArticleOutcome outcome = articles.get(i);
                if (outcome == null) {
                    throw new IllegalStateException("No processed article for event #" + i);
                }
                attachArticle(outcome, i, root, stack, articlesByAnchor);
            }
        }
        return root.freezeChildren();
    }

    private void openHeading(SourceEvent event, int index, Node root, Deque<Node> stack) {
        NodeType type = event.getType() != null ? event.getType() : grammar.classify(event.getTitleType());
        if (type == NodeType.ARTICLE) {
            // an article heading without a body carries no content to attach
            log.debug("Ignoring article-typed heading event #{}: {}", index, event.getTitleType());
            return;
        }
        while (!stack.isEmpty() && !grammar.canContain(stack.peek().type, type)) {
            stack.pop();
        }
        Node parent = stack.isEmpty() ? root : stack.peek();
        String label = label(event);

        Node existing = parent.findChild(type, label);
        if (existing != null) {
            log.debug("Merging duplicate {} '{}' (event #{}) into event #{}",
                    type.getWireName(), label, index, existing.sourceIndex);
            stack.push(existing);
            return;
        }

        int rank = event.getRank() != null ? event.getRank() : grammar.rankOf(type);
        Node node = new Node(type, label, trimToNull(event.getTitleType()), trimToNull(event.getTitleContent()),
                rank, index, parent);
        parent.children.add(node);
        stack.push(node);
    }

    private void attachArticle(ArticleOutcome outcome, int index, Node root, Deque<Node> stack,
                               Map<String, Node> articlesByAnchor) throws StructuralConflictException {
        Node parent = stack.isEmpty() ? root : stack.peek();
        ArticleContent content = outcome.getContent();

        Node prior = articlesByAnchor.get(content.getAnchorId());
        if (prior != null) {
            String first = location(prior);
            String second = "event #" + index + " " + path(parent) + " > Art. " + content.getArticleNumber();
            if (prior.parent != parent) {
                throw new StructuralConflictException(
                        "Article anchor " + content.getAnchorId() + " appears under two containers", first, second);
            }
            if (!Objects.equals(prior.rawBody, outcome.getRawBody())) {
                throw new StructuralConflictException(
                        "Article anchor " + content.getAnchorId() + " repeated with different content", first, second);
            }
            log.debug("Dropping identical duplicate of {} at event #{}", content.getAnchorId(), index);
            return;
        }

        Node node = new Node(NodeType.ARTICLE, "Art. " + content.getArticleNumber(), null, null,
                grammar.rankOf(NodeType.ARTICLE), index, parent);
        node.content = content;
        node.rawBody = outcome.getRawBody();
        parent.children.add(node);
        articlesByAnchor.put(content.getAnchorId(), node);
    }

    private static String label(SourceEvent event) {
        String type = event.getTitleType() == null ? "" : event.getTitleType().trim();
        String content = event.getTitleContent() == null ? "" : event.getTitleContent().trim();
        return (type + " " + content).trim();
    }

    private static String location(Node node) {
        return "event #" + node.sourceIndex + " " + path(node.parent) + " > " + node.label;
    }

    private static String path(Node container) {
        List<String> labels = new ArrayList<>();
        for (Node n = container; n != null && n.type != null; n = n.parent) labels.add(0, n.label);
        return labels.isEmpty() ? "(root)" : String.join(" > ", labels);
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static final class Node {
        final NodeType type;
        final String label;
        final String titleType;
        final String titleContent;
        final int rank;
        final int sourceIndex;
        final Node parent;
        final List<Node> children = new ArrayList<>();
        ArticleContent content;
        String rawBody;

        Node(NodeType type, String label, String titleType, String titleContent, int rank, int sourceIndex, Node parent) {
            this.type = type;
            this.label = label;
            this.titleType = titleType;
            this.titleContent = titleContent;
            this.rank = rank;
            this.sourceIndex = sourceIndex;
            this.parent = parent;
        }

        Node findChild(NodeType type, String label) {
            for (Node c : children) {
                if (c.type == type && c.label.equals(label)) return c;
            }
            return null;
        }

        List<DocumentNode> freezeChildren() {
            List<DocumentNode> out = new ArrayList<>(children.size());
            for (Node c : children) out.add(c.freeze());
            return out;
        }

        DocumentNode freeze() {
            return DocumentNode.builder()
                    .type(type)
                    .label(label)
                    .titleType(titleType)
                    .titleContent(titleContent)
                    .rank(rank)
                    .children(freezeChildren())
                    .articleContent(content)
                    .sourceIndex(sourceIndex)
                    .build();
        }
    }
}
