package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.DocumentNode;
import com.myorg.justelparser.model.NodeType;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a finished tree: sibling (type, label) uniqueness, document-wide anchor uniqueness,
 * containment rules and article leaves. Used on built trees and on hand-corrected ones.
 */
@RequiredArgsConstructor
public class HierarchyValidator {

    private final HeadingGrammar grammar;

    public List<String> findViolations(List<DocumentNode> roots) {
        List<String> violations = new ArrayList<>();
        check(null, roots, "(root)", new HashSet<>(), violations);
        return violations;
    }

    public void validate(String dossierNumber, List<DocumentNode> roots) {
        List<String> violations = findViolations(roots);
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid hierarchy for " + dossierNumber + ": " + String.join("; ", violations));
        }
    }

    private void check(DocumentNode parent, List<DocumentNode> children, String path,
                       Set<String> anchors, List<String> violations) {
        Set<String> siblingKeys = new HashSet<>();
        for (DocumentNode child : children) {
            if (child.getType() == null) {
                violations.add("Node without type under " + path);
                continue;
            }
            String where = path + " > " + child.getLabel();
            if (!siblingKeys.add(child.getType().getWireName() + "|" + child.getLabel())) {
                violations.add("Duplicate sibling " + where);
            }
            NodeType parentType = parent == null ? null : parent.getType();
            if (!grammar.canContain(parentType, child.getType())) {
                violations.add(child.getType().getWireName() + " not allowed under "
                        + (parentType == null ? "root" : parentType.getWireName()) + " at " + where);
            }
            if (child.isArticle()) {
                if (child.getArticleContent() == null) {
                    violations.add("Article without content at " + where);
                } else if (!anchors.add(child.getArticleContent().getAnchorId())) {
                    violations.add("Duplicate anchor " + child.getArticleContent().getAnchorId() + " at " + where);
                }
                if (!child.getChildren().isEmpty()) {
                    violations.add("Article with children at " + where);
                }
            } else {
                check(child, child.getChildren(), where, anchors, violations);
            }
        }
    }
}
