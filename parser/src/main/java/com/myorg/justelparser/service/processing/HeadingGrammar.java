package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.NodeType;
import lombok.Getter;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative heading table: how a title type is recognized, its canonical rank and which
 * containers may hold it directly. New heading conventions are new rows; the stack
 * algorithm in {@link HierarchyBuilder} never changes.
 */
public class HeadingGrammar {

    /** Rule order matters: "sous-section" must be tried before "section". */
    private static final List<HeadingRule> DEFAULT_RULES = List.of(
            rule(NodeType.LIVRE, "^livre\\b", 0),
            rule(NodeType.TITRE, "^titre\\b", 1, NodeType.LIVRE),
            rule(NodeType.ANNEXE, "^annexe\\b", 1, NodeType.LIVRE),
            rule(NodeType.CHAPITRE, "^chapitre\\b", 2, NodeType.LIVRE, NodeType.TITRE, NodeType.ANNEXE),
            rule(NodeType.SOUS_SECTION, "^sous-section\\b", 4,
                    NodeType.LIVRE, NodeType.TITRE, NodeType.ANNEXE, NodeType.CHAPITRE, NodeType.SECTION),
            rule(NodeType.SECTION, "^section\\b", 3,
                    NodeType.LIVRE, NodeType.TITRE, NodeType.ANNEXE, NodeType.CHAPITRE),
            rule(NodeType.ARTICLE, "^art(?:icle)?\\.?\\b", 5,
                    NodeType.LIVRE, NodeType.TITRE, NodeType.ANNEXE, NodeType.CHAPITRE,
                    NodeType.SECTION, NodeType.SOUS_SECTION));

    private final List<HeadingRule> rules;
    private final Map<NodeType, HeadingRule> byType = new EnumMap<>(NodeType.class);

    public HeadingGrammar() {
        this(DEFAULT_RULES);
    }

    public HeadingGrammar(List<HeadingRule> rules) {
        this.rules = List.copyOf(rules);
        for (HeadingRule r : this.rules) byType.putIfAbsent(r.getType(), r);
        for (NodeType t : NodeType.values()) {
            if (!byType.containsKey(t)) {
                throw new IllegalArgumentException("No heading rule for " + t.getWireName());
            }
        }
    }

    /**
     * Classifies a title type such as "CHAPITRE V" or "Sous-section 2". Anything
     * unrecognized is treated as a section.
     */
    public NodeType classify(String titleType) {
        if (titleType != null) {
            String t = titleType.trim();
            for (HeadingRule r : rules) {
                if (r.getType() != NodeType.ARTICLE && r.matches(t)) return r.getType();
            }
        }
        return NodeType.SECTION;
    }

    public HeadingRule rule(NodeType type) {
        return byType.get(type);
    }

    public int rankOf(NodeType type) {
        return byType.get(type).getRank();
    }

    /**
     * Whether {@code parent} may directly contain {@code child}. A null parent is the
     * document root, which may contain anything.
     */
    public boolean canContain(NodeType parent, NodeType child) {
        return parent == null || byType.get(child).getAllowedParents().contains(parent);
    }

    private static HeadingRule rule(NodeType type, String regex, int rank, NodeType... parents) {
        Set<NodeType> allowed = parents.length == 0 ? EnumSet.noneOf(NodeType.class) : EnumSet.of(parents[0], parents);
        return new HeadingRule(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), rank, allowed);
    }

    @Getter
    public static final class HeadingRule {
        private final NodeType type;
        private final Pattern matcher;
        private final int rank;
        private final Set<NodeType> allowedParents;

        public HeadingRule(NodeType type, Pattern matcher, int rank, Set<NodeType> allowedParents) {
            this.type = type;
            this.matcher = matcher;
            this.rank = rank;
            this.allowedParents = allowedParents.isEmpty()
                    ? EnumSet.noneOf(NodeType.class) : EnumSet.copyOf(allowedParents);
        }

        public boolean matches(String titleType) {
            return matcher.matcher(titleType).find();
        }

        public Set<NodeType> getAllowedParents() {
            return allowedParents.isEmpty() ? EnumSet.noneOf(NodeType.class) : EnumSet.copyOf(allowedParents);
        }
    }
}
