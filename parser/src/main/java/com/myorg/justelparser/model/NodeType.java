package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural node types found in consolidated Belgian legal texts.
 */
public enum NodeType {
    LIVRE("livre"),
    TITRE("titre"),
    ANNEXE("annexe"),
    CHAPITRE("chapitre"),
    SECTION("section"),
    SOUS_SECTION("sous-section"),
    ARTICLE("article");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isContainer() {
        return this != ARTICLE;
    }

    @JsonCreator
    public static NodeType fromWireName(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase();
        for (NodeType t : values()) {
            if (t.wireName.equals(v) || t.name().equalsIgnoreCase(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + value);
    }
}
