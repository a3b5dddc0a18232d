package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of change an amending act made, derived from the citation prefix
 * ("Inséré par", "Remplacé par", ...).
 */
public enum ModificationType {
    MODIFICATION,
    INSERTION,
    ABROGATION,
    REPLACEMENT;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ModificationType fromWireName(String value) {
        return value == null ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Maps a citation prefix to a modification type. No prefix means a plain modification.
     */
    public static ModificationType fromPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return MODIFICATION;
        String p = prefix.toLowerCase(Locale.ROOT);
        if (p.contains("inséré") || p.contains("insere")) return INSERTION;
        if (p.contains("abrogé") || p.contains("abroge")) return ABROGATION;
        if (p.contains("remplacé") || p.contains("remplace")) return REPLACEMENT;
        return MODIFICATION;
    }
}
