package com.myorg.justelparser.service.processing;

import java.util.Objects;

/**
 * Builds links to the consolidated text of an act from its dossier number.
 */
public class LegalUrlTemplate {

    private final String template;

    public LegalUrlTemplate(String template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    public String directUrl(String dossierNumber) {
        if (dossierNumber == null || dossierNumber.isBlank()) return null;
        String dossier = dossierNumber.trim();
        return template
                .replace("{dossier}", dossier)
                .replace("{cn}", dossier.replaceAll("\\D", ""));
    }

    public String directArticleUrl(String dossierNumber, String articleNumber) {
        String base = directUrl(dossierNumber);
        if (base == null || articleNumber == null || articleNumber.isBlank()) return null;
        return base + "#Art." + articleNumber.trim();
    }
}
