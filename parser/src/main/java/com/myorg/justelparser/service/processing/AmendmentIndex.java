package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.DocumentMetadata;
import com.myorg.justelparser.model.ModificationType;
import com.myorg.justelparser.model.source.AmendmentDeclaration;
import com.myorg.justelparser.model.source.SourceDocument;
import com.myorg.justelparser.util.DateNormalizer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of every "document A amends document B" declaration in a corpus,
 * keyed by the amended dossier. Built once, before linking.
 */
@Slf4j
public final class AmendmentIndex {

    private final Map<String, List<Entry>> byTarget;

    private AmendmentIndex(Map<String, List<Entry>> byTarget) {
        this.byTarget = byTarget;
    }

    public static AmendmentIndex harvest(Collection<SourceDocument> sources) {
        Map<String, List<Entry>> collected = new LinkedHashMap<>();
        for (SourceDocument source : sources) {
            String amending = source == null ? null : dossierOf(source);
            if (amending == null) continue;
            DocumentMetadata meta = source.getMetadata();
            for (AmendmentDeclaration decl : source.getAmends()) {
                String target = decl.getTargetDossierNumber() == null ? null : decl.getTargetDossierNumber().trim();
                if (target == null || target.isEmpty()) {
                    log.warn("Amendment declaration without target in {}", amending);
                    continue;
                }
                if (target.equals(amending)) {
                    log.warn("Ignoring self-amendment declared by {}", amending);
                    continue;
                }
                collected.computeIfAbsent(target, k -> new ArrayList<>()).add(new Entry(
                        amending,
                        meta == null ? null : DateNormalizer.toIso(meta.getPublicationDate()),
                        decl.getModifiedArticles(),
                        meta == null ? null : meta.getOfficialUrl(),
                        meta == null ? null : meta.getTitle(),
                        decl.getModificationType() == null ? ModificationType.MODIFICATION : decl.getModificationType(),
                        target));
            }
        }
        Map<String, List<Entry>> frozen = new LinkedHashMap<>();
        collected.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new AmendmentIndex(Map.copyOf(frozen));
    }

    public List<Entry> amendmentsOf(String targetDossier) {
        return byTarget.getOrDefault(targetDossier, List.of());
    }

    public Collection<String> targets() {
        return byTarget.keySet();
    }

    public int size() {
        int n = 0;
        for (List<Entry> l : byTarget.values()) n += l.size();
        return n;
    }

    static String dossierOf(SourceDocument source) {
        String d = source.getDossierNumber();
        if ((d == null || d.isBlank()) && source.getMetadata() != null) d = source.getMetadata().getDossierNumber();
        return d == null || d.isBlank() ? null : d.trim();
    }

    @Getter
    public static final class Entry {
        private final String amendingDossier;
        private final String publicationDate;
        private final List<String> modifiedArticles;
        private final String sourceUrl;
        private final String fullTitle;
        private final ModificationType modificationType;
        private final String targetDossier;

        Entry(String amendingDossier, String publicationDate, List<String> modifiedArticles, String sourceUrl,
              String fullTitle, ModificationType modificationType, String targetDossier) {
            this.amendingDossier = amendingDossier;
            this.publicationDate = publicationDate;
            this.modifiedArticles = List.copyOf(modifiedArticles);
            this.sourceUrl = sourceUrl;
            this.fullTitle = fullTitle;
            this.modificationType = modificationType;
            this.targetDossier = targetDossier;
        }
    }
}
