package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.DocumentMetadata;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ModificationRecord;
import com.myorg.justelparser.model.References;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Populates {@code references.modified_by} and {@code references.modifies} across a corpus.
 * Pure graph construction over already-parsed documents: inputs are never modified, linked
 * copies are returned in input order.
 */
@Slf4j
public class ModificationHistoryLinker {

    static final Comparator<ModificationRecord> RECORD_ORDER =
            Comparator.comparing(ModificationRecord::getPublicationDate, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(ModificationRecord::getDossierNumber, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<LegalDocument> link(List<LegalDocument> documents, AmendmentIndex index) {
        Map<String, LegalDocument> byDossier = new LinkedHashMap<>();
        for (LegalDocument doc : documents) {
            String dossier = doc.getDossierNumber();
            if (dossier == null) continue;
            if (byDossier.putIfAbsent(dossier, doc) != null) {
                log.warn("Dossier {} appears twice in corpus; linking the first occurrence", dossier);
            }
        }

        Map<String, List<ModificationRecord>> modifiedBy = new HashMap<>();
        Map<String, List<ModificationRecord>> modifies = new HashMap<>();
        for (String target : index.targets()) {
            LegalDocument targetDoc = byDossier.get(target);
            if (targetDoc == null) {
                log.info("Amended dossier {} not in corpus; {} declaration(s) left unlinked",
                        target, index.amendmentsOf(target).size());
                continue;
            }
            for (AmendmentIndex.Entry e : index.amendmentsOf(target)) {
                if (!byDossier.containsKey(e.getAmendingDossier())) {
                    log.debug("Amending dossier {} has no parsed document; skipping edge to {}", e.getAmendingDossier(), target);
                    continue;
                }
                modifiedBy.computeIfAbsent(target, k -> new ArrayList<>()).add(ModificationRecord.builder()
                        .dossierNumber(e.getAmendingDossier())
                        .publicationDate(e.getPublicationDate())
                        .modifiedArticles(e.getModifiedArticles())
                        .sourceUrl(e.getSourceUrl())
                        .fullTitle(e.getFullTitle())
                        .modificationType(e.getModificationType())
                        .build());

                DocumentMetadata targetMeta = targetDoc.getDocumentMetadata();
                modifies.computeIfAbsent(e.getAmendingDossier(), k -> new ArrayList<>()).add(ModificationRecord.builder()
                        .dossierNumber(target)
                        .publicationDate(e.getPublicationDate())
                        .modifiedArticles(e.getModifiedArticles())
                        .sourceUrl(targetMeta == null ? null : targetMeta.getOfficialUrl())
                        .fullTitle(targetMeta == null ? null : targetMeta.getTitle())
                        .modificationType(e.getModificationType())
                        .build());
            }
        }

        List<LegalDocument> linked = new ArrayList<>(documents.size());
        for (LegalDocument doc : documents) {
            String dossier = doc.getDossierNumber();
            if (dossier == null || byDossier.get(dossier) != doc) {
                linked.add(doc);
                continue;
            }
            List<ModificationRecord> in = sorted(modifiedBy.get(dossier));
            List<ModificationRecord> out = sorted(modifies.get(dossier));
            linked.add(doc.toBuilder()
                    .references(References.builder().modifiedBy(in).modifies(out).build())
                    .build());
        }
        log.info("Linked {} document(s) across {} amendment declaration(s)", byDossier.size(), index.size());
        return linked;
    }

    private static List<ModificationRecord> sorted(List<ModificationRecord> records) {
        if (records == null) return List.of();
        List<ModificationRecord> copy = new ArrayList<>(records);
        copy.sort(RECORD_ORDER);
        return List.copyOf(copy);
    }
}
