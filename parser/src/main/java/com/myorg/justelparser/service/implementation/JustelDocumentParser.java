package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.exception.StructuralConflictException;
import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.AbrogationInfo;
import com.myorg.justelparser.model.CompletenessFlags;
import com.myorg.justelparser.model.DocumentMetadata;
import com.myorg.justelparser.model.DocumentNode;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.ExternalLinks;
import com.myorg.justelparser.model.ExtractionMetadata;
import com.myorg.justelparser.model.ExtractionStatistics;
import com.myorg.justelparser.model.IssueKind;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ParseIssue;
import com.myorg.justelparser.model.ParseStatus;
import com.myorg.justelparser.model.References;
import com.myorg.justelparser.model.source.EventKind;
import com.myorg.justelparser.model.source.SourceDocument;
import com.myorg.justelparser.model.source.SourceEvent;
import com.myorg.justelparser.service.DocumentParser;
import com.myorg.justelparser.service.HandCorrectionStore;
import com.myorg.justelparser.service.processing.AbrogationInfoExtractor;
import com.myorg.justelparser.service.processing.ArticleProcessor;
import com.myorg.justelparser.service.processing.ArticleProcessor.ArticleOutcome;
import com.myorg.justelparser.service.processing.DocumentStatistics;
import com.myorg.justelparser.service.processing.HierarchyBuilder;
import com.myorg.justelparser.service.processing.HierarchyValidator;
import com.myorg.justelparser.util.DateNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-document pipeline: override lookup, article processing, hierarchy build and
 * assembly of the output record.
 */
@Slf4j
@RequiredArgsConstructor
public class JustelDocumentParser implements DocumentParser {

    private final HandCorrectionStore handCorrections;
    private final ArticleProcessor articleProcessor;
    private final HierarchyBuilder hierarchyBuilder;
    private final HierarchyValidator hierarchyValidator;
    private final AbrogationInfoExtractor abrogationInfoExtractor;
    private final Clock clock;

    @Override
    public DocumentParseResult parse(SourceDocument source) {
        if (source == null) {
            throw new ValidationException("Source document must not be null");
        }
        String dossier = dossierOf(source);

        Optional<LegalDocument> override = handCorrections.find(dossier);
        if (override.isPresent()) {
            log.info("Using hand-corrected tree for {}", dossier);
            return DocumentParseResult.builder()
                    .dossierNumber(dossier)
                    .status(ParseStatus.HAND_CORRECTED)
                    .document(markHandCorrected(dossier, override.get()))
                    .build();
        }

        List<SourceEvent> events = source.getEvents();
        List<ParseIssue> issues = new ArrayList<>();
        Map<Integer, ArticleOutcome> articles = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            SourceEvent event = events.get(i);
            if (event == null || event.getKind() == null) {
                throw new ValidationException("Event #" + i + " of " + dossier + " has no kind");
            }
            if (event.getKind() == EventKind.ARTICLE) {
                ArticleOutcome outcome = articleProcessor.process(event, dossier);
                articles.put(i, outcome);
                issues.addAll(outcome.getIssues());
            }
        }

        List<DocumentNode> hierarchy;
        boolean conflict = false;
        try {
            hierarchy = hierarchyBuilder.build(events, articles);
            List<String> violations = hierarchyValidator.findViolations(hierarchy);
            if (!violations.isEmpty()) {
                throw new IllegalStateException("Built hierarchy of " + dossier + " breaks hierarchy rules: " + violations);
            }
        } catch (StructuralConflictException e) {
            log.warn("Structural conflict in {}: {}", dossier, e.getMessage());
            issues.add(ParseIssue.builder()
                    .kind(IssueKind.STRUCTURAL_CONFLICT)
                    .message(e.getMessage())
                    .build());
            hierarchy = List.of();
            conflict = true;
        }

        DocumentMetadata metadata = normalizeMetadata(dossier, source.getMetadata());
        AbrogationInfo abrogation = abrogationInfoExtractor.extract(source.getAbrogationText()).orElse(null);
        ExtractionStatistics statistics = DocumentStatistics.of(hierarchy);

        boolean bracketsBalanced = none(issues, IssueKind.BRACKET_MISMATCH);
        CompletenessFlags flags = CompletenessFlags.builder()
                .allArticlesExtracted(!conflict)
                .footnotesLinked(none(issues, IssueKind.DANGLING_FOOTNOTE_REFERENCE))
                .bracketsBalanced(bracketsBalanced)
                .citationsParsed(none(issues, IssueKind.CITATION_PARSE_ERROR))
                .hierarchicalStructureComplete(!conflict)
                .metadataComplete(metadata.isComplete())
                .preambleExtracted(source.getPreamble() != null && !source.getPreamble().isBlank())
                .abrogatedDocument(abrogation != null)
                .handCorrected(false)
                .requiresReview(conflict || !bracketsBalanced)
                .build();

        LegalDocument document = LegalDocument.builder()
                .documentMetadata(metadata)
                .preamble(source.getPreamble())
                .abrogationInfo(abrogation)
                .documentHierarchy(hierarchy)
                .references(References.empty())
                .externalLinks(source.getExternalLinks() == null ? ExternalLinks.empty() : source.getExternalLinks())
                .extractionMetadata(ExtractionMetadata.builder()
                        .extractionDate(clock.instant())
                        .sourceDossier(dossier)
                        .handCorrected(false)
                        .statistics(statistics)
                        .completenessFlags(flags)
                        .issues(issues)
                        .build())
                .build();

        log.info("Parsed {}: {} article(s), {} issue(s){}", dossier, statistics.getTotalArticles(), issues.size(),
                conflict ? ", CONFLICT" : "");
        return DocumentParseResult.builder()
                .dossierNumber(dossier)
                .status(conflict ? ParseStatus.CONFLICT : ParseStatus.PARSED)
                .document(document)
                .errorMessage(conflict ? "Structural conflict, hand-correction required" : null)
                .build();
    }

    private LegalDocument markHandCorrected(String dossier, LegalDocument corrected) {
        hierarchyValidator.validate(dossier, corrected.getDocumentHierarchy());
        ExtractionMetadata existing = corrected.getExtractionMetadata();
        ExtractionMetadata.ExtractionMetadataBuilder meta = existing == null
                ? ExtractionMetadata.builder().sourceDossier(dossier).extractionDate(clock.instant())
                : existing.toBuilder();
        CompletenessFlags flags = existing == null || existing.getCompletenessFlags() == null
                ? CompletenessFlags.builder()
                        .allArticlesExtracted(true)
                        .footnotesLinked(true)
                        .bracketsBalanced(true)
                        .citationsParsed(true)
                        .hierarchicalStructureComplete(true)
                        .metadataComplete(corrected.getDocumentMetadata() != null && corrected.getDocumentMetadata().isComplete())
                        .preambleExtracted(corrected.getPreamble() != null && !corrected.getPreamble().isBlank())
                        .abrogatedDocument(corrected.getAbrogationInfo() != null)
                        .build()
                : existing.getCompletenessFlags();
        return corrected.toBuilder()
                .references(corrected.getReferences() == null ? References.empty() : corrected.getReferences())
                .extractionMetadata(meta
                        .handCorrected(true)
                        .statistics(DocumentStatistics.of(corrected.getDocumentHierarchy()))
                        .completenessFlags(flags.toBuilder().handCorrected(true).requiresReview(false).build())
                        .build())
                .build();
    }

    private static DocumentMetadata normalizeMetadata(String dossier, DocumentMetadata supplied) {
        DocumentMetadata m = supplied == null ? DocumentMetadata.builder().build() : supplied;
        String endValidity = DateNormalizer.toIso(m.getEndValidityDate());
        String status = m.getStatus();
        if (status == null || status.isBlank()) {
            status = endValidity == null || endValidity.isBlank()
                    ? DocumentMetadata.STATUS_ACTIVE : DocumentMetadata.STATUS_ABROGATED;
        }
        return m.toBuilder()
                .dossierNumber(dossier)
                .language(m.getLanguage() == null ? "fr" : m.getLanguage())
                .publicationDate(DateNormalizer.toIso(m.getPublicationDate()))
                .effectiveDate(DateNormalizer.toIso(m.getEffectiveDate()))
                .endValidityDate(endValidity)
                .status(status)
                .build();
    }

    private static String dossierOf(SourceDocument source) {
        String d = source.getDossierNumber();
        if ((d == null || d.isBlank()) && source.getMetadata() != null) {
            d = source.getMetadata().getDossierNumber();
        }
        if (d == null || d.isBlank()) {
            throw new ValidationException("Source document has no dossier_number");
        }
        return d.trim();
    }

    private static boolean none(List<ParseIssue> issues, IssueKind kind) {
        for (ParseIssue i : issues) {
            if (i.getKind() == kind) return false;
        }
        return true;
    }
}
