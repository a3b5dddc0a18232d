package com.myorg.justelparser.service.implementation;

import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.CorpusValidationResult;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.IssueKind;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.model.ParseIssue;
import com.myorg.justelparser.model.ParseStatus;
import com.myorg.justelparser.service.ValidationReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.*;

/**
 * Corpus validation report: one summary sheet plus one sheet per issue kind, so reviewers
 * can see which dossiers need a hand-corrected tree.
 */
@Slf4j
public class ExcelValidationReportWriter implements ValidationReportWriter {
    private static final String SUMMARY_SHEET = "Summary";
    private static final String CONFLICTS_SHEET = "Conflicts";
    private static final String MISMATCH_SHEET = "Bracket Mismatches";
    private static final String DANGLING_SHEET = "Dangling References";
    private static final String CITATION_SHEET = "Citation Errors";
    private static final String[] ISSUE_HEADER = {"dossier_number", "anchor_id", "offset", "message"};

    private final File outputFile;

    public ExcelValidationReportWriter(File outputFile) {
        this.outputFile = outputFile;
    }

    @Override
    public CorpusValidationResult write(List<DocumentParseResult> results) {
        if (results == null) results = List.of();
        try {
            CorpusValidationResult summary = summarize(results);
            if (outputFile == null) {
                log.warn("outputFile is null, skipping Excel report");
                return summary;
            }
            File parent = outputFile.getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                log.warn("Could not create parent directories for: {}", parent.getAbsolutePath());
            }
            writeExcel(summary, results);
            log.info("Validation complete: documents={}, articles={}, statuses={}, issues={}",
                    summary.getDocumentCount(), summary.getArticleCount(),
                    summary.getStatusCounts(), summary.getIssueCounts());
            return summary;
        } catch (IOException e) {
            throw new ValidationException("Validation report failed", e);
        }
    }

    private CorpusValidationResult summarize(List<DocumentParseResult> results) {
        Map<String, Integer> statusCounts = new TreeMap<>();
        for (ParseStatus s : ParseStatus.values()) statusCounts.put(s.name(), 0);
        Map<String, Integer> issueCounts = new TreeMap<>();
        for (IssueKind k : IssueKind.values()) issueCounts.put(k.name(), 0);

        int articles = 0;
        List<String> needsCorrection = new ArrayList<>();
        for (DocumentParseResult r : results) {
            if (r.getStatus() != null) statusCounts.merge(r.getStatus().name(), 1, Integer::sum);
            if (r.requiresHandCorrection()) needsCorrection.add(r.getDossierNumber());
            LegalDocument doc = r.getDocument();
            if (doc == null || doc.getExtractionMetadata() == null) continue;
            if (doc.getExtractionMetadata().getStatistics() != null) {
                articles += doc.getExtractionMetadata().getStatistics().getTotalArticles();
            }
            for (ParseIssue issue : doc.getExtractionMetadata().getIssues()) {
                issueCounts.merge(issue.getKind().name(), 1, Integer::sum);
            }
        }
        Collections.sort(needsCorrection);

        return CorpusValidationResult.builder()
                .documentCount(results.size())
                .articleCount(articles)
                .statusCounts(statusCounts)
                .issueCounts(issueCounts)
                .requiresHandCorrection(needsCorrection)
                .build();
    }

    private void writeExcel(CorpusValidationResult summary, List<DocumentParseResult> results) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle header = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            header.setFont(bold);

            Sheet sSummary = workbook.createSheet(SUMMARY_SHEET);
            int row = 0;
            addRow(sSummary, row++, header, "Metric", "Value");
            addRow(sSummary, row++, null, "Documents", String.valueOf(summary.getDocumentCount()));
            addRow(sSummary, row++, null, "Articles", String.valueOf(summary.getArticleCount()));
            for (Map.Entry<String, Integer> e : summary.getStatusCounts().entrySet()) {
                addRow(sSummary, row++, null, "Status " + e.getKey(), String.valueOf(e.getValue()));
            }
            for (Map.Entry<String, Integer> e : summary.getIssueCounts().entrySet()) {
                addRow(sSummary, row++, null, "Issues " + e.getKey(), String.valueOf(e.getValue()));
            }
            row++;
            addRow(sSummary, row++, null, "Requires hand-correction",
                    String.join(", ", summary.getRequiresHandCorrection()));

            issueSheet(workbook, header, CONFLICTS_SHEET, IssueKind.STRUCTURAL_CONFLICT, results);
            issueSheet(workbook, header, MISMATCH_SHEET, IssueKind.BRACKET_MISMATCH, results);
            issueSheet(workbook, header, DANGLING_SHEET, IssueKind.DANGLING_FOOTNOTE_REFERENCE, results);
            issueSheet(workbook, header, CITATION_SHEET, IssueKind.CITATION_PARSE_ERROR, results);

            sSummary.setColumnWidth(0, 10000);
            sSummary.setColumnWidth(1, 20000);

            try (FileOutputStream fos = new FileOutputStream(outputFile)) {
                workbook.write(fos);
            }
            log.info("Validation report written to {}", outputFile.getAbsolutePath());
        }
    }

    private void issueSheet(Workbook workbook, CellStyle header, String name, IssueKind kind,
                            List<DocumentParseResult> results) {
        Sheet sheet = workbook.createSheet(name);
        addRow(sheet, 0, header, ISSUE_HEADER);
        int row = 1;
        for (DocumentParseResult r : results) {
            LegalDocument doc = r.getDocument();
            if (doc == null || doc.getExtractionMetadata() == null) continue;
            for (ParseIssue issue : doc.getExtractionMetadata().getIssues()) {
                if (issue.getKind() != kind) continue;
                addRow(sheet, row++, null,
                        r.getDossierNumber(),
                        issue.getAnchorId() == null ? "" : issue.getAnchorId(),
                        issue.getOffset() == null ? "" : String.valueOf(issue.getOffset()),
                        shorten(issue.getMessage(), 2000));
            }
        }
        sheet.setColumnWidth(0, 5000);
        sheet.setColumnWidth(1, 5000);
        sheet.setColumnWidth(2, 2500);
        sheet.setColumnWidth(3, 25000);
    }

    private String shorten(String s, int max) {
        if (s == null) return "";
        return (s.length() <= max) ? s : s.substring(0, max - 3) + "...";
    }

    private void addRow(Sheet sheet, int rowIndex, CellStyle style, String... values) {
        Row row = sheet.createRow(rowIndex);
        for (int c = 0; c < values.length; c++) {
            Cell cell = row.createCell(c);
            cell.setCellValue(values[c] == null ? "" : values[c]);
            if (style != null) cell.setCellStyle(style);
        }
    }
}
