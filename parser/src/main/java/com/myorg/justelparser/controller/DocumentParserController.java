package com.myorg.justelparser.controller;

import com.myorg.justelparser.config.StorageProperties;
import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.metrics.PerfProbe;
import com.myorg.justelparser.model.CorpusProcessingResponse;
import com.myorg.justelparser.model.CorpusValidationResult;
import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.source.SourceDocument;
import com.myorg.justelparser.service.DocumentParser;
import com.myorg.justelparser.service.JsonlWriter;
import com.myorg.justelparser.service.ValidationReportWriter;
import com.myorg.justelparser.service.implementation.CorpusProcessor;
import com.myorg.justelparser.service.implementation.ExcelValidationReportWriter;
import com.myorg.justelparser.service.implementation.JacksonJsonlWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class DocumentParserController {

    static final String DOCUMENTS_FILE = "documents.jsonl";
    static final String VALIDATION_FILE = "validation_report.xlsx";

    private final StorageProperties storageProperties;
    private final DocumentParser documentParser;
    private final CorpusProcessor corpusProcessor;

    @PostMapping("/documents/parse")
    public ResponseEntity<DocumentParseResult> parseDocument(@RequestBody SourceDocument source) {
        if (source == null) {
            throw new ValidationException("Request body must be a source document.");
        }
        return ResponseEntity.ok(documentParser.parse(source));
    }

    @PostMapping("/corpus/process")
    public ResponseEntity<CorpusProcessingResponse> processCorpus(@RequestBody List<SourceDocument> sources)
            throws IOException {
        if (sources == null || sources.isEmpty()) {
            throw new ValidationException("Please submit at least one source document.");
        }

        PerfProbe probe = new PerfProbe("corpus-job");
        Path outDir = outputDirectory();
        Files.createDirectories(outDir);
        log.info("Corpus job started: {} document(s) -> {}", sources.size(), outDir);

        List<DocumentParseResult> results = corpusProcessor.process(sources);
        probe.mark("Corpus parsed", results.size());

        JsonlWriter<DocumentParseResult> writer = new JacksonJsonlWriter<>();
        writer.write(outDir.resolve(DOCUMENTS_FILE).toFile(), results);
        probe.mark("JSONL written", results.size());

        ValidationReportWriter validator = new ExcelValidationReportWriter(outDir.resolve(VALIDATION_FILE).toFile());
        CorpusValidationResult validation = validator.write(results);
        probe.mark("Validation report written", 1);

        long totalMs = probe.done("Job complete");
        return ResponseEntity.ok(CorpusProcessingResponse.builder()
                .outputDirectory(outDir.toString())
                .durationMs(totalMs)
                .validation(validation)
                .build());
    }

    @GetMapping("/corpus/results/documents")
    public ResponseEntity<FileSystemResource> getDocumentsJsonl() {
        return serveFile(DOCUMENTS_FILE);
    }

    @GetMapping("/corpus/results/validation")
    public ResponseEntity<FileSystemResource> getValidationReport() {
        return serveFile(VALIDATION_FILE);
    }

    // ===== Helpers =====

    private Path outputDirectory() {
        return Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize();
    }

    private ResponseEntity<FileSystemResource> serveFile(String name) {
        File f = outputDirectory().resolve(name).toFile();

        if (!f.exists()) return ResponseEntity.notFound().build();

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + name + "\"")
                .body(new FileSystemResource(f));
    }
}
