package com.myorg.justelparser.service.implementation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.justelparser.exception.ValidationException;
import com.myorg.justelparser.model.LegalDocument;
import com.myorg.justelparser.service.HandCorrectionStore;
import com.myorg.justelparser.service.processing.HierarchyValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads hand-corrected documents from a directory of JSON files once, at construction.
 * Each file is keyed by its own {@code document_metadata.dossier_number}, never by its name.
 */
@Slf4j
public class FileSystemHandCorrectionStore implements HandCorrectionStore {

    private final Map<String, LegalDocument> documents;

    public FileSystemHandCorrectionStore(Path directory, ObjectMapper mapper, HierarchyValidator validator) {
        this.documents = Map.copyOf(load(directory, mapper, validator));
    }

    @Override
    public Optional<LegalDocument> find(String dossierNumber) {
        return dossierNumber == null ? Optional.empty() : Optional.ofNullable(documents.get(dossierNumber.trim()));
    }

    public int size() {
        return documents.size();
    }

    private static Map<String, LegalDocument> load(Path directory, ObjectMapper mapper, HierarchyValidator validator) {
        Map<String, LegalDocument> loaded = new HashMap<>();
        if (directory == null) {
            log.info("No hand-correction directory configured");
            return loaded;
        }
        if (!Files.isDirectory(directory)) {
            log.warn("Hand-correction directory {} does not exist; no overrides loaded", directory.toAbsolutePath());
            return loaded;
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                LegalDocument doc = read(file, mapper);
                String dossier = doc.getDossierNumber();
                if (dossier == null || dossier.isBlank()) {
                    throw new ValidationException("Hand-corrected document " + file.getFileName()
                            + " has no document_metadata.dossier_number");
                }
                validator.validate(dossier, doc.getDocumentHierarchy());
                if (loaded.putIfAbsent(dossier.trim(), doc) != null) {
                    throw new ValidationException("Two hand-corrected documents for dossier " + dossier);
                }
                log.info("Loaded hand-corrected tree for {} from {}", dossier, file.getFileName());
            }
        } catch (IOException e) {
            throw new ValidationException("Cannot read hand-correction directory " + directory, e);
        }
        log.info("Hand-correction store ready: {} document(s)", loaded.size());
        return loaded;
    }

    private static LegalDocument read(Path file, ObjectMapper mapper) {
        try {
            return mapper.readValue(file.toFile(), LegalDocument.class);
        } catch (IOException e) {
            throw new ValidationException("Malformed hand-corrected document " + file.getFileName(), e);
        }
    }
}
