package com.myorg.justelparser.service;

import com.myorg.justelparser.model.LegalDocument;

import java.util.Optional;

/**
 * Keyed table of manually authored replacement documents. Consulted before any automatic
 * parse; a hit is used verbatim.
 */
public interface HandCorrectionStore {

    Optional<LegalDocument> find(String dossierNumber);

    static HandCorrectionStore empty() {
        return dossierNumber -> Optional.empty();
    }
}
