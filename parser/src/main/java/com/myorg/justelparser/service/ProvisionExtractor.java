package com.myorg.justelparser.service;

import com.myorg.justelparser.model.Provision;

import java.util.List;

public interface ProvisionExtractor {

    /**
     * Extracts the numbered provisions of de-bracketed article text, in source order.
     */
    List<Provision> extract(String text);
}
