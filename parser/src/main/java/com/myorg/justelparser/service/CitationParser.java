package com.myorg.justelparser.service;

import com.myorg.justelparser.exception.CitationParseException;
import com.myorg.justelparser.model.LegalCitation;

import java.util.List;

/**
 * Turns gazette citation strings such as {@code <L 2008-12-22/33, art. 105, 013; En vigueur : 08-01-2009>}
 * into {@link LegalCitation} values.
 */
public interface CitationParser {

    /**
     * Parses the first citation found in {@code raw}.
     *
     * @throws CitationParseException when the string matches no known citation shape
     */
    LegalCitation parse(String raw) throws CitationParseException;

    /**
     * Finds every citation in free text, in order of appearance. Offsets are relative to {@code text}.
     */
    List<LegalCitation> findAll(String text);
}
