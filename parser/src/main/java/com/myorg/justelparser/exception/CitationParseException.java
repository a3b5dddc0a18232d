package com.myorg.justelparser.exception;

import lombok.Getter;

@Getter
public class CitationParseException extends DocumentParseException {

    private final String rawCitation;

    public CitationParseException(String message, String rawCitation) {
        super(message);
        this.rawCitation = rawCitation;
    }
}
