package com.myorg.justelparser.service;

import com.myorg.justelparser.model.DocumentParseResult;
import com.myorg.justelparser.model.source.SourceDocument;

public interface DocumentParser {

    /**
     * Parses one document. Article-scoped failures are reported inside the result; a
     * structural conflict yields a CONFLICT result. Never blocks on other documents.
     */
    DocumentParseResult parse(SourceDocument source);
}
