package com.myorg.justelparser.service;

import com.myorg.justelparser.model.CorpusValidationResult;
import com.myorg.justelparser.model.DocumentParseResult;

import java.util.List;

public interface ValidationReportWriter {

    CorpusValidationResult write(List<DocumentParseResult> results);
}
