package com.myorg.justelparser.model;

public enum IssueKind {
    STRUCTURAL_CONFLICT,
    BRACKET_MISMATCH,
    DANGLING_FOOTNOTE_REFERENCE,
    CITATION_PARSE_ERROR
}
