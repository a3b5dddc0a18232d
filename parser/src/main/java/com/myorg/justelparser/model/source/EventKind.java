package com.myorg.justelparser.model.source;

public enum EventKind {
    HEADING,
    ARTICLE
}
