package com.myorg.justelparser.model;

public enum ParseStatus {
    PARSED,
    HAND_CORRECTED,
    CONFLICT,
    FAILED,
    TIMED_OUT
}
