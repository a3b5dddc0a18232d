package com.myorg.justelparser.exception;

import lombok.Getter;

/**
 * Two nodes collide in a way the builder refuses to merge automatically. Both source
 * locations are carried so a reviewer can find them.
 */
@Getter
public class StructuralConflictException extends DocumentParseException {

    private final String firstLocation;
    private final String secondLocation;

    public StructuralConflictException(String message, String firstLocation, String secondLocation) {
        super(message + " [" + firstLocation + "] vs [" + secondLocation + "]");
        this.firstLocation = firstLocation;
        this.secondLocation = secondLocation;
    }
}
