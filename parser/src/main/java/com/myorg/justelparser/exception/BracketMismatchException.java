package com.myorg.justelparser.exception;

import lombok.Getter;

@Getter
public class BracketMismatchException extends DocumentParseException {

    /** Offset of the offending marker in the raw article text. */
    private final int sourceOffset;

    /** Length of the de-bracketed output when the mismatch was hit. */
    private final int outputOffset;

    private final String expectedId;
    private final String foundId;

    public BracketMismatchException(String message, int sourceOffset, int outputOffset,
                                    String expectedId, String foundId) {
        super(message);
        this.sourceOffset = sourceOffset;
        this.outputOffset = outputOffset;
        this.expectedId = expectedId;
        this.foundId = foundId;
    }
}
