package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.FootnoteReference;
import lombok.Getter;

import java.util.List;

/**
 * De-bracketed article text and the spans recovered from it.
 */
@Getter
public class ResolvedText {

    private final String text;
    private final List<FootnoteReference> references;

    public ResolvedText(String text, List<FootnoteReference> references) {
        this.text = text;
        this.references = List.copyOf(references);
    }
}
