package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.AbrogationInfo;
import com.myorg.justelparser.util.DateNormalizer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the notice left in place of the text of a fully repealed act:
 * {@code (abrogé) <L 2019-04-26/28, art. 45, 239; En vigueur : 01-01-2022>}.
 */
public class AbrogationInfoExtractor {

    private static final Pattern NOTICE = Pattern.compile(
            "\\(abrogé\\)\\s*<([^,>]+),\\s*([^,>]+),\\s*([^;>]+);\\s*(?:\\*\\*)?\\s*En\\s+vigueur\\s*:?\\s*(?:\\*\\*)?([^>]+)>",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    public Optional<AbrogationInfo> extract(String abrogationText) {
        if (abrogationText == null || abrogationText.isBlank()) return Optional.empty();
        Matcher m = NOTICE.matcher(abrogationText);
        if (!m.find()) return Optional.empty();
        return Optional.of(AbrogationInfo.builder()
                .fullyAbrogated(true)
                .abrogatingLaw(m.group(1).trim())
                .abrogatingArticle(m.group(2).trim())
                .abrogationEntry(m.group(3).trim())
                .abrogationDate(DateNormalizer.toIso(m.group(4)))
                .rawAbrogationText(m.group(0))
                .build());
    }
}
