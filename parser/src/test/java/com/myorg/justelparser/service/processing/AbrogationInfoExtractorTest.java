package com.myorg.justelparser.service.processing;

import com.myorg.justelparser.model.AbrogationInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AbrogationInfoExtractor Tests")
class AbrogationInfoExtractorTest {

    private final AbrogationInfoExtractor extractor = new AbrogationInfoExtractor();

    @Test
    @DisplayName("should read the abrogating act from the notice")
    void shouldExtract_whenNoticePresent() {
        Optional<AbrogationInfo> info = extractor.extract(
                "Texte abrogé. (abrogé) <L 2019-04-26/28, art. 45, 239; En vigueur : 01-01-2022>");

        assertThat(info).hasValueSatisfying(i -> {
            assertThat(i.isFullyAbrogated()).isTrue();
            assertThat(i.getAbrogatingLaw()).isEqualTo("L 2019-04-26/28");
            assertThat(i.getAbrogatingArticle()).isEqualTo("art. 45");
            assertThat(i.getAbrogationEntry()).isEqualTo("239");
            assertThat(i.getAbrogationDate()).isEqualTo("2022-01-01");
            assertThat(i.getRawAbrogationText()).startsWith("(abrogé) <L");
        });
    }

    @Test
    @DisplayName("should return empty when there is no notice")
    void shouldReturnEmpty_whenNoNotice() {
        assertThat(extractor.extract("Loi en vigueur.")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
