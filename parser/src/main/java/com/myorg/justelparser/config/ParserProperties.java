package com.myorg.justelparser.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** Configuration properties for the parsing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "justel")
@Getter
@Setter
public class ParserProperties {

    private Citation citation = new Citation();
    private Corpus corpus = new Corpus();
    private Overrides overrides = new Overrides();

    @Getter
    @Setter
    public static class Citation {
        /** Consolidated-text URL; {dossier} is the raw dossier number, {cn} its digits only. */
        private String urlTemplate =
                "https://www.ejustice.just.fgov.be/cgi_loi/change_lg.pl?language=fr&la=F&cn={cn}&table_name=loi";
    }

    @Getter
    @Setter
    public static class Corpus {
        private int workerThreads = 4;

        /** Abandon documents still running after this long. Zero or unset waits forever. */
        private Duration timeout;
    }

    @Getter
    @Setter
    public static class Overrides {
        /** Directory of hand-corrected LegalDocument JSON files; unset disables overrides. */
        private String directory;
    }
}
