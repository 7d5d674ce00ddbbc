package com.creatorradar.discovery.normalizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmailExtractorTest {

    @Test
    @DisplayName("finds every address in a biography, lowercased and deduplicated")
    void fromText() {
        String bio = "Yoga coach 🧘 Biz: Ana.Collabs@Gmail.com. Backup ana.collabs@gmail.com or team@studio.co.uk";
        assertThat(EmailExtractor.fromText(bio)).containsExactly("ana.collabs@gmail.com", "team@studio.co.uk");
    }

    @Test
    void noEmail() {
        assertThat(EmailExtractor.fromText(null)).isEmpty();
        assertThat(EmailExtractor.fromText("  ")).isEmpty();
        assertThat(EmailExtractor.fromText("DM me @ana for collabs")).isEmpty();
    }

    @Test
    @DisplayName("mailto links are read without their query string")
    void fromLinks() {
        List<String> links = List.of("https://linktr.ee/ana", "MAILTO:hello@ana.fit?subject=collab");
        assertThat(EmailExtractor.fromLinks(links)).containsExactly("hello@ana.fit");
    }

    @Test
    void extractMergesTextFirst() {
        assertThat(EmailExtractor.extract("pr@ana.fit", List.of("mailto:hello@ana.fit", "mailto:pr@ana.fit")))
                .containsExactly("pr@ana.fit", "hello@ana.fit");
    }
}
