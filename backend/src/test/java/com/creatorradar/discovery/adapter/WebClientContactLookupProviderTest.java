package com.creatorradar.discovery.adapter;

import com.creatorradar.discovery.config.EnrichmentProperties;
import com.creatorradar.discovery.config.ProviderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientContactLookupProviderTest {

    private final WebClientContactLookupProvider provider = new WebClientContactLookupProvider(
            WebClient.builder(), new ProviderProperties(), new EnrichmentProperties(), new ObjectMapper());

    @Test
    @DisplayName("reads bio, email, links and followers from a nested user object")
    void nestedUser() {
        ContactProfile profile = provider.toProfile("""
                {"user":{"signature":"Coach | jane@fit.io","follower_count":1200,
                  "bio_links":[{"url":"https://linktr.ee/jane"}],"external_url":"https://jane.fit"}}
                """);

        assertThat(profile.bio()).isEqualTo("Coach | jane@fit.io");
        assertThat(profile.followerCount()).isEqualTo(1200L);
        assertThat(profile.links()).containsExactly("https://linktr.ee/jane", "https://jane.fit");
        assertThat(profile.email()).isNull();
    }

    @Test
    @DisplayName("falls back to top-level fields and alternative names")
    void flatPayload() {
        ContactProfile profile = provider.toProfile("""
                {"description":"Daily vlogs","public_email":"hi@vlog.tv","subscriberCountInt":50000,
                 "links":["https://vlog.tv"]}
                """);

        assertThat(profile.bio()).isEqualTo("Daily vlogs");
        assertThat(profile.email()).isEqualTo("hi@vlog.tv");
        assertThat(profile.followerCount()).isEqualTo(50000L);
        assertThat(profile.links()).containsExactly("https://vlog.tv");
    }

    @Test
    void malformedJson() {
        assertThatThrownBy(() -> provider.toProfile("not json"))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).isRetryable()).isFalse());
    }
}
