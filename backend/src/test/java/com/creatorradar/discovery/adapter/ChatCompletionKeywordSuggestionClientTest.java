package com.creatorradar.discovery.adapter;

import com.creatorradar.discovery.config.KeywordExpansionProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatCompletionKeywordSuggestionClientTest {

    private final ChatCompletionKeywordSuggestionClient client = new ChatCompletionKeywordSuggestionClient(
            WebClient.builder(), new KeywordExpansionProperties(), new ObjectMapper());

    @Test
    @DisplayName("takes the JSON array from the first choice")
    void jsonArray() {
        String response = """
                {"choices":[{"message":{"content":"[\\"home workouts\\", \\"hiit\\", 3]"}}]}
                """;

        assertThat(client.parseSuggestions(response)).containsExactly("home workouts", "hiit");
    }

    @Test
    @DisplayName("falls back to quoted strings when the model answers with prose")
    void proseFallback() {
        String response = """
                {"choices":[{"message":{"content":"Sure! Try \\"yoga flow\\" and \\"mobility\\"."}}]}
                """;

        assertThat(client.parseSuggestions(response)).containsExactly("yoga flow", "mobility");
    }

    @Test
    @DisplayName("no choices yields no suggestions; malformed envelopes fail")
    void edgeCases() {
        assertThat(client.parseSuggestions("{\"choices\":[]}")).isEmpty();
        assertThatThrownBy(() -> client.parseSuggestions("{oops"))
                .isInstanceOf(ProviderException.class);
    }
}
