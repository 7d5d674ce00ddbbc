package com.creatorradar.discovery.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * LLM keyword expansion (OpenAI-compatible chat completions).
 */
@ConfigurationProperties(prefix = "creatorradar.discovery.expansion")
@NoArgsConstructor
@Getter
@Setter
public class KeywordExpansionProperties {

    private boolean enabled = true;

    /** Chat completions endpoint. */
    private String apiUrl = "https://openrouter.ai/api/v1/chat/completions";

    /** Bearer key; expansion is skipped when blank. */
    private String apiKey = "";

    private String model = "openai/gpt-4o-mini";

    private long requestTimeoutMs = 15_000;
}
