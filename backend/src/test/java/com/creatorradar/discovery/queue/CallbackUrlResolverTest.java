package com.creatorradar.discovery.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackUrlResolverTest {

    private final CallbackUrlResolver resolver = new CallbackUrlResolver();

    @Test
    @DisplayName("X-Forwarded-Host wins over Host")
    void forwardedHostWins() {
        MockServerHttpRequest request = MockServerHttpRequest.post("http://10.0.0.5:8080/api/v2/worker/search?x=1")
                .header("X-Forwarded-Host", "app.example.com, proxy.internal")
                .header("Host", "10.0.0.5:8080")
                .build();

        assertThat(resolver.baseUrl(request)).isEqualTo("https://app.example.com");
        assertThat(resolver.requestUrl(request)).isEqualTo("https://app.example.com/api/v2/worker/search");
    }

    @Test
    @DisplayName("local hosts use http")
    void localHostsUseHttp() {
        MockServerHttpRequest request = MockServerHttpRequest.post("http://localhost:3000/api/v2/jobs")
                .header("Host", "localhost:3000")
                .build();

        assertThat(resolver.baseUrl(request)).isEqualTo("http://localhost:3000");
        assertThat(CallbackUrlResolver.baseUrl("127.0.0.1:8080")).isEqualTo("http://127.0.0.1:8080");
        assertThat(CallbackUrlResolver.baseUrl("api.example.com")).isEqualTo("https://api.example.com");
    }
}
