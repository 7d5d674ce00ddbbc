package com.creatorradar.discovery.queue;

import com.creatorradar.common.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QStashQueuePublisherTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private QueueProperties properties;

    @BeforeEach
    void setUp() {
        properties = new QueueProperties();
        properties.setBaseUrl("https://qstash.example.com/");
        properties.setToken("tok");
    }

    @Test
    @DisplayName("publishes with auth, retries, dedup and delay headers")
    void publishHeaders() {
        QStashQueuePublisher publisher = publisher(new AtomicInteger(), HttpStatus.OK);

        String id = publisher.publish("https://app.example.com/api/v2/worker/monitor", Map.of("jobId", "job-1"),
                "monitor:job-1:0", Duration.ofSeconds(30));

        assertThat(id).isEqualTo("msg_1");
        ClientRequest request = requests.get(0);
        assertThat(request.url().toString())
                .isEqualTo("https://qstash.example.com/v2/publish/https://app.example.com/api/v2/worker/monitor");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer tok");
        assertThat(request.headers().getFirst("Upstash-Retries")).isEqualTo("3");
        assertThat(request.headers().getFirst("Upstash-Deduplication-Id")).isEqualTo("monitor:job-1:0");
        assertThat(request.headers().getFirst("Upstash-Delay")).isEqualTo("30s");
    }

    @Test
    @DisplayName("5xx responses are retried up to the policy's attempts")
    void retriesServerErrors() {
        AtomicInteger failuresLeft = new AtomicInteger(2);
        QStashQueuePublisher publisher = publisher(failuresLeft, HttpStatus.SERVICE_UNAVAILABLE);

        assertThat(publisher.publish("https://app.example.com/x", Map.of(), "search:job-1:0", Duration.ZERO))
                .isEqualTo("msg_1");
        assertThat(requests).hasSize(3);
        assertThat(requests.get(0).headers().containsKey("Upstash-Delay")).isFalse();
    }

    @Test
    @DisplayName("4xx responses fail immediately")
    void clientErrorsAreFinal() {
        QStashQueuePublisher publisher = publisher(new AtomicInteger(5), HttpStatus.UNAUTHORIZED);

        assertThatThrownBy(() -> publisher.publish("https://app.example.com/x", Map.of(), "search:job-1:0", Duration.ZERO))
                .isInstanceOf(QueuePublishException.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    @DisplayName("gives up after the last attempt")
    void exhaustsAttempts() {
        QStashQueuePublisher publisher = publisher(new AtomicInteger(10), HttpStatus.BAD_GATEWAY);

        assertThatThrownBy(() -> publisher.publish("https://app.example.com/x", Map.of(), "search:job-1:0", Duration.ZERO))
                .isInstanceOf(QueuePublishException.class)
                .hasMessageContaining("after 3 attempts");
        assertThat(requests).hasSize(3);
    }

    /** Fails the first {@code failures} calls with {@code failureStatus}, then answers 200. */
    private QStashQueuePublisher publisher(AtomicInteger failures, HttpStatus failureStatus) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            if (failures.getAndDecrement() > 0) {
                return Mono.just(ClientResponse.create(failureStatus).body("{\"error\":\"nope\"}").build());
            }
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"messageId\":\"msg_1\"}")
                    .build());
        });
        return new QStashQueuePublisher(builder, properties, new RetryPolicy(1L, 0, 3));
    }
}
