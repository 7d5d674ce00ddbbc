package com.creatorradar.api.controller;

import com.creatorradar.api.dto.WorkerResponse;
import com.creatorradar.api.validation.WorkerMessageValidator;
import com.creatorradar.discovery.adapter.ProviderException;
import com.creatorradar.discovery.job.ContinuationMonitor;
import com.creatorradar.discovery.job.EnrichmentWorker;
import com.creatorradar.discovery.job.SearchWorker;
import com.creatorradar.discovery.job.WorkerOutcome;
import com.creatorradar.discovery.queue.CallbackUrlResolver;
import com.creatorradar.discovery.queue.QueuePublishException;
import com.creatorradar.discovery.queue.QueueSignatureVerifier;
import com.creatorradar.discovery.queue.WorkerMessage;
import com.creatorradar.discovery.queue.WorkerPaths;
import com.creatorradar.ledger.IdempotencyCheckResult;
import com.creatorradar.ledger.IdempotencyLedger;
import com.creatorradar.ledger.IdempotencyReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Queue push endpoints. Each delivery goes through signature check (401), message validation (400), the
 * idempotency ledger (duplicates answer 200 "skipped") and then the worker.
 * <p>
 * Infrastructure failures mark the ledger row FAILED and answer 503 so the queue redelivers; business
 * failures answer 200 so it does not. Any other exception from a worker also answers 200 with an error body,
 * leaving the ledger row FAILED so a manual replay can reclaim it.
 */
@RestController
@RequestMapping(WorkerPaths.BASE)
@RequiredArgsConstructor
@Slf4j
public class WorkerController {

    public static final String SIGNATURE_HEADER = "Upstash-Signature";
    static final String LEDGER_SOURCE = "qstash";

    private final QueueSignatureVerifier signatureVerifier;
    private final CallbackUrlResolver callbackUrlResolver;
    private final WorkerMessageValidator messageValidator;
    private final IdempotencyLedger ledger;
    private final SearchWorker searchWorker;
    private final EnrichmentWorker enrichmentWorker;
    private final ContinuationMonitor continuationMonitor;

    @PostMapping("/search")
    public Mono<ResponseEntity<WorkerResponse>> search(@RequestBody(required = false) byte[] body,
                                                       @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
                                                       ServerHttpRequest request) {
        return deliver("search", body, signature, request, messageValidator::search, searchWorker::process);
    }

    @PostMapping("/enrich")
    public Mono<ResponseEntity<WorkerResponse>> enrich(@RequestBody(required = false) byte[] body,
                                                       @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
                                                       ServerHttpRequest request) {
        return deliver("enrich", body, signature, request, messageValidator::enrich,
                (message, callbackBaseUrl) -> enrichmentWorker.process(message));
    }

    @PostMapping("/monitor")
    public Mono<ResponseEntity<WorkerResponse>> monitor(@RequestBody(required = false) byte[] body,
                                                        @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
                                                        ServerHttpRequest request) {
        return deliver("monitor", body, signature, request, messageValidator::monitor, continuationMonitor::process);
    }

    private <M extends WorkerMessage> Mono<ResponseEntity<WorkerResponse>> deliver(
            String eventType, byte[] body, String signature, ServerHttpRequest request,
            Function<byte[], M> parser, BiFunction<M, String, WorkerOutcome> worker) {
        byte[] raw = body != null ? body : new byte[0];
        String requestUrl = callbackUrlResolver.requestUrl(request);
        String callbackBaseUrl = callbackUrlResolver.baseUrl(request);
        return Mono.fromCallable(() -> {
                    signatureVerifier.verify(signature, requestUrl, raw);
                    M message = parser.apply(raw);
                    return handle(eventType, message, new String(raw, StandardCharsets.UTF_8), callbackBaseUrl, worker);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private <M extends WorkerMessage> ResponseEntity<WorkerResponse> handle(
            String eventType, M message, String payload, String callbackBaseUrl,
            BiFunction<M, String, WorkerOutcome> worker) {
        String eventId = message.eventId();
        IdempotencyCheckResult check = ledger.check(eventId, LEDGER_SOURCE, eventType, null, payload);
        if (!check.shouldProcess()) {
            log.debug("Skipping duplicate {} delivery {} ({})", eventType, eventId, check.reason());
            return ResponseEntity.ok(WorkerResponse.duplicate(message.jobId(), check.reason()));
        }
        try {
            WorkerOutcome outcome = worker.apply(message, callbackBaseUrl);
            ledger.markCompleted(eventId);
            WorkerResponse response = WorkerResponse.from(outcome);
            return ResponseEntity.ok(check.reason() == IdempotencyReason.RETRYING_FAILED
                    ? response.withReason(check.reason()) : response);
        } catch (ProviderException e) {
            if (e.isRetryable()) {
                return retry(eventType, eventId, message.jobId(), e);
            }
            log.warn("{} delivery {} failed: {}", eventType, eventId, e.getMessage());
            ledger.markCompleted(eventId);
            return ResponseEntity.ok(WorkerResponse.error(message.jobId(), e.getMessage()));
        } catch (DataAccessException | QueuePublishException e) {
            return retry(eventType, eventId, message.jobId(), e);
        } catch (RuntimeException e) {
            log.error("{} delivery {} failed unexpectedly", eventType, eventId, e);
            ledger.markFailed(eventId, e.getMessage());
            return ResponseEntity.ok(WorkerResponse.error(message.jobId(), "Internal error: " + e.getMessage()));
        }
    }

    private ResponseEntity<WorkerResponse> retry(String eventType, String eventId, String jobId, RuntimeException e) {
        log.error("{} delivery {} hit an infrastructure failure; asking the queue to retry", eventType, eventId, e);
        ledger.markFailed(eventId, e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(WorkerResponse.retry(jobId, e.getMessage()));
    }
}
