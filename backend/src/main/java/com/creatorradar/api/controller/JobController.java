package com.creatorradar.api.controller;

import com.creatorradar.api.dto.CreateJobRequest;
import com.creatorradar.api.dto.CreateJobResponse;
import com.creatorradar.api.dto.ErrorBody;
import com.creatorradar.api.dto.JobResultsResponse;
import com.creatorradar.api.dto.JobStatusResponse;
import com.creatorradar.api.validation.JobRequestValidator;
import com.creatorradar.discovery.job.CreateJobCommand;
import com.creatorradar.discovery.job.CreatedJob;
import com.creatorradar.discovery.job.DiscoveryJobService;
import com.creatorradar.discovery.queue.CallbackUrlResolver;
import com.creatorradar.domain.Platform;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /jobs, GET /jobs/{jobId}/status, GET /jobs/{jobId}/results, DELETE /jobs/{jobId}.
 * Service calls block on Mongo and the queue, so they run on boundedElastic.
 */
@RestController
@RequestMapping("/api/v2/jobs")
@RequiredArgsConstructor
public class JobController {

    private final DiscoveryJobService jobService;
    private final JobRequestValidator jobRequestValidator;
    private final CallbackUrlResolver callbackUrlResolver;

    @PostMapping
    public Mono<ResponseEntity<CreateJobResponse>> create(@Valid @RequestBody CreateJobRequest request,
                                                          ServerHttpRequest httpRequest) {
        CreateJobCommand command = new CreateJobCommand(
                request.ownerId().trim(),
                Platform.fromJson(request.platform()),
                jobRequestValidator.sanitizeKeywords(request.keywords()),
                request.targetResults(),
                request.expansionEnabled());
        String callbackBaseUrl = callbackUrlResolver.baseUrl(httpRequest);
        return Mono.fromCallable(() -> {
                    CreatedJob created = jobService.create(command, callbackBaseUrl);
                    return ResponseEntity.accepted().body(new CreateJobResponse(created.jobId(), created.keywords(),
                            created.workersDispatched(), "Discovery started"));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{jobId}/status")
    public Mono<ResponseEntity<?>> status(@PathVariable String jobId) {
        return Mono.<ResponseEntity<?>>fromCallable(() -> jobService.status(jobId)
                        .<ResponseEntity<?>>map(p -> ResponseEntity.ok(JobStatusResponse.from(p)))
                        .orElseGet(() -> notFound(jobId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{jobId}/results")
    public Mono<ResponseEntity<?>> results(@PathVariable String jobId,
                                           @RequestParam(defaultValue = "0") int offset,
                                           @RequestParam(defaultValue = "50") int limit) {
        return Mono.<ResponseEntity<?>>fromCallable(() -> jobService.results(jobId, offset, limit)
                        .<ResponseEntity<?>>map(page -> ResponseEntity.ok(JobResultsResponse.from(page)))
                        .orElseGet(() -> notFound(jobId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{jobId}")
    public Mono<ResponseEntity<?>> delete(@PathVariable String jobId) {
        return Mono.<ResponseEntity<?>>fromCallable(() -> jobService.delete(jobId)
                        ? ResponseEntity.noContent().build()
                        : notFound(jobId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<ErrorBody> notFound(String jobId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("JOB_NOT_FOUND", "Job not found: " + jobId));
    }
}
