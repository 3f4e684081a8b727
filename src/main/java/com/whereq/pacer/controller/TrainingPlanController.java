package com.whereq.pacer.controller;

import com.whereq.pacer.dto.PlanErrorResponse;
import com.whereq.pacer.dto.PlanStatus;
import com.whereq.pacer.dto.PlanStatusResponse;
import com.whereq.pacer.dto.PlanSubmitRequest;
import com.whereq.pacer.dto.PlanSubmitResponse;
import com.whereq.pacer.exception.ArtifactMissingException;
import com.whereq.pacer.exception.PlanAlreadyInProgressException;
import com.whereq.pacer.exception.PlanNotFoundException;
import com.whereq.pacer.exception.PlanNotReadyException;
import com.whereq.pacer.model.PlanArtifact;
import com.whereq.pacer.service.ArtifactResolver;
import com.whereq.pacer.service.PlanStatusService;
import com.whereq.pacer.service.PlanSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * REST controller for training plan submission, status polling and download.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping(TrainingPlanController.BASE_PATH)
@RequiredArgsConstructor
@Tag(name = "Training Plans", description = "Submit plan generations, poll their status and download the result")
public class TrainingPlanController {

    public static final String BASE_PATH = "/api/v1/training-plans";

    static final MediaType XLSX = MediaType.parseMediaType(
        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final PlanSubmissionService submissionService;
    private final PlanStatusService statusService;
    private final ArtifactResolver artifactResolver;

    /**
     * Start a plan generation
     *
     * @param request athlete name and optional goals
     * @return Mono with 202 Accepted, or 409 when a generation is already running for the athlete
     */
    @PostMapping
    @Operation(summary = "Generate training plan",
        description = "Start the generation of a personalized training plan; poll the status URL for the result")
    public Mono<ResponseEntity<PlanSubmitResponse>> submitPlan(@Valid @RequestBody Mono<PlanSubmitRequest> request) {
        return request
            .doOnNext(r -> log.info("Received training plan submission for {}", r.getAthleteName()))
            .flatMap(r -> submissionService.submit(r.getAthleteName(), r.getGoals()))
            .map(response -> {
                String statusUrl = planUrl(response.getAthleteName(), "status");
                response.setStatusUrl(statusUrl);
                response.setDownloadUrl(planUrl(response.getAthleteName(), "download"));
                return ResponseEntity
                    .status(HttpStatus.ACCEPTED)
                    .location(URI.create(statusUrl))
                    .body(response);
            })
            .onErrorResume(PlanAlreadyInProgressException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(PlanSubmitResponse.rejected(PlanAlreadyInProgressException.REASON))))
            .onErrorResume(WebExchangeBindException.class, e -> {
                String reason = e.getFieldErrors().stream()
                    .map(FieldError::getDefaultMessage)
                    .findFirst()
                    .orElse("Invalid request");
                log.warn("Validation error: {}", reason);
                return Mono.just(ResponseEntity.badRequest().body(PlanSubmitResponse.rejected(reason)));
            })
            .onErrorResume(ServerWebInputException.class, e -> {
                log.warn("Unreadable submission: {}", e.getReason());
                return Mono.just(ResponseEntity.badRequest().body(PlanSubmitResponse.rejected(e.getReason())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(PlanSubmitResponse.rejected(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during plan submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(PlanSubmitResponse.rejected("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get plan status
     *
     * @param athleteName athlete name, matched case- and spacing-insensitively
     * @return Mono with the status; 404 with status not_found when no plan was requested
     */
    @GetMapping("/{athleteName}/status")
    @Operation(summary = "Check training plan status", description = "Poll the status of a training plan generation")
    public Mono<ResponseEntity<PlanStatusResponse>> getPlanStatus(@PathVariable String athleteName) {
        log.debug("Status request for {}", athleteName);

        return statusService.status(athleteName)
            .map(status -> status.getStatus() == PlanStatus.NOT_FOUND
                ? ResponseEntity.status(HttpStatus.NOT_FOUND).body(status)
                : ResponseEntity.ok(status))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Invalid status request: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    /**
     * Download the plan spreadsheet
     *
     * @param athleteName athlete name
     * @return Mono with the spreadsheet, or an error body echoing the plan status
     */
    @GetMapping("/{athleteName}/download")
    @Operation(summary = "Download training plan", description = "Download the spreadsheet of a completed training plan")
    public Mono<ResponseEntity<Object>> downloadPlan(@PathVariable String athleteName) {
        log.info("Download request for {}", athleteName);

        return artifactResolver.resolve(athleteName)
            .map(this::toDownload)
            .onErrorResume(PlanNotFoundException.class, e -> Mono.just(error(HttpStatus.NOT_FOUND,
                PlanErrorResponse.NOT_FOUND, e.getMessage(), PlanStatusResponse.notFound())))
            .onErrorResume(PlanNotReadyException.class, e -> Mono.just(error(HttpStatus.CONFLICT,
                PlanErrorResponse.NOT_READY, e.getMessage(), PlanStatusResponse.from(e.getRecord()))))
            .onErrorResume(ArtifactMissingException.class, e -> {
                log.error("Artifact missing for {}: {}", athleteName, e.getMessage());
                return Mono.just(error(HttpStatus.GONE,
                    PlanErrorResponse.ARTIFACT_MISSING, e.getMessage(), PlanStatusResponse.from(e.getRecord())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Invalid download request: {}", e.getMessage());
                return Mono.just(error(HttpStatus.BAD_REQUEST, PlanErrorResponse.INVALID_REQUEST, e.getMessage(), null));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error serving plan for {}", athleteName, e);
                return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR,
                    PlanErrorResponse.INTERNAL, "Internal server error", null));
            });
    }

    private ResponseEntity<Object> toDownload(PlanArtifact artifact) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(XLSX);
        headers.setContentLength(artifact.getSize());
        headers.setContentDisposition(ContentDisposition.attachment()
            .filename(artifact.getFileName())
            .build());
        return new ResponseEntity<>(new FileSystemResource(artifact.getPath()), headers, HttpStatus.OK);
    }

    private ResponseEntity<Object> error(HttpStatus status, String code, String message, PlanStatusResponse planStatus) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(PlanErrorResponse.builder()
                .error(code)
                .message(message)
                .status(planStatus)
                .build());
    }

    private static String planUrl(String athleteName, String action) {
        return UriComponentsBuilder.fromPath(BASE_PATH)
            .pathSegment(athleteName, action)
            .encode()
            .build()
            .toUriString();
    }
}
