package com.whereq.pacer.generator;

import com.whereq.pacer.config.PacerProperties;
import com.whereq.pacer.exception.PlanGenerationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Plan generator that delegates to an external plan generation backend.
 * The backend answers a POST with a summary and the URL of the spreadsheet,
 * which is then streamed into the artifact directory.
 */
@Slf4j
@Service
public class RemotePlanGenerator implements PlanGenerator {

    private final WebClient webClient;
    private final String submitPath;
    private final Duration timeout;

    public RemotePlanGenerator(WebClient.Builder webClientBuilder, PacerProperties properties) {
        PacerProperties.GeneratorConfig config = properties.getGenerator();
        this.webClient = webClientBuilder.clone().baseUrl(config.getBaseUrl()).build();
        this.submitPath = config.getSubmitPath();
        this.timeout = config.getTimeout();
    }

    @Override
    public Mono<GenerationResult> generate(GenerationRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("athleteName", request.getAthleteName());
        body.put("goals", request.getGoals());

        log.info("Requesting training plan for {} from backend", request.getKey());

        return webClient.post()
            .uri(submitPath)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::toGenerationError)
            .bodyToMono(BackendPlanResponse.class)
            .switchIfEmpty(Mono.error(() -> new PlanGenerationException("Plan backend returned an empty response")))
            .flatMap(plan -> download(plan, request.getTargetPath()))
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof PlanGenerationException),
                e -> new PlanGenerationException("Plan backend call failed: " + e.getMessage(), e));
    }

    /**
     * Stream the artifact to a temporary file and move it into place.
     * A failed or cancelled transfer (timeout) removes the temporary file.
     */
    private Mono<GenerationResult> download(BackendPlanResponse plan, Path target) {
        if (plan.getArtifactUrl() == null || plan.getArtifactUrl().isBlank()) {
            return Mono.error(new PlanGenerationException("Plan backend did not return an artifact URL"));
        }

        Path partial = target.resolveSibling(target.getFileName() + ".part");

        Flux<DataBuffer> content = webClient.get()
            .uri(plan.getArtifactUrl())
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::toGenerationError)
            .bodyToFlux(DataBuffer.class);

        return Mono.fromCallable(() -> Files.createDirectories(target.getParent()))
            .subscribeOn(Schedulers.boundedElastic())
            .then(DataBufferUtils.write(content, partial,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))
            .then(Mono.fromCallable(() -> Files.move(partial, target,
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE))
                .subscribeOn(Schedulers.boundedElastic()))
            .doOnError(e -> deleteQuietly(partial))
            .doOnCancel(() -> deleteQuietly(partial))
            .doOnSuccess(path -> log.info("Stored training plan artifact {}", path))
            .thenReturn(GenerationResult.builder()
                .summary(plan.getSummary())
                .artifactRef(target.getFileName().toString())
                .build());
    }

    private Mono<Throwable> toGenerationError(ClientResponse response) {
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> new PlanGenerationException(
                "Plan backend answered " + response.statusCode().value() + ": " + body));
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (Exception e) {
            log.warn("Could not remove partial artifact {}: {}", path, e.getMessage());
        }
    }

    /**
     * Response of the plan generation backend
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackendPlanResponse {
        /**
         * Human-readable plan summary
         */
        private String summary;

        /**
         * Absolute URL, or path relative to the backend base URL, of the spreadsheet
         */
        private String artifactUrl;
    }
}
