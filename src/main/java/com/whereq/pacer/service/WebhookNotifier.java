package com.whereq.pacer.service;

import com.whereq.pacer.config.PacerProperties;
import com.whereq.pacer.dto.PlanStatus;
import com.whereq.pacer.model.JobRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service for sending webhook notifications when a plan reaches a terminal state
 */
@Slf4j
@Service
public class WebhookNotifier {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final String webhookUrl;

    public WebhookNotifier(WebClient.Builder webClientBuilder, PacerProperties properties) {
        this.webClient = webClientBuilder.build();
        this.webhookUrl = properties.getNotifications().getWebhookUrl();
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    /**
     * Notify the configured webhook about a job's terminal state
     *
     * @param record job record after its terminal update
     * @return Mono that completes when the notification is sent or given up; never errors
     */
    public Mono<Void> notify(JobRecord record) {
        if (!isEnabled()) {
            return Mono.empty();
        }

        Map<String, Object> payload = buildPayload(record);

        return webClient.post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                record.getKey(), record.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.warn("Failed to send webhook notification for job {}: {}",
                record.getKey(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail job if webhook fails
            .then();
    }

    private Map<String, Object> buildPayload(JobRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("athleteName", record.getAthleteName());
        payload.put("status", PlanStatus.of(record.getStatus()).wireValue());
        payload.put("message", record.getMessage());
        payload.put("artifactAvailable", record.isArtifactAvailable());
        payload.put("timestamp", record.getUpdatedAt().toEpochMilli());
        return payload;
    }
}
