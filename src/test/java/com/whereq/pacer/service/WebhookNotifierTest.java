package com.whereq.pacer.service;

import com.whereq.pacer.config.PacerProperties;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookNotifierTest {

    private static final String WEBHOOK_URL = "http://hooks.test/plans";

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private final JobRecord completed = JobRecord
        .processing(JobKey.of("Jane Doe"), "Jane Doe", null, Instant.parse("2026-01-05T10:00:00Z"))
        .transition(JobStatus.COMPLETED, "12-week plan", "jane_doe_plan.xlsx", Instant.parse("2026-01-05T10:05:00Z"));

    @Test
    void disabledWithoutUrl() {
        WebhookNotifier notifier = notifier(null, Mono.just(ClientResponse.create(HttpStatus.OK).build()));

        assertThat(notifier.isEnabled()).isFalse();
        StepVerifier.create(notifier.notify(completed)).verifyComplete();
        assertThat(requests).isEmpty();
    }

    @Test
    void postsToConfiguredUrl() {
        WebhookNotifier notifier = notifier(WEBHOOK_URL, Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build()));

        StepVerifier.create(notifier.notify(completed)).verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo(WEBHOOK_URL);
    }

    @Test
    void failingWebhookDoesNotPropagate() {
        WebhookNotifier notifier = notifier(WEBHOOK_URL, Mono.error(new IOException("connection reset")));

        StepVerifier.create(notifier.notify(completed)).verifyComplete();
    }

    @Test
    void errorStatusDoesNotPropagate() {
        WebhookNotifier notifier = notifier(WEBHOOK_URL,
            Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build()));

        StepVerifier.create(notifier.notify(completed)).verifyComplete();
    }

    private WebhookNotifier notifier(String url, Mono<ClientResponse> response) {
        PacerProperties properties = new PacerProperties();
        properties.getNotifications().setWebhookUrl(url);
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return response;
        });
        return new WebhookNotifier(builder, properties);
    }
}
