package com.whereq.pacer.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient builder for the plan generation backend and webhook notifications.
 * Artifacts are streamed, so the in-memory codec limit only bounds JSON bodies.
 */
@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;
    private static final int MAX_JSON_BODY_BYTES = 2 * 1024 * 1024; // 2MB
    private static final String USER_AGENT = "whereq-pacer";

    @Bean
    public WebClient.Builder webClientBuilder(PacerProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(responseTimeout(properties));

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_JSON_BODY_BYTES));
    }

    /**
     * Time allowed between request and response headers; generation itself may
     * take minutes, so this follows the generator timeout
     */
    private static Duration responseTimeout(PacerProperties properties) {
        Duration generatorTimeout = properties.getGenerator().getTimeout();
        return generatorTimeout != null ? generatorTimeout : Duration.ofMinutes(10);
    }
}
