package dev.jobmatcher.push;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.jobmatcher.config.PushConfig;
import dev.jobmatcher.model.NotificationTarget;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Apple Push Notification service provider over its HTTP/2 JSON API.
 * Authenticates every request with the current provider token from {@link ApnsTokenProvider}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "push.provider", havingValue = "apns")
public class ApnsPushProvider implements PushProvider {

    private static final String DEVICE_PATH = "/3/device/{token}";
    private static final Set<String> TOKEN_REJECTIONS = Set.of("ExpiredProviderToken", "InvalidProviderToken");

    private final WebClient webClient;
    private final ApnsTokenProvider tokenProvider;
    private final Duration timeout;
    private final HttpProtocol protocol;

    public ApnsPushProvider(WebClient.Builder webClientBuilder, PushConfig pushConfig,
                            ApnsTokenProvider tokenProvider) {
        PushConfig.Apns apns = pushConfig.getApns();
        String baseUrl = Objects.requireNonNull(apns.getBaseUrl());
        this.tokenProvider = tokenProvider;
        this.timeout = apns.getTimeout();
        // APNs only speaks HTTP/2; cleartext endpoints (local gateways) get h2c with prior knowledge
        this.protocol = baseUrl.startsWith("http://") ? HttpProtocol.H2C : HttpProtocol.H2;

        HttpClient httpClient = HttpClient.create()
                .protocol(protocol);

        WebClient.Builder builder = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .baseUrl(baseUrl)
                .defaultHeader("apns-push-type", "alert")
                .defaultHeader("apns-priority", "10");
        if (apns.getTopic() != null && !apns.getTopic().isBlank()) {
            builder.defaultHeader("apns-topic", apns.getTopic());
        } else {
            log.warn("APNs topic is not set! Deliveries for token-based auth will be rejected.");
        }
        this.webClient = builder.build();

        log.info("APNs push delivery enabled against {} over {} (topic: {})", baseUrl, protocol, apns.getTopic());
    }

    @Override
    public String getName() {
        return "apns";
    }

    @Override
    @SuppressWarnings("null")
    public Mono<PushResponse> send(NotificationTarget target, PushPayload payload) {
        return Mono.defer(() -> webClient.post()
                        .uri(DEVICE_PATH, target.getDeviceToken())
                        .header(HttpHeaders.AUTHORIZATION, "bearer " + tokenProvider.currentToken())
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(payload)
                        .exchangeToMono(this::toPushResponse))
                .timeout(timeout)
                .retryWhen(Retry.backoff(2, Duration.ofMillis(200))
                        .filter(WebClientRequestException.class::isInstance)
                        .doBeforeRetry(signal -> log.info("Retrying push to target {} (Attempt {})",
                                target.getTargetId(), signal.totalRetries() + 1)))
                .onErrorResume(e -> {
                    log.warn("Push transport failure for target {}: {}", target.getTargetId(), e.getMessage());
                    return Mono.just(PushResponse.rejected("transport_error", e.getMessage()));
                });
    }

    private Mono<PushResponse> toPushResponse(ClientResponse response) {
        String status = String.valueOf(response.statusCode().value());
        if (response.statusCode().is2xxSuccessful()) {
            String apnsId = response.headers().asHttpHeaders().getFirst("apns-id");
            return response.releaseBody()
                    .thenReturn(PushResponse.delivered(status, apnsId));
        }
        return response.bodyToMono(ApnsError.class)
                .doOnNext(error -> {
                    if (TOKEN_REJECTIONS.contains(error.getReason())) {
                        log.warn("APNs rejected the provider token ({}), signing a new one", error.getReason());
                        tokenProvider.invalidate();
                    }
                })
                .map(error -> PushResponse.rejected(status, error.getReason()))
                .onErrorResume(e -> Mono.just(PushResponse.rejected(status, null)))
                .defaultIfEmpty(PushResponse.rejected(status, null));
    }

    HttpProtocol getProtocol() {
        return protocol;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApnsError {
        private String reason;
    }
}
