package com.altar_funds.api;

import com.altar_funds.api.dto.*;
import com.altar_funds.exception.NetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Calls the AltarFunds backend. Every failure (transport, non-2xx, undecodable body or a
 * {@code success=false} envelope) reaches the caller as a {@link NetworkException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AltarFundsApiClient {

    private static final ParameterizedTypeReference<ApiEnvelope<RemoteProfile>> PROFILE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<RemoteFinancialSummary>> SUMMARY =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<RemoteGivingHistory>> HISTORY =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<PaymentSessionCreated>> SESSION =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<List<RemoteRecurringGiving>>> RECURRING_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<RemoteRecurringGiving>> RECURRING =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<List<RemotePledge>>> PLEDGES =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<List<RemoteCategory>>> CATEGORIES =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<RemoteChurch>> CHURCH =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<List<RemoteNotification>>> NOTIFICATIONS =
            new ParameterizedTypeReference<>() {};

    @Qualifier("altarFundsWebClient")
    private final WebClient http;

    public Mono<RemoteProfile> getProfile() {
        return get("Profile fetch", b -> b.path("/auth/profile/").build(), PROFILE);
    }

    public Mono<RemoteFinancialSummary> getFinancialSummary() {
        return get("Financial summary fetch", b -> b.path("/dashboard/financial-summary/").build(), SUMMARY);
    }

    /**
     * Giving history, newest first as ordered by the backend.
     */
    public Mono<List<RemoteTransaction>> getGivingHistory(int limit) {
        return get("Giving history fetch",
                b -> b.path("/giving/history/").queryParam("limit", limit).build(), HISTORY)
                .map(history -> Optional.ofNullable(history.givings()).orElse(List.of()))
                .defaultIfEmpty(List.of());
    }

    public Mono<PaymentSessionCreated> createPaymentSession(PaymentSessionRequest request) {
        String operation = "Payment session creation";
        return http.post()
                .uri(b -> b.path("/payments/requests/").build())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SESSION)
                .flatMap(envelope -> unwrap(operation, envelope))
                .filter(created -> created.reference() != null && !created.reference().isBlank())
                .switchIfEmpty(Mono.error(() -> new NetworkException(operation + " returned no session reference")))
                .onErrorMap(ex -> !(ex instanceof NetworkException), ex -> wrap(operation, ex));
    }

    public Mono<PaymentStatusPayload> getPaymentStatus(String reference) {
        String operation = "Payment status check";
        return http.get()
                .uri(b -> b.path("/payments/requests/{reference}/status/").build(reference))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(PaymentStatusPayload.class)
                .switchIfEmpty(Mono.error(() -> new NetworkException(operation + " returned an empty body")))
                .onErrorMap(ex -> !(ex instanceof NetworkException), ex -> wrap(operation, ex));
    }

    public Mono<List<RemoteRecurringGiving>> getRecurringGivings() {
        return get("Recurring giving fetch", b -> b.path("/giving/recurring/").build(), RECURRING_LIST)
                .defaultIfEmpty(List.of());
    }

    public Mono<RemoteRecurringGiving> pauseRecurringGiving(String id) {
        return post("Recurring giving pause", b -> b.path("/giving/recurring/{id}/pause/").build(id), RECURRING);
    }

    public Mono<RemoteRecurringGiving> resumeRecurringGiving(String id) {
        return post("Recurring giving resume", b -> b.path("/giving/recurring/{id}/resume/").build(id), RECURRING);
    }

    public Mono<List<RemotePledge>> getPledges() {
        return get("Pledge fetch", b -> b.path("/giving/pledges/").build(), PLEDGES)
                .defaultIfEmpty(List.of());
    }

    public Mono<List<RemoteCategory>> getCategories() {
        return get("Category fetch", b -> b.path("/giving/categories/").build(), CATEGORIES)
                .defaultIfEmpty(List.of());
    }

    public Mono<RemoteChurch> getChurch(int churchId) {
        return get("Church fetch", b -> b.path("/churches/{id}/").build(churchId), CHURCH);
    }

    public Mono<List<RemoteNotification>> getNotifications() {
        return get("Notification fetch", b -> b.path("/notifications/").build(), NOTIFICATIONS)
                .defaultIfEmpty(List.of());
    }

    private <T> Mono<T> get(String operation,
                            Function<UriBuilder, URI> uri,
                            ParameterizedTypeReference<ApiEnvelope<T>> type) {
        return http.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(type)
                .flatMap(envelope -> unwrap(operation, envelope))
                .onErrorMap(ex -> !(ex instanceof NetworkException), ex -> wrap(operation, ex));
    }

    private <T> Mono<T> post(String operation,
                             Function<UriBuilder, URI> uri,
                             ParameterizedTypeReference<ApiEnvelope<T>> type) {
        return http.post()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(type)
                .flatMap(envelope -> unwrap(operation, envelope))
                .onErrorMap(ex -> !(ex instanceof NetworkException), ex -> wrap(operation, ex));
    }

    private static <T> Mono<T> unwrap(String operation, ApiEnvelope<T> envelope) {
        if (!envelope.success()) {
            String reason = envelope.message() == null ? "no reason given" : envelope.message();
            return Mono.error(new NetworkException(operation + " was rejected by the server: " + reason));
        }
        return Mono.justOrEmpty(envelope.data());
    }

    private static NetworkException wrap(String operation, Throwable cause) {
        log.debug("{} failed", operation, cause);
        return new NetworkException(operation + " failed: " + cause.getMessage(), cause);
    }
}
