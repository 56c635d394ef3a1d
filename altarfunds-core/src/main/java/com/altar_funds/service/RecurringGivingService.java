package com.altar_funds.service;

import com.altar_funds.api.AltarFundsApiClient;
import com.altar_funds.exception.GivingValidationException;
import com.altar_funds.exception.NetworkException;
import com.altar_funds.model.RecurringGiving;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Standing gifts. The schedule itself runs on the backend; this side only lists them and sends
 * the member's pause and resume requests.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecurringGivingService {

    private final AltarFundsApiClient apiClient;

    public Mono<List<RecurringGiving>> list() {
        return apiClient.getRecurringGivings()
                .map(list -> list.stream().map(RecurringGiving::from).toList());
    }

    public Mono<RecurringGiving> pause(String id) {
        return requireId(id)
                .flatMap(apiClient::pauseRecurringGiving)
                .map(RecurringGiving::from)
                .switchIfEmpty(Mono.error(() -> new NetworkException("Pause of recurring giving " + id + " returned nothing")))
                .doOnNext(updated -> log.info("Recurring giving {} is now {}", id, updated.status()));
    }

    public Mono<RecurringGiving> resume(String id) {
        return requireId(id)
                .flatMap(apiClient::resumeRecurringGiving)
                .map(RecurringGiving::from)
                .switchIfEmpty(Mono.error(() -> new NetworkException("Resume of recurring giving " + id + " returned nothing")))
                .doOnNext(updated -> log.info("Recurring giving {} is now {}", id, updated.status()));
    }

    private static Mono<String> requireId(String id) {
        return id == null || id.isBlank()
                ? Mono.error(new GivingValidationException("Recurring giving id is required"))
                : Mono.just(id);
    }
}
