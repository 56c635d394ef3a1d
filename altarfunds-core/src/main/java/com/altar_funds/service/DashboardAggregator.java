package com.altar_funds.service;

import com.altar_funds.api.AltarFundsApiClient;
import com.altar_funds.dto.DashboardSnapshot;
import com.altar_funds.dto.RecentTransactions;
import com.altar_funds.event.PaymentResolvedEvent;
import com.altar_funds.model.FinancialSummary;
import com.altar_funds.model.GivingTransaction;
import com.altar_funds.model.MemberProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Loads everything the member dashboard shows in one cycle. The three sections are fetched
 * concurrently and fail independently; a failed section is replaced by its fallback and the
 * cycle itself never errors.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardAggregator {

    static final int RECENT_LIMIT = 5;

    private final AltarFundsApiClient apiClient;
    private final TransactionListProjection projection;

    private final Sinks.Many<DashboardSnapshot> snapshots = Sinks.many().replay().latest();

    public Mono<DashboardSnapshot> load() {
        Mono<Optional<MemberProfile>> profile = apiClient.getProfile()
                .map(MemberProfile::from)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(err -> {
                    log.warn("Dashboard profile unavailable: {}", err.getMessage());
                    return Mono.just(Optional.empty());
                });

        Mono<FinancialSummary> summary = apiClient.getFinancialSummary()
                .map(FinancialSummary::from)
                .defaultIfEmpty(FinancialSummary.ZERO)
                .onErrorResume(err -> {
                    log.warn("Dashboard financial summary unavailable, showing zeros: {}", err.getMessage());
                    return Mono.just(FinancialSummary.ZERO);
                });

        Mono<RecentTransactions> recent = apiClient.getGivingHistory(RECENT_LIMIT)
                // server order is kept, the backend already sorts newest first
                .map(history -> history.stream()
                        .limit(RECENT_LIMIT)
                        .map(GivingTransaction::from)
                        .toList())
                .map(projection::project)
                .map(RecentTransactions::of)
                .defaultIfEmpty(RecentTransactions.empty())
                .onErrorResume(err -> {
                    log.warn("Dashboard recent transactions unavailable: {}", err.getMessage());
                    return Mono.just(RecentTransactions.empty());
                });

        return Mono.zip(profile, summary, recent)
                .map(t -> new DashboardSnapshot(t.getT1(), t.getT2(), t.getT3(), OffsetDateTime.now(ZoneOffset.UTC)));
    }

    /**
     * Runs a full load cycle and publishes the result to {@link #snapshots()} subscribers.
     */
    public Mono<DashboardSnapshot> refresh() {
        return load().doOnNext(snapshots::tryEmitNext);
    }

    /**
     * Latest snapshot followed by every later refresh.
     */
    public Flux<DashboardSnapshot> snapshots() {
        return snapshots.asFlux();
    }

    @EventListener
    public void onPaymentResolved(PaymentResolvedEvent event) {
        log.debug("Refreshing dashboard after payment {} resolved as {}", event.reference(), event.status());
        refresh().subscribe();
    }
}
