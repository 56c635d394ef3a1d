package com.altar_funds.controller;

import com.altar_funds.dto.*;
import com.altar_funds.exception.GivingValidationException;
import com.altar_funds.model.CachedCategory;
import com.altar_funds.model.CachedChurch;
import com.altar_funds.model.CachedNotification;
import com.altar_funds.model.RecurringGiving;
import com.altar_funds.service.*;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class GivingController {

    private final DashboardAggregator dashboardAggregator;

    private final PaymentSessionManager paymentSessionManager;

    private final CacheSyncService cacheSyncService;

    private final TransactionListProjection projection;

    private final RecurringGivingService recurringGivingService;

    private final PledgeService pledgeService;

    @GetMapping("/dashboard")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<DashboardSnapshot>> dashboard() {
        return dashboardAggregator.refresh()
                .map(ApiResponse::ok);
    }

    @GetMapping(value = "/dashboard/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<DashboardSnapshot> dashboardStream() {
        return dashboardAggregator.snapshots();
    }

    @PostMapping("/giving")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<PaymentSessionResponse>> give(@RequestBody(required = false) GiveRequest request) {
        if (request == null) request = new GiveRequest(null, null);

        return paymentSessionManager.initiate(request.amount(), request.category())
                .map(PaymentSessionResponse::from)
                .map(ApiResponse::ok);
    }

    @PostMapping("/giving/{reference}/verify")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<TransactionRow>> verify(@PathVariable("reference") String reference) {
        return paymentSessionManager.verify(reference)
                .map(projection::toRow)
                .map(ApiResponse::ok);
    }

    @GetMapping("/transactions")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CachedRead<TransactionRow>>> transactions(
            @RequestParam(name = "limit", defaultValue = "" + CacheSyncService.DEFAULT_HISTORY_LIMIT) int limit) {
        if (limit < 1) {
            return Mono.error(new GivingValidationException("limit must be at least 1"));
        }
        return cacheSyncService.givingHistory(limit)
                .map(read -> new CachedRead<>(projection.project(read.items()), read.stale()))
                .map(ApiResponse::ok);
    }

    @GetMapping("/categories")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CachedRead<CachedCategory>>> categories() {
        return cacheSyncService.categories()
                .map(ApiResponse::ok);
    }

    @GetMapping("/church")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CachedRead<CachedChurch>>> church() {
        return cacheSyncService.church()
                .map(ApiResponse::ok);
    }

    @GetMapping("/notifications")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CachedRead<CachedNotification>>> notifications() {
        return cacheSyncService.notifications()
                .map(ApiResponse::ok);
    }

    @GetMapping("/recurring")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<List<RecurringGiving>>> recurring() {
        return recurringGivingService.list()
                .map(ApiResponse::ok);
    }

    @PostMapping("/recurring/{id}/pause")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<RecurringGiving>> pause(@PathVariable("id") String id) {
        return recurringGivingService.pause(id)
                .map(ApiResponse::ok);
    }

    @PostMapping("/recurring/{id}/resume")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<RecurringGiving>> resume(@PathVariable("id") String id) {
        return recurringGivingService.resume(id)
                .map(ApiResponse::ok);
    }

    @GetMapping("/pledges")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<List<PledgeProgress>>> pledges() {
        return pledgeService.pledges()
                .map(ApiResponse::ok);
    }
}
