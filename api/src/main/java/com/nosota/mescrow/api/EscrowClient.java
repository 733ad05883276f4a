package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.CreateEscrowRequest;
import com.nosota.mescrow.api.response.AutoReleaseResponse;
import com.nosota.mescrow.api.response.EscrowResponse;
import com.nosota.mescrow.api.response.MarketplaceStatsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of EscrowApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link WalletClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class EscrowClient implements EscrowApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<EscrowResponse> createEscrow(CreateEscrowRequest request) {
        log.debug("Calling createEscrow: buyerId={}, sellerId={}, amount={}",
                request.buyerId(), request.sellerId(), request.amount());

        return webClient.post()
                .uri("/api/v1/escrows")
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow(UUID escrowId) {
        log.debug("Calling getEscrow: escrowId={}", escrowId);

        return webClient.get()
                .uri("/api/v1/escrows/{escrowId}", escrowId)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> release(UUID escrowId) {
        log.debug("Calling release: escrowId={}", escrowId);

        return webClient.post()
                .uri("/api/v1/escrows/{escrowId}/release", escrowId)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> refund(UUID escrowId) {
        log.debug("Calling refund: escrowId={}", escrowId);

        return webClient.post()
                .uri("/api/v1/escrows/{escrowId}/refund", escrowId)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AutoReleaseResponse> processAutoReleases() {
        log.debug("Calling processAutoReleases");

        return webClient.post()
                .uri("/api/v1/escrows/auto-release")
                .retrieve()
                .toEntity(AutoReleaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MarketplaceStatsResponse> getStats() {
        return webClient.get()
                .uri("/api/v1/escrows/stats")
                .retrieve()
                .toEntity(MarketplaceStatsResponse.class)
                .block();
    }
}
