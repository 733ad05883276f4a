package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.CreateEscrowRequest;
import com.nosota.mescrow.api.response.AutoReleaseResponse;
import com.nosota.mescrow.api.response.EscrowResponse;
import com.nosota.mescrow.api.response.MarketplaceStatsResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Escrow API interface.
 *
 * <p>Exposes the escrow engine: creation, release to seller, refund to buyer,
 * and the auto-release trigger.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>EscrowController - in service module (server-side implementation)</li>
 *   <li>EscrowClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/escrows")
public interface EscrowApi {

    /**
     * Creates a HELD escrow, debiting the buyer.
     *
     * @param request Buyer, seller, amount and optional hold days
     * @return Created escrow
     */
    @PostMapping
    ResponseEntity<EscrowResponse> createEscrow(@RequestBody @Valid CreateEscrowRequest request) throws Exception;

    @GetMapping("/{escrowId}")
    ResponseEntity<EscrowResponse> getEscrow(@PathVariable("escrowId") UUID escrowId) throws Exception;

    /**
     * Releases a HELD escrow to the seller.
     *
     * @param escrowId Escrow ID
     * @return Released escrow
     */
    @PostMapping("/{escrowId}/release")
    ResponseEntity<EscrowResponse> release(@PathVariable("escrowId") UUID escrowId) throws Exception;

    /**
     * Refunds a HELD or DISPUTED escrow to the buyer.
     *
     * @param escrowId Escrow ID
     * @return Refunded escrow
     */
    @PostMapping("/{escrowId}/refund")
    ResponseEntity<EscrowResponse> refund(@PathVariable("escrowId") UUID escrowId) throws Exception;

    /**
     * Releases every HELD escrow whose auto-release deadline has passed.
     *
     * @return Number of escrows released
     */
    @PostMapping("/auto-release")
    ResponseEntity<AutoReleaseResponse> processAutoReleases();

    /**
     * Gets admin dashboard figures.
     *
     * @return Open dispute count and total funds held in escrow
     */
    @GetMapping("/stats")
    ResponseEntity<MarketplaceStatsResponse> getStats();
}
