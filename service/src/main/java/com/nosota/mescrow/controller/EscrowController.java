package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.EscrowApi;
import com.nosota.mescrow.api.request.CreateEscrowRequest;
import com.nosota.mescrow.api.response.AutoReleaseResponse;
import com.nosota.mescrow.api.response.EscrowResponse;
import com.nosota.mescrow.api.response.MarketplaceStatsResponse;
import com.nosota.mescrow.error.EscrowAlreadyRefundedException;
import com.nosota.mescrow.error.EscrowAlreadyReleasedException;
import com.nosota.mescrow.error.EscrowNotFoundException;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.mapper.MarketplaceMapper;
import com.nosota.mescrow.model.Escrow;
import com.nosota.mescrow.service.DisputeService;
import com.nosota.mescrow.service.EscrowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for the escrow engine.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowController implements EscrowApi {

    private final EscrowService escrowService;
    private final DisputeService disputeService;

    @Override
    public ResponseEntity<EscrowResponse> createEscrow(CreateEscrowRequest request)
            throws UserNotFoundException, InsufficientBalanceException {
        log.info("Creating escrow: buyerId={}, sellerId={}, amount={}, holdDays={}",
                request.buyerId(), request.sellerId(), request.amount(), request.holdDays());

        Escrow escrow = request.holdDays() == null
                ? escrowService.createEscrow(request.buyerId(), request.sellerId(), request.amount())
                : escrowService.createEscrow(request.buyerId(), request.sellerId(), request.amount(), request.holdDays());

        return ResponseEntity.status(HttpStatus.CREATED).body(MarketplaceMapper.INSTANCE.toEscrowResponse(escrow));
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow(UUID escrowId) throws EscrowNotFoundException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toEscrowResponse(escrowService.getEscrow(escrowId)));
    }

    @Override
    public ResponseEntity<EscrowResponse> release(UUID escrowId)
            throws EscrowNotFoundException, EscrowAlreadyReleasedException, UserNotFoundException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toEscrowResponse(escrowService.release(escrowId)));
    }

    @Override
    public ResponseEntity<EscrowResponse> refund(UUID escrowId)
            throws EscrowNotFoundException, EscrowAlreadyReleasedException, EscrowAlreadyRefundedException,
            UserNotFoundException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toEscrowResponse(escrowService.refund(escrowId)));
    }

    @Override
    public ResponseEntity<AutoReleaseResponse> processAutoReleases() {
        int released = escrowService.processAutoReleases();
        return ResponseEntity.ok(new AutoReleaseResponse(released));
    }

    @Override
    public ResponseEntity<MarketplaceStatsResponse> getStats() {
        return ResponseEntity.ok(new MarketplaceStatsResponse(disputeService.countOpen(), escrowService.totalHeld()));
    }
}
