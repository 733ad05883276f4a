package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.DisputeApi;
import com.nosota.mescrow.api.request.OpenDisputeRequest;
import com.nosota.mescrow.api.request.ResolveDisputeRequest;
import com.nosota.mescrow.api.request.SubmitEvidenceRequest;
import com.nosota.mescrow.api.response.DisputeResponse;
import com.nosota.mescrow.api.response.EvidenceResponse;
import com.nosota.mescrow.api.response.ResolutionResponse;
import com.nosota.mescrow.error.MarketplaceException;
import com.nosota.mescrow.mapper.MarketplaceMapper;
import com.nosota.mescrow.model.Dispute;
import com.nosota.mescrow.model.DisputeEvidence;
import com.nosota.mescrow.service.DisputeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for disputes.
 *
 * <p>The adjudicator ID arrives in the request body; the front end has already checked
 * that the caller may adjudicate.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class DisputeController implements DisputeApi {

    private final DisputeService disputeService;

    @Override
    public ResponseEntity<DisputeResponse> openDispute(OpenDisputeRequest request) throws MarketplaceException {
        log.info("Opening dispute: orderId={}, initiatorId={}", request.orderId(), request.initiatorId());

        Dispute dispute = disputeService.open(request.orderId(), request.initiatorId(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(MarketplaceMapper.INSTANCE.toDisputeResponse(dispute));
    }

    @Override
    public ResponseEntity<DisputeResponse> getDispute(UUID disputeId) throws MarketplaceException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toDisputeResponse(disputeService.getDispute(disputeId)));
    }

    @Override
    public ResponseEntity<List<DisputeResponse>> listOpenDisputes() {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toDisputeResponseList(disputeService.listOpen()));
    }

    @Override
    public ResponseEntity<EvidenceResponse> submitEvidence(UUID disputeId, SubmitEvidenceRequest request)
            throws MarketplaceException {
        DisputeEvidence evidence = disputeService.submitEvidence(
                disputeId, request.submitterId(), request.type(), request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(MarketplaceMapper.INSTANCE.toEvidenceResponse(evidence));
    }

    @Override
    public ResponseEntity<List<EvidenceResponse>> listEvidence(UUID disputeId) throws MarketplaceException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toEvidenceResponseList(disputeService.listEvidence(disputeId)));
    }

    @Override
    public ResponseEntity<ResolutionResponse> resolveDispute(UUID disputeId, ResolveDisputeRequest request)
            throws MarketplaceException {
        log.info("Resolving dispute: disputeId={}, resolution={}, adjudicatorId={}",
                disputeId, request.resolution(), request.adjudicatorId());

        DisputeService.Resolved resolved = disputeService.resolve(
                disputeId, request.resolution(), request.adjudicatorId(), request.notes());

        ResolutionResponse response = new ResolutionResponse(
                disputeId,
                resolved.dispute().getEscrowId(),
                resolved.dispute().getResolution().asString(),
                resolved.split().buyer(),
                resolved.split().seller(),
                resolved.split().destroyed()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<DisputeResponse> markWarningSent(UUID disputeId) throws MarketplaceException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toDisputeResponse(disputeService.markWarningSent(disputeId)));
    }
}
