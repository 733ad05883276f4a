package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.OpenDisputeRequest;
import com.nosota.mescrow.api.request.ResolveDisputeRequest;
import com.nosota.mescrow.api.request.SubmitEvidenceRequest;
import com.nosota.mescrow.api.response.DisputeResponse;
import com.nosota.mescrow.api.response.EvidenceResponse;
import com.nosota.mescrow.api.response.ResolutionResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Dispute API interface.
 *
 * <p>Dispute lifecycle: open → evidence → resolve. Resolution strings are
 * {@code buyer_full}, {@code seller_full}, {@code burn} or {@code split_<b>_<s>} with b + s = 100.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>DisputeController - in service module (server-side implementation)</li>
 *   <li>DisputeClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/disputes")
public interface DisputeApi {

    @PostMapping
    ResponseEntity<DisputeResponse> openDispute(@RequestBody @Valid OpenDisputeRequest request) throws Exception;

    @GetMapping("/{disputeId}")
    ResponseEntity<DisputeResponse> getDispute(@PathVariable("disputeId") UUID disputeId) throws Exception;

    /**
     * Lists open disputes, nearest auto-resolve deadline first.
     */
    @GetMapping
    ResponseEntity<List<DisputeResponse>> listOpenDisputes();

    @PostMapping("/{disputeId}/evidence")
    ResponseEntity<EvidenceResponse> submitEvidence(
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid SubmitEvidenceRequest request) throws Exception;

    @GetMapping("/{disputeId}/evidence")
    ResponseEntity<List<EvidenceResponse>> listEvidence(@PathVariable("disputeId") UUID disputeId) throws Exception;

    /**
     * Resolves an open dispute and moves the escrowed funds accordingly.
     *
     * @param disputeId Dispute ID
     * @param request   Resolution string, adjudicator and notes
     * @return Computed fund split
     */
    @PostMapping("/{disputeId}/resolve")
    ResponseEntity<ResolutionResponse> resolveDispute(
            @PathVariable("disputeId") UUID disputeId,
            @RequestBody @Valid ResolveDisputeRequest request) throws Exception;

    /**
     * Records that the auto-resolve warning for a dispute was delivered.
     */
    @PostMapping("/{disputeId}/warning-sent")
    ResponseEntity<DisputeResponse> markWarningSent(@PathVariable("disputeId") UUID disputeId) throws Exception;
}
