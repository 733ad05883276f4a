package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.OpenDisputeRequest;
import com.nosota.mescrow.api.request.ResolveDisputeRequest;
import com.nosota.mescrow.api.request.SubmitEvidenceRequest;
import com.nosota.mescrow.api.response.DisputeResponse;
import com.nosota.mescrow.api.response.EvidenceResponse;
import com.nosota.mescrow.api.response.ResolutionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of DisputeApi.
 */
@RequiredArgsConstructor
@Slf4j
public class DisputeClient implements DisputeApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<DisputeResponse> openDispute(OpenDisputeRequest request) {
        log.debug("Calling openDispute: orderId={}, initiatorId={}", request.orderId(), request.initiatorId());

        return webClient.post()
                .uri("/api/v1/disputes")
                .bodyValue(request)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> getDispute(UUID disputeId) {
        return webClient.get()
                .uri("/api/v1/disputes/{disputeId}", disputeId)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<DisputeResponse>> listOpenDisputes() {
        return webClient.get()
                .uri("/api/v1/disputes")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<DisputeResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<EvidenceResponse> submitEvidence(UUID disputeId, SubmitEvidenceRequest request) {
        log.debug("Calling submitEvidence: disputeId={}, submitterId={}, type={}",
                disputeId, request.submitterId(), request.type());

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/evidence", disputeId)
                .bodyValue(request)
                .retrieve()
                .toEntity(EvidenceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<EvidenceResponse>> listEvidence(UUID disputeId) {
        return webClient.get()
                .uri("/api/v1/disputes/{disputeId}/evidence", disputeId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<EvidenceResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<ResolutionResponse> resolveDispute(UUID disputeId, ResolveDisputeRequest request) {
        log.debug("Calling resolveDispute: disputeId={}, resolution={}", disputeId, request.resolution());

        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/resolve", disputeId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ResolutionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisputeResponse> markWarningSent(UUID disputeId) {
        return webClient.post()
                .uri("/api/v1/disputes/{disputeId}/warning-sent", disputeId)
                .retrieve()
                .toEntity(DisputeResponse.class)
                .block();
    }
}
