package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.CompleteCheckoutRequest;
import com.nosota.mescrow.api.response.CheckoutResponse;
import com.nosota.mescrow.api.response.OrderResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of CheckoutApi.
 */
@RequiredArgsConstructor
@Slf4j
public class CheckoutClient implements CheckoutApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<CheckoutResponse> startCheckout(String userId) {
        log.debug("Calling startCheckout: userId={}", userId);

        return webClient.post()
                .uri("/api/v1/checkout/users/{userId}", userId)
                .retrieve()
                .toEntity(CheckoutResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CheckoutResponse> getCheckout(UUID sessionId) {
        return webClient.get()
                .uri("/api/v1/checkout/{sessionId}", sessionId)
                .retrieve()
                .toEntity(CheckoutResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<OrderResponse>> completeCheckout(UUID sessionId, CompleteCheckoutRequest request) {
        log.debug("Calling completeCheckout: sessionId={}, method={}", sessionId, request.method());

        return webClient.post()
                .uri("/api/v1/checkout/{sessionId}/complete", sessionId)
                .bodyValue(request)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<OrderResponse>>() {})
                .block();
    }
}
