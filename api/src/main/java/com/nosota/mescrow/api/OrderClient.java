package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.MarkShippedRequest;
import com.nosota.mescrow.api.response.OrderResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of OrderApi.
 */
@RequiredArgsConstructor
@Slf4j
public class OrderClient implements OrderApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<OrderResponse> getOrder(UUID orderId) {
        return webClient.get()
                .uri("/api/v1/orders/{orderId}", orderId)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OrderResponse> markShipped(UUID orderId, MarkShippedRequest request) {
        log.debug("Calling markShipped: orderId={}, sellerId={}", orderId, request.sellerId());

        return webClient.post()
                .uri("/api/v1/orders/{orderId}/ship", orderId)
                .bodyValue(request)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OrderResponse> confirmDelivery(UUID orderId, String buyerId) {
        log.debug("Calling confirmDelivery: orderId={}, buyerId={}", orderId, buyerId);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/orders/{orderId}/confirm")
                        .queryParam("buyerId", buyerId)
                        .build(orderId))
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<OrderResponse>> listBuyerOrders(String buyerId) {
        return webClient.get()
                .uri("/api/v1/orders/buyers/{buyerId}", buyerId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<OrderResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<OrderResponse>> listSellerOrders(String sellerId) {
        return webClient.get()
                .uri("/api/v1/orders/sellers/{sellerId}", sellerId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<OrderResponse>>() {})
                .block();
    }
}
