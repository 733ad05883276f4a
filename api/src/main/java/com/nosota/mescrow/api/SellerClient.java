package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.PurchaseBondRequest;
import com.nosota.mescrow.api.response.SellerBondResponse;
import com.nosota.mescrow.api.response.SellerCategoryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of SellerApi.
 */
@RequiredArgsConstructor
@Slf4j
public class SellerClient implements SellerApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<SellerBondResponse> purchaseBond(String userId, PurchaseBondRequest request) {
        log.debug("Calling purchaseBond: userId={}, category={}", userId, request.category());

        return webClient.post()
                .uri("/api/v1/sellers/{userId}/bonds", userId)
                .bodyValue(request)
                .retrieve()
                .toEntity(SellerBondResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<SellerCategoryResponse>> listCategories(String userId) {
        return webClient.get()
                .uri("/api/v1/sellers/{userId}/categories", userId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SellerCategoryResponse>>() {})
                .block();
    }
}
