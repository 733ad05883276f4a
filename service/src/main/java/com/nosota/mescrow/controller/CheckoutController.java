package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.CheckoutApi;
import com.nosota.mescrow.api.request.CompleteCheckoutRequest;
import com.nosota.mescrow.api.response.CheckoutResponse;
import com.nosota.mescrow.api.response.OrderResponse;
import com.nosota.mescrow.error.MarketplaceException;
import com.nosota.mescrow.mapper.MarketplaceMapper;
import com.nosota.mescrow.model.CheckoutSession;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.service.CheckoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class CheckoutController implements CheckoutApi {

    private final CheckoutService checkoutService;

    @Override
    public ResponseEntity<CheckoutResponse> startCheckout(String userId) throws MarketplaceException {
        CheckoutSession session = checkoutService.start(userId);
        return ResponseEntity.ok(toResponse(session));
    }

    @Override
    public ResponseEntity<CheckoutResponse> getCheckout(UUID sessionId) throws MarketplaceException {
        return ResponseEntity.ok(toResponse(checkoutService.getSession(sessionId)));
    }

    @Override
    public ResponseEntity<List<OrderResponse>> completeCheckout(UUID sessionId, CompleteCheckoutRequest request)
            throws MarketplaceException {
        log.info("Completing checkout: sessionId={}, method={}", sessionId, request.method());

        List<Order> orders = checkoutService.complete(sessionId, request.method(), request.token());
        return ResponseEntity.status(HttpStatus.CREATED).body(MarketplaceMapper.INSTANCE.toOrderResponseList(orders));
    }

    private CheckoutResponse toResponse(CheckoutSession session) {
        return new CheckoutResponse(
                session.getId(),
                session.getUserId(),
                session.getStatus(),
                session.getTotalAmount(),
                session.getFeeAmount(),
                session.getCreatedAt(),
                session.getExpiresAt(),
                session.getPaidAt(),
                MarketplaceMapper.INSTANCE.toCheckoutItemResponseList(checkoutService.getItems(session.getId()))
        );
    }
}
