package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.OrderApi;
import com.nosota.mescrow.api.request.MarkShippedRequest;
import com.nosota.mescrow.api.response.OrderResponse;
import com.nosota.mescrow.error.MarketplaceException;
import com.nosota.mescrow.mapper.MarketplaceMapper;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.service.OrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderController implements OrderApi {

    private final OrderService orderService;

    @Override
    public ResponseEntity<OrderResponse> getOrder(UUID orderId) throws MarketplaceException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toOrderResponse(orderService.getOrder(orderId)));
    }

    @Override
    public ResponseEntity<OrderResponse> markShipped(UUID orderId, MarkShippedRequest request)
            throws MarketplaceException {
        Order order = orderService.markShipped(orderId, request.sellerId(), request.trackingInfo());
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toOrderResponse(order));
    }

    @Override
    public ResponseEntity<OrderResponse> confirmDelivery(UUID orderId, String buyerId) throws MarketplaceException {
        log.info("Confirming delivery: orderId={}, buyerId={}", orderId, buyerId);

        Order order = orderService.confirmDelivery(orderId, buyerId);
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toOrderResponse(order));
    }

    @Override
    public ResponseEntity<List<OrderResponse>> listBuyerOrders(String buyerId) {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toOrderResponseList(orderService.listForBuyer(buyerId)));
    }

    @Override
    public ResponseEntity<List<OrderResponse>> listSellerOrders(String sellerId) {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toOrderResponseList(orderService.listForSeller(sellerId)));
    }
}
