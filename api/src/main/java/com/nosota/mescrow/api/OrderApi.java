package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.MarkShippedRequest;
import com.nosota.mescrow.api.response.OrderResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Order API interface: shipping and delivery confirmation.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>OrderController - in service module (server-side implementation)</li>
 *   <li>OrderClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/orders")
public interface OrderApi {

    @GetMapping("/{orderId}")
    ResponseEntity<OrderResponse> getOrder(@PathVariable("orderId") UUID orderId) throws Exception;

    @PostMapping("/{orderId}/ship")
    ResponseEntity<OrderResponse> markShipped(
            @PathVariable("orderId") UUID orderId,
            @RequestBody @Valid MarkShippedRequest request) throws Exception;

    /**
     * Buyer confirms delivery; the escrow is released to the seller.
     */
    @PostMapping("/{orderId}/confirm")
    ResponseEntity<OrderResponse> confirmDelivery(
            @PathVariable("orderId") UUID orderId,
            @RequestParam("buyerId") String buyerId) throws Exception;

    @GetMapping("/buyers/{buyerId}")
    ResponseEntity<List<OrderResponse>> listBuyerOrders(@PathVariable("buyerId") String buyerId);

    @GetMapping("/sellers/{sellerId}")
    ResponseEntity<List<OrderResponse>> listSellerOrders(@PathVariable("sellerId") String sellerId);
}
