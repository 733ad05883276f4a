package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.CompleteCheckoutRequest;
import com.nosota.mescrow.api.response.CheckoutResponse;
import com.nosota.mescrow.api.response.OrderResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Checkout API interface.
 *
 * <p>Starting a checkout locks the current prices of the buyer's cart for a limited time.
 * Completing it pays the session and creates one escrow and one order per seller.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>CheckoutController - in service module (server-side implementation)</li>
 *   <li>CheckoutClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/checkout")
public interface CheckoutApi {

    /**
     * Starts (or returns the pending) checkout session of a user.
     */
    @PostMapping("/users/{userId}")
    ResponseEntity<CheckoutResponse> startCheckout(@PathVariable("userId") String userId) throws Exception;

    @GetMapping("/{sessionId}")
    ResponseEntity<CheckoutResponse> getCheckout(@PathVariable("sessionId") UUID sessionId) throws Exception;

    /**
     * Pays a pending checkout session.
     *
     * @param sessionId Session ID
     * @param request   Payment method and optional token
     * @return Orders created, one per seller
     */
    @PostMapping("/{sessionId}/complete")
    ResponseEntity<List<OrderResponse>> completeCheckout(
            @PathVariable("sessionId") UUID sessionId,
            @RequestBody @Valid CompleteCheckoutRequest request) throws Exception;
}
