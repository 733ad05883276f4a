package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.PurchaseBondRequest;
import com.nosota.mescrow.api.response.SellerBondResponse;
import com.nosota.mescrow.api.response.SellerCategoryResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Seller API interface: category bonds paid from the wallet.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>SellerController - in service module (server-side implementation)</li>
 *   <li>SellerClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/sellers")
public interface SellerApi {

    /**
     * Debits the category bond and unlocks the category. A buyer becomes a seller.
     */
    @PostMapping("/{userId}/bonds")
    ResponseEntity<SellerBondResponse> purchaseBond(
            @PathVariable("userId") String userId,
            @RequestBody @Valid PurchaseBondRequest request) throws Exception;

    @GetMapping("/{userId}/categories")
    ResponseEntity<List<SellerCategoryResponse>> listCategories(@PathVariable("userId") String userId) throws Exception;
}
