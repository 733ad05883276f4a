package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.SellerApi;
import com.nosota.mescrow.api.request.PurchaseBondRequest;
import com.nosota.mescrow.api.response.SellerBondResponse;
import com.nosota.mescrow.api.response.SellerCategoryResponse;
import com.nosota.mescrow.error.MarketplaceException;
import com.nosota.mescrow.mapper.MarketplaceMapper;
import com.nosota.mescrow.service.SellerBondService;
import com.nosota.mescrow.service.SellerBondService.BondPurchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SellerController implements SellerApi {

    private final SellerBondService sellerBondService;

    @Override
    public ResponseEntity<SellerBondResponse> purchaseBond(String userId, PurchaseBondRequest request)
            throws MarketplaceException {
        log.info("Purchasing seller bond: userId={}, category={}", userId, request.category());

        BondPurchase purchase = sellerBondService.purchaseBond(userId, request.category());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(MarketplaceMapper.INSTANCE.toSellerBondResponse(purchase));
    }

    @Override
    public ResponseEntity<List<SellerCategoryResponse>> listCategories(String userId) throws MarketplaceException {
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toSellerCategoryResponseList(
                sellerBondService.listCategories(userId)));
    }
}
