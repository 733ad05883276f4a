package com.nosota.mescrow.error;

import com.nosota.mescrow.api.model.SellerCategory;

public class CategoryAlreadyBondedException extends ConflictException {

    public CategoryAlreadyBondedException(String userId, SellerCategory category) {
        super("Seller " + userId + " already holds category " + category);
    }
}
