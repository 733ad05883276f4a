package com.nosota.mescrow.error;

public class CartEmptyException extends ConflictException {

    public CartEmptyException(String userId) {
        super("Cart is empty for user: " + userId);
    }
}
