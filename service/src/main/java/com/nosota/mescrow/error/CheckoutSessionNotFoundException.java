package com.nosota.mescrow.error;

import java.util.UUID;

public class CheckoutSessionNotFoundException extends NotFoundException {

    public CheckoutSessionNotFoundException(UUID id) {
        super("Checkout session not found: " + id);
    }
}
