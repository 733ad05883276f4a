package com.nosota.mescrow.error;

import java.util.UUID;

public class OrderNotShippableException extends ConflictException {

    public OrderNotShippableException(UUID id) {
        super("Order cannot be shipped in its current state: " + id);
    }
}
