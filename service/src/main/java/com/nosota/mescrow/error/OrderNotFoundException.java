package com.nosota.mescrow.error;

import java.util.UUID;

public class OrderNotFoundException extends NotFoundException {

    public OrderNotFoundException(UUID id) {
        super("Order not found: " + id);
    }
}
