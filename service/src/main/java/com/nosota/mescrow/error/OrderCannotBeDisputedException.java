package com.nosota.mescrow.error;

import java.util.UUID;

public class OrderCannotBeDisputedException extends ConflictException {

    public OrderCannotBeDisputedException(UUID id) {
        super("Order cannot be disputed in its current state: " + id);
    }
}
