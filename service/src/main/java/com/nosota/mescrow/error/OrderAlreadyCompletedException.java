package com.nosota.mescrow.error;

import java.util.UUID;

public class OrderAlreadyCompletedException extends ConflictException {

    public OrderAlreadyCompletedException(UUID id) {
        super("Order already completed: " + id);
    }
}
