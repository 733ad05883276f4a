package com.nosota.mescrow.error;

import java.util.UUID;

public class DisputeAlreadyResolvedException extends ConflictException {

    public DisputeAlreadyResolvedException(UUID id) {
        super("Dispute already resolved: " + id);
    }
}
