package com.nosota.mescrow.error;

import java.util.UUID;

public class DisputeNotFoundException extends NotFoundException {

    public DisputeNotFoundException(UUID id) {
        super("Dispute not found: " + id);
    }
}
