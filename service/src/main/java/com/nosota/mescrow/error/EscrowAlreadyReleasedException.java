package com.nosota.mescrow.error;

import java.util.UUID;

public class EscrowAlreadyReleasedException extends ConflictException {

    public EscrowAlreadyReleasedException(UUID id) {
        super("Escrow is not held: " + id);
    }
}
