package com.nosota.mescrow.error;

import java.util.UUID;

public class EscrowAlreadyRefundedException extends ConflictException {

    public EscrowAlreadyRefundedException(UUID id) {
        super("Escrow can no longer be refunded: " + id);
    }
}
