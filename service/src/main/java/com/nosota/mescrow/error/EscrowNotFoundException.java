package com.nosota.mescrow.error;

import java.util.UUID;

public class EscrowNotFoundException extends NotFoundException {

    public EscrowNotFoundException(UUID id) {
        super("Escrow not found: " + id);
    }

    public EscrowNotFoundException(String message) {
        super(message);
    }
}
