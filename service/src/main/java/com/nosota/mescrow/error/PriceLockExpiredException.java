package com.nosota.mescrow.error;

import java.util.UUID;

public class PriceLockExpiredException extends ConflictException {

    public PriceLockExpiredException(UUID id) {
        super("Price lock expired for checkout session: " + id);
    }
}
