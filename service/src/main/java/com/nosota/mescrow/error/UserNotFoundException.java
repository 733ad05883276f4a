package com.nosota.mescrow.error;

public class UserNotFoundException extends NotFoundException {

    public UserNotFoundException(String userId) {
        super("User not found: " + userId);
    }
}
