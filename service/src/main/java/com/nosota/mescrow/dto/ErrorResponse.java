package com.nosota.mescrow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Error body returned by every failed API call.
 *
 * @param needed    For insufficient-balance errors: amount required
 * @param available For insufficient-balance errors: amount available
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        Long needed,
        Long available
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, null, null);
    }

    public static ErrorResponse insufficientBalance(int status, String message, String path,
                                                    long needed, long available) {
        return new ErrorResponse(LocalDateTime.now(), status, "Insufficient Balance", message, path,
                needed, available);
    }
}
