package com.nosota.mescrow.model;

import com.nosota.mescrow.error.InvalidResolutionException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link DisputeResolution} in its string form.
 */
@Converter
public class DisputeResolutionConverter implements AttributeConverter<DisputeResolution, String> {

    @Override
    public String convertToDatabaseColumn(DisputeResolution resolution) {
        return resolution == null ? null : resolution.asString();
    }

    @Override
    public DisputeResolution convertToEntityAttribute(String value) {
        if (value == null) {
            return null;
        }
        try {
            return DisputeResolution.parse(value);
        } catch (InvalidResolutionException e) {
            throw new IllegalStateException("Corrupt resolution stored in dispute: " + value, e);
        }
    }
}
