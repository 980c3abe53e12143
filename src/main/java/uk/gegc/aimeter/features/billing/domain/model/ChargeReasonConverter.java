package uk.gegc.aimeter.features.billing.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;

/**
 * Stores {@link ChargeReason} by its wire name.
 */
@Converter
public class ChargeReasonConverter implements AttributeConverter<ChargeReason, String> {

    @Override
    public String convertToDatabaseColumn(ChargeReason attribute) {
        return attribute == null ? null : attribute.wireName();
    }

    @Override
    public ChargeReason convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return Arrays.stream(ChargeReason.values())
                .filter(value -> value.wireName().equals(dbData))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown ChargeReason value: " + dbData));
    }
}
