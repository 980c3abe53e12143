package uk.gegc.aimeter.features.billing.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;

/**
 * Stores {@link ChargeProvenance} by its wire name.
 */
@Converter
public class ChargeProvenanceConverter implements AttributeConverter<ChargeProvenance, String> {

    @Override
    public String convertToDatabaseColumn(ChargeProvenance attribute) {
        return attribute == null ? null : attribute.wireName();
    }

    @Override
    public ChargeProvenance convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return Arrays.stream(ChargeProvenance.values())
                .filter(value -> value.wireName().equals(dbData))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown ChargeProvenance value: " + dbData));
    }
}
