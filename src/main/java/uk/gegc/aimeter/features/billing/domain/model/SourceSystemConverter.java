package uk.gegc.aimeter.features.billing.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;

/**
 * Stores {@link SourceSystem} by its wire name.
 */
@Converter
public class SourceSystemConverter implements AttributeConverter<SourceSystem, String> {

    @Override
    public String convertToDatabaseColumn(SourceSystem attribute) {
        return attribute == null ? null : attribute.wireName();
    }

    @Override
    public SourceSystem convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return Arrays.stream(SourceSystem.values())
                .filter(value -> value.wireName().equals(dbData))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown SourceSystem value: " + dbData));
    }
}
