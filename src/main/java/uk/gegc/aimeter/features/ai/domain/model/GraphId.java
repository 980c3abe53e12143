package uk.gegc.aimeter.features.ai.domain.model;

import java.util.Optional;

/**
 * Namespaced graph id, {@code <providerId>:<graphName>}.
 */
public record GraphId(String providerId, String graphName) {

    public static final char SEPARATOR = ':';

    /**
     * Splits at the first separator. Empty when the separator is missing or either part is blank.
     */
    public static Optional<GraphId> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new GraphId(value.substring(0, idx), value.substring(idx + 1)));
    }

    @Override
    public String toString() {
        return providerId + SEPARATOR + graphName;
    }
}
