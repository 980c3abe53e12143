package uk.gegc.aimeter.features.ai.domain.model;

/**
 * @param graphId namespaced id in the form {@code <providerId>:<graphName>}
 */
public record GraphDescriptor(String graphId, String displayName, String description) {
}
