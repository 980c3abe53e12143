package uk.gegc.aimeter.features.ai.domain.model;

import java.util.List;

/**
 * @param graphName optional namespaced graph id; the configured default is used when blank
 * @param model     optional model id; the catalog default is used when blank
 */
public record ChatRunRequest(String graphName, String model, List<ChatMessage> messages) {
}
