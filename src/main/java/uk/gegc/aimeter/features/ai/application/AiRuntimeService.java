package uk.gegc.aimeter.features.ai.application;

import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;

import java.util.List;

public interface AiRuntimeService {

    /**
     * Applies conversation rules and admission control, then starts the graph run behind the relay.
     */
    ChatRunHandle runChatStream(ChatRunRequest request, CallerIdentity caller);

    List<GraphDescriptor> listGraphs();
}
