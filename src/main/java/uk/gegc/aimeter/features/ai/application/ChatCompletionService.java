package uk.gegc.aimeter.features.ai.application;

import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatCompletion;
import uk.gegc.aimeter.features.ai.domain.model.ChatRunRequest;

/**
 * Single-shot (non-streamed) completion path, billed with provenance {@code response}.
 */
public interface ChatCompletionService {

    ChatCompletion complete(ChatRunRequest request, CallerIdentity caller);
}
