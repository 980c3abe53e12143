package uk.gegc.aimeter.features.ai.application;

import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionResult;
import uk.gegc.aimeter.shared.exception.AiServiceException;

public interface LlmCompletionPort {

    /**
     * @throws AiServiceException when the provider call fails or returns an unusable response
     */
    LlmCompletionResult completion(LlmCompletionRequest request);
}
