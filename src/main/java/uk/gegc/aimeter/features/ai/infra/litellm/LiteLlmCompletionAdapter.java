package uk.gegc.aimeter.features.ai.infra.litellm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import uk.gegc.aimeter.features.ai.application.LlmCompletionPort;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionResult;
import uk.gegc.aimeter.features.ai.domain.model.TokenUsage;
import uk.gegc.aimeter.shared.exception.AiServiceException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * OpenAI-compatible chat completion through the LiteLLM proxy. Returns the message even when the
 * proxy omits {@code response_cost}; billing then runs in degraded mode.
 */
@Slf4j
@Component
public class LiteLlmCompletionAdapter implements LlmCompletionPort {

    static final String CHAT_COMPLETIONS_PATH = "/v1/chat/completions";
    static final String CALL_ID_HEADER = "x-litellm-call-id";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LiteLlmProperties properties;

    public LiteLlmCompletionAdapter(@Qualifier("liteLlmRestTemplate") RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    LiteLlmProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public LlmCompletionResult completion(LlmCompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("messages", toLiteLlmMessages(request.messages()));
        body.put("temperature", properties.getTemperature());
        body.put("max_tokens", properties.getMaxTokens());
        body.put("user", request.caller().billingAccountId());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(CHAT_COMPLETIONS_PATH, HttpMethod.POST,
                    new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new AiServiceException("LiteLLM API error: " + e.getMessage(), e);
        }

        if (response.getBody() == null) {
            throw new AiServiceException("Empty response from LiteLLM");
        }
        return parse(response, request.model());
    }

    private LlmCompletionResult parse(ResponseEntity<String> response, String requestedModel) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new AiServiceException("Invalid response from LiteLLM", e);
        }

        JsonNode choice = root.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        if (!content.isTextual()) {
            throw new AiServiceException("Invalid response from LiteLLM");
        }

        JsonNode usageNode = root.path("usage");
        TokenUsage usage = new TokenUsage(
                usageNode.path("prompt_tokens").asInt(0),
                usageNode.path("completion_tokens").asInt(0));

        BigDecimal cost = null;
        JsonNode costNode = root.path("response_cost");
        if (costNode.isNumber()) {
            cost = costNode.decimalValue();
        } else {
            log.warn("Missing response_cost in LiteLLM response - billing may be incomplete model={} promptTokens={} completionTokens={}",
                    requestedModel, usage.promptTokens(), usage.completionTokens());
        }

        String callId = response.getHeaders().getFirst(CALL_ID_HEADER);
        if (callId == null || callId.isBlank()) {
            callId = root.path("id").isTextual() ? root.path("id").asText() : null;
        }

        return new LlmCompletionResult(
                content.asText(),
                root.path("model").isTextual() ? root.path("model").asText() : requestedModel,
                choice.path("finish_reason").isTextual() ? choice.path("finish_reason").asText() : null,
                usage,
                cost,
                callId);
    }

    private List<Map<String, String>> toLiteLlmMessages(List<ChatMessage> messages) {
        return messages.stream()
                .map(message -> Map.of(
                        "role", message.role().name().toLowerCase(Locale.ROOT),
                        "content", message.content() == null ? "" : message.content()))
                .toList();
    }
}
