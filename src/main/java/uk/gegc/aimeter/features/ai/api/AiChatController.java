package uk.gegc.aimeter.features.ai.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.aimeter.features.ai.api.dto.ChatCompletionResponse;
import uk.gegc.aimeter.features.ai.api.dto.ChatRequest;
import uk.gegc.aimeter.features.ai.application.AiRuntimeService;
import uk.gegc.aimeter.features.ai.application.ChatCompletionService;
import uk.gegc.aimeter.features.ai.application.ChatRunHandle;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatCompletion;
import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.infra.web.RunEventSseWriter;
import uk.gegc.aimeter.shared.web.CallerIdentityResolver;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/ai")
@RequiredArgsConstructor
@Tag(name = "AI Chat", description = "Metered chat completions and streamed graph runs")
public class AiChatController {

    private final AiRuntimeService aiRuntimeService;
    private final ChatCompletionService chatCompletionService;
    private final CallerIdentityResolver callerIdentityResolver;
    private final RunEventSseWriter runEventSseWriter;

    @Operation(summary = "List runnable graphs of all providers")
    @ApiResponse(responseCode = "200", description = "Graph descriptors",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = GraphDescriptor.class))))
    @GetMapping("/graphs")
    public ResponseEntity<List<GraphDescriptor>> listGraphs() {
        return ResponseEntity.ok(aiRuntimeService.listGraphs());
    }

    @Operation(summary = "Single-shot chat completion",
            description = "Admission-checked completion through the LiteLLM proxy. Billing is recorded after the response and never blocks it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Completion returned",
                    content = @Content(schema = @Schema(implementation = ChatCompletionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid conversation"),
            @ApiResponse(responseCode = "401", description = "Missing caller identity headers"),
            @ApiResponse(responseCode = "402", description = "Insufficient credits"),
            @ApiResponse(responseCode = "503", description = "AI service unavailable")
    })
    @PostMapping("/chat/completions")
    public ResponseEntity<ChatCompletionResponse> complete(@Valid @RequestBody ChatRequest request,
                                                           HttpServletRequest httpRequest) {
        CallerIdentity caller = callerIdentityResolver.resolve(httpRequest);
        ChatCompletion completion = chatCompletionService.complete(request.toRunRequest(), caller);
        return ResponseEntity.ok(ChatCompletionResponse.from(completion));
    }

    @Operation(summary = "Streamed graph run",
            description = "Server-sent events: text_delta and tool events, then exactly one assistant_final or error, then done.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event stream opened"),
            @ApiResponse(responseCode = "400", description = "Invalid conversation"),
            @ApiResponse(responseCode = "401", description = "Missing caller identity headers"),
            @ApiResponse(responseCode = "402", description = "Insufficient credits")
    })
    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatRequest request, HttpServletRequest httpRequest) {
        CallerIdentity caller = callerIdentityResolver.resolve(httpRequest);
        ChatRunHandle handle = aiRuntimeService.runChatStream(request.toRunRequest(), caller);
        log.debug("Streaming run {} to caller {}", handle.runId(), caller.billingAccountId());
        return runEventSseWriter.open(handle);
    }
}
