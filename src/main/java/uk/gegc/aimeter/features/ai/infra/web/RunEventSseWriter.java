package uk.gegc.aimeter.features.ai.infra.web;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.aimeter.features.ai.application.ChatRunHandle;
import uk.gegc.aimeter.features.ai.application.relay.UiEventStream;
import uk.gegc.aimeter.features.ai.domain.event.AiEvent;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Drains a run's UI stream into an {@link SseEmitter}, one SSE event per {@link AiEvent} named by
 * its type. A disconnect, timeout or write failure aborts the run and detaches; a normally
 * completed stream only detaches. Billing is unaffected either way.
 */
@Slf4j
@Component
public class RunEventSseWriter {

    private final Executor sseExecutor;
    private final long timeoutMs;

    public RunEventSseWriter(@Qualifier("sseTaskExecutor") Executor sseExecutor,
                             @Value("${ai.sse.timeout-ms:300000}") long timeoutMs) {
        this.sseExecutor = sseExecutor;
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter open(ChatRunHandle handle) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        emitter.onTimeout(() -> {
            log.info("SSE timeout after {} ms for run {}", timeoutMs, handle.runId());
            abortAndDetach(handle);
        });
        emitter.onError(e -> {
            log.info("SSE error for run {}: {}", handle.runId(), e.getMessage());
            abortAndDetach(handle);
        });
        emitter.onCompletion(() -> handle.events().close());

        Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        sseExecutor.execute(() -> {
            if (mdcContext != null) {
                MDC.setContextMap(mdcContext);
            }
            try {
                drain(handle, emitter);
            } finally {
                MDC.clear();
            }
        });
        return emitter;
    }

    void drain(ChatRunHandle handle, SseEmitter emitter) {
        UiEventStream events = handle.events();
        long sequence = 0;
        try {
            while (events.hasNext()) {
                AiEvent event = events.next();
                emitter.send(SseEmitter.event()
                        .id(handle.runId() + ":" + sequence++)
                        .name(event.type())
                        .data(event, MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            // Client gone or emitter already completed by a timeout
            log.info("Client disconnected from run {} after {} events: {}", handle.runId(), sequence, e.getMessage());
            abortAndDetach(handle);
        } catch (RuntimeException e) {
            log.warn("Streaming run {} failed after {} events", handle.runId(), sequence, e);
            abortAndDetach(handle);
            emitter.completeWithError(e);
        }
    }

    private static void abortAndDetach(ChatRunHandle handle) {
        handle.abortSignal().abort();
        handle.events().close();
    }
}
