package uk.gegc.aimeter.features.ai.application.relay;

import uk.gegc.aimeter.features.ai.domain.event.AiEvent;
import uk.gegc.aimeter.shared.exception.AiServiceException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Caller-facing view of a relayed run. Blocking iterator over UI events; ends after {@code done}.
 * Closing it detaches from the run without affecting billing.
 */
public final class UiEventStream implements Iterator<AiEvent>, AutoCloseable {

    private final EventChannel<AiEvent> channel;
    private AiEvent next;
    private volatile boolean finished;

    UiEventStream(EventChannel<AiEvent> channel) {
        this.channel = channel;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            next = channel.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting for run events", e);
        }
        if (next == null) {
            finished = true;
            return false;
        }
        return true;
    }

    @Override
    public AiEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Run event stream is finished");
        }
        AiEvent event = next;
        next = null;
        return event;
    }

    /**
     * Sequential stream view; closing the stream detaches.
     */
    public Stream<AiEvent> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(this::close);
    }

    @Override
    public void close() {
        finished = true;
        next = null;
        channel.detach();
    }
}
