package uk.gegc.aimeter.features.ai.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation signal shared between the HTTP layer, the relay and the provider.
 * Listeners registered after the signal fired run immediately on the registering thread.
 */
public final class AbortSignal {

    private final List<Runnable> listeners = new ArrayList<>();
    private boolean aborted;

    public void abort() {
        List<Runnable> toRun;
        synchronized (this) {
            if (aborted) {
                return;
            }
            aborted = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    public void onAbort(Runnable listener) {
        synchronized (this) {
            if (!aborted) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }
}
