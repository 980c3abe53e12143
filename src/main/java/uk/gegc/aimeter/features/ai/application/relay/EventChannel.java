package uk.gegc.aimeter.features.ai.application.relay;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded single-producer, single-consumer channel between the relay pump and the UI drain.
 * <p>
 * All state lives behind one lock: {@link #take()} checks "closed and drained" and parks on the
 * condition while holding it, so a {@link #close()} can never slip in between the check and the
 * wait. Only the producer closes the channel. The consumer leaves through {@link #detach()},
 * which discards queued items and makes later offers no-ops without stopping the producer.
 */
public final class EventChannel<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<T> queue = new ArrayDeque<>();
    private boolean closed;
    private boolean detached;

    /**
     * @return {@code false} when the channel is closed or the consumer detached
     */
    public boolean offer(T item) {
        lock.lock();
        try {
            if (closed || detached) {
                return false;
            }
            queue.addLast(item);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available.
     *
     * @return the next item, or {@code null} once the channel is closed and drained or detached
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                T next = queue.pollFirst();
                if (next != null) {
                    return next;
                }
                if (closed || detached) {
                    return null;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Producer side: no more items will be offered. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consumer side: stop receiving. Idempotent.
     */
    public void detach() {
        lock.lock();
        try {
            detached = true;
            queue.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    boolean isDetached() {
        lock.lock();
        try {
            return detached;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
