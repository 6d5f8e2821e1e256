package com.acme.metadata.extractor.queue;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded blocking multi-producer, single-consumer channel.
 *
 * <p>{@link #send(Object)} blocks while the channel is full, which is the only backpressure
 * the pipeline applies. Closing has two directions:</p>
 * <ul>
 *   <li>{@link #close()} by the producer side: no more sends; the consumer drains what is
 *   queued and then sees end-of-stream ({@code null} from {@link #receive()}).</li>
 *   <li>{@link #disconnect()} by the consumer side: blocked and future sends return
 *   {@link SendResult.Closed}; queued items are discarded.</li>
 * </ul>
 */
public final class BoundedChannel<E> implements AutoCloseable {
    private static final long POLL_SLICE_MS = 50L;

    private final BlockingQueue<E> queue;
    private final int capacity;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean disconnected = new AtomicBoolean(false);
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong received = new AtomicLong();

    public BoundedChannel(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.queue = new ArrayBlockingQueue<>(this.capacity);
    }

    public int capacity() {
        return capacity;
    }

    public int sizeApprox() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed.get() || disconnected.get();
    }

    /**
     * Blocks until there is room, or until the channel is closed or disconnected.
     *
     * @throws InterruptedException if the producer thread is interrupted while waiting
     */
    public SendResult send(E item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        while (true) {
            if (closed.get() || disconnected.get()) {
                return new SendResult.Closed();
            }
            if (queue.offer(item, POLL_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (disconnected.get()) {
                    // consumer left between the check and the offer
                    queue.remove(item);
                    return new SendResult.Closed();
                }
                return new SendResult.Ok(sent.incrementAndGet());
            }
        }
    }

    /**
     * Blocks until an item arrives. Returns {@code null} once the channel is closed and drained,
     * or after {@link #disconnect()}.
     */
    public E receive() throws InterruptedException {
        while (true) {
            if (disconnected.get()) {
                return null;
            }
            E item = queue.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
            if (item != null) {
                received.incrementAndGet();
                return item;
            }
            if (closed.get() && queue.isEmpty()) {
                return null;
            }
        }
    }

    public void disconnect() {
        disconnected.set(true);
        queue.clear();
    }

    public ChannelSnapshot snapshot() {
        return new ChannelSnapshot(queue.size(), capacity, sent.get(), received.get(), isClosed());
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
