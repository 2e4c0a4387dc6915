package io.seriescache.batch;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Hands events of one type over to another thread: register it on an accumulator, then
 * {@link #poll(Duration)} from the consumer side.
 */
public class QueueingBatchListener implements BatchListener {
    private final EventType type;
    private final BlockingQueue<BatchData> queue = new LinkedBlockingQueue<>();

    public QueueingBatchListener(EventType type) { this.type = type; }

    @Override
    public void onEvent(BatchEvent event) {
        if (event.type() == type) queue.add(event.data());
    }

    /** @return the next batch, or null if none arrived in time */
    public BatchData poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() { return queue.size(); }
}
