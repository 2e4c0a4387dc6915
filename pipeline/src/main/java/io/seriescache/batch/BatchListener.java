package io.seriescache.batch;

/** Called synchronously on the accumulating thread, in registration order. */
@FunctionalInterface
public interface BatchListener {
    void onEvent(BatchEvent event);
}
