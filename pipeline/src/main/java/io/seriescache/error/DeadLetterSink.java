package io.seriescache.error;

public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, T item, Exception e);
    @Override default void close() {}
}
