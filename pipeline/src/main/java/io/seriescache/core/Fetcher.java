package io.seriescache.core;

/**
 * Fetcher turns one request into one payload by calling an upstream provider.
 * Returning {@code null} (or an empty payload) means "no new data".
 */
@FunctionalInterface
public interface Fetcher<I, O> {
    O fetch(I request) throws Exception;
}
