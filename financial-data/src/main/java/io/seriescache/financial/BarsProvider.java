package io.seriescache.financial;

import io.seriescache.core.Fetcher;

/** Upstream source of bars: one table per request, empty when nothing is new. */
public interface BarsProvider extends Fetcher<FetchRequest, BarTable> {
}
