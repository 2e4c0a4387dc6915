package io.seriescache.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.function.Supplier;

/**
 * Thin view over a {@link MetricRegistry} that prefixes every name, so two runs sharing a registry
 * can be told apart.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) { this(registry, ""); }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(prefix + name); }
    public Meter meter(String name) { return registry.meter(prefix + name); }
    public Timer timer(String name) { return registry.timer(prefix + name); }

    /** Registers the gauge, replacing one left behind by a previous run under the same name. */
    public <T> void gauge(String name, Supplier<T> value) {
        String full = prefix + name;
        registry.remove(full);
        registry.register(full, (Gauge<T>) value::get);
    }
}
