package io.klinesync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) {
        this(registry, "");
    }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
    }

    public Counter counter(String name) { return registry.counter(prefix + name); }
    public Meter meter(String name) { return registry.meter(prefix + name); }
    public Timer timer(String name) { return registry.timer(prefix + name); }
}
