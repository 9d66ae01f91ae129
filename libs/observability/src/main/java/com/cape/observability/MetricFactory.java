package com.cape.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Registers the policy agent's Micrometer meters under one naming and tagging scheme.
 * <p>
 * Every meter carries {@code service=<serviceName>} followed by the caller's extra tags. Micrometer
 * returns the already-registered meter when the same name and tags are requested again, so callers
 * may hold on to the meter or ask for it each time.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    /**
     * @param registry    the registry meters are added to (Prometheus in the running agent)
     * @param serviceName value of the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * Counter named {@code name}, e.g. {@code labels.objects.created}.
     *
     * @param tags extra tags as alternating keys and values
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(withServiceTag(tags))
                .register(registry);
    }

    /**
     * Timer named {@code name}, e.g. {@code labels.effective.duration}.
     *
     * @param tags extra tags as alternating keys and values
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(withServiceTag(tags))
                .register(registry);
    }

    private Tags withServiceTag(String... extra) {
        if (extra.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs");
        }
        return extra.length == 0 ? serviceTags : serviceTags.and(extra);
    }
}
