package com.github.rudygunawan.memo.metrics;

import com.github.rudygunawan.memo.api.MemoCache;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for memo cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.max.size - Configured maximum number of entries
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions (size and expiry)
 *   <li>cache.loads - Number of computations, tagged result=success|failure
 *   <li>cache.load.duration - Total time spent computing
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.inflight - Asynchronous computations currently in flight
 * </ul>
 *
 * <p>Counters restart from zero after {@code clear()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MemoCache cache = MemoCacheBuilder.newBuilder()
 *     .maximumSize(1000)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "userCache");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor, must implement {@link CacheMetrics}
     * @param cacheName the name of the cache
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose metrics
     */
    public static MemoCache monitor(MeterRegistry registry, MemoCache cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor, must implement {@link CacheMetrics}
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose metrics
     */
    public static MemoCache monitor(MeterRegistry registry, MemoCache cache, String cacheName,
                                    Iterable<Tag> tags) {
        if (!(cache instanceof CacheMetrics)) {
            throw new IllegalArgumentException("cache does not expose metrics: " + cache.getClass().getName());
        }
        new MicrometerCacheMetrics((CacheMetrics) cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.max.size", cache, CacheMetrics::maximumSize)
                .tags(allTags)
                .description("Maximum number of entries the cache holds")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of successful computations")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of failed computations")
                .register(registry);

        FunctionTimer.builder("cache.load.duration", cache,
                        c -> c.loadSuccessCount() + c.loadFailureCount(),
                        CacheMetrics::totalLoadTimeNanos,
                        TimeUnit.NANOSECONDS)
                .tags(allTags)
                .description("Time spent computing cached values")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, CacheMetrics::hitRatio)
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.inflight", cache, CacheMetrics::inflightCount)
                .tags(allTags)
                .description("Asynchronous computations currently in flight")
                .register(registry);
    }
}
