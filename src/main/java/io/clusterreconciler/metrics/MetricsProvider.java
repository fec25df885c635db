package io.clusterreconciler.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/*
 * MetricsProvider creates and caches the counters, gauges and timers of a reconciler run.
 * Every meter carries the reconciler id tag.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String RECONCILER_TAG = "reconciler";
    private static final String PERCENTILE_TAG = "phi";
    private static final String BUCKET_TAG = "le";

    private final MeterRegistry registry;
    private final String reconcilerId;
    // one holder per name and tag set
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String reconcilerId) {
        this.registry = registry;
        this.reconcilerId = reconcilerId;
        log.info("MetricsProvider initialized for reconciler: {}", reconcilerId);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     *
     * @param name the name of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String[] tagArray = mapToTagArray(tags);
        String key = name + String.join(",", tagArray);
        return gauges.computeIfAbsent(key, ignored -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(tagArray).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    /**
     * One line per registered counter, gauge and timer, sorted by name then tags, e.g.
     * {@code artifacts_created{cluster=k3s} count=2}. Percentile and bucket gauges derived from timers are left out.
     *
     * @return the current values of every meter
     */
    public List<String> summary() {
        List<String> lines = new ArrayList<>();
        for (Meter meter : registry.getMeters()) {
            Meter.Id id = meter.getId();
            if (id.getTag(PERCENTILE_TAG) != null || id.getTag(BUCKET_TAG) != null) {
                continue;
            }
            String value;
            if (meter instanceof Counter) {
                value = "count=" + format(((Counter) meter).count());
            } else if (meter instanceof Timer) {
                Timer timer = (Timer) meter;
                value = "count=" + timer.count() + " total=" + format(timer.totalTime(TimeUnit.MILLISECONDS)) + "ms";
            } else if (meter instanceof Gauge) {
                value = "value=" + format(((Gauge) meter).value());
            } else {
                continue;
            }
            lines.add(id.getName() + describeTags(id) + " " + value);
        }
        lines.sort(null);
        return lines;
    }

    private static String describeTags(Meter.Id id) {
        String tags = id.getTags().stream()
            .filter(tag -> !RECONCILER_TAG.equals(tag.getKey()))
            .map(tag -> tag.getKey() + "=" + tag.getValue())
            .collect(Collectors.joining(","));
        return tags.isEmpty() ? "" : "{" + tags + "}";
    }

    private static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : String.format(Locale.ROOT, "%.1f", value);
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : new TreeMap<>(tags).entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = RECONCILER_TAG;
        tagArray[index] = reconcilerId;
        return tagArray;
    }
}
